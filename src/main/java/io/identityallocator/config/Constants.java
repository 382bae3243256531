package io.identityallocator.config;

/**
 * Application constants.
 */
public final class Constants {
    
    private Constants() {
        // Utility class
    }
    
    // Default configuration values
    public static final String DEFAULT_ETCD_ENDPOINT = "http://localhost:2379";
    public static final String DEFAULT_CLUSTER_NAME = "default";
    public static final String DEFAULT_BASE_PATH = "/identity-allocator/state/identities/v1";
    public static final long DEFAULT_KEEPALIVE_SECONDS = 300L;
    public static final long DEFAULT_LEASE_TTL_SECONDS = 900L;
    
    // Numeric identity space
    public static final long MINIMAL_NUMERIC_IDENTITY = 256L;
    public static final long MINIMAL_ALLOCATION_IDENTITY = MINIMAL_NUMERIC_IDENTITY;
    public static final long MAXIMUM_ALLOCATION_IDENTITY = 65535L;
    public static final int CLUSTER_ID_SHIFT = 16;
    public static final int CLUSTER_ID_MAX = 255;
    
    // Node-local identities carry this bit and never leave the node
    public static final long LOCAL_IDENTITY_FLAG = 1L << 24;
    public static final long DEFAULT_LOCAL_MIN_ID = 1L;
    public static final long DEFAULT_LOCAL_MAX_ID = 0xFFFFFFL;
    
    // Allocator wiring
    public static final int EVENT_QUEUE_CAPACITY = 1024;
    public static final String KEEPALIVE_TASK_PREFIX = "sync-identity";
    
    // etcd path segments
    public static final String PATH_DELIMITER = "/";
    public static final String PATH_ID = "id";
    public static final String PATH_VALUE = "value";
    public static final String PATH_LOCKS = "locks";
    
    // Environment variables
    public static final String ENV_NODE_NAME = "NODE_NAME";
    public static final String ENV_CONFIG_FILE = "IDENTITY_ALLOCATOR_CONFIG_FILE";
    
    // Metric names
    public static final String METRIC_ALLOCATIONS = "identity.allocations";
    public static final String METRIC_RELEASES = "identity.releases";
    public static final String METRIC_RELEASE_FAILURES = "identity.release.failures";
    public static final String METRIC_GLOBAL_REFERENCES = "identity.global.references";
    public static final String METRIC_ALLOCATE_LATENCY = "identity.allocate.latency";
    
    // Metric tags
    public static final String TAG_SCOPE = "scope";
    public static final String TAG_OUTCOME = "outcome";
    public static final String OUTCOME_NEW = "new";
    public static final String OUTCOME_REUSED = "reused";
    public static final String SCOPE_RESERVED = "reserved";
    public static final String SCOPE_LOCAL = "local";
    public static final String SCOPE_GLOBAL = "global";
}
