package io.identityallocator.labels;

/**
 * Well-known label sources.
 */
public final class LabelSource {

    private LabelSource() {
        // Utility class
    }

    /** Labels without an explicit source. */
    public static final String UNSPEC = "unspec";
    /** Labels only the allocator itself hands out, e.g. reserved:host. */
    public static final String RESERVED = "reserved";
    /** Labels derived from Kubernetes pod and namespace metadata. */
    public static final String K8S = "k8s";
    /** Labels derived from container runtime metadata. */
    public static final String CONTAINER = "container";
    /** Labels describing a CIDR prefix; identities for these stay node-local. */
    public static final String CIDR = "cidr";
}
