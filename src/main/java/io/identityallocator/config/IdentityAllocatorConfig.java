package io.identityallocator.config;

import io.identityallocator.util.EnvironmentUtils;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;

import static io.identityallocator.config.Constants.*;

/**
 * Configuration for the identity allocator.
 * Loads configuration from application.yml with fallbacks to constants.
 */
@Slf4j
@Getter
public class IdentityAllocatorConfig {

    private final String[] etcdEndpoints;
    private final String nodeName;
    private final String clusterName;
    private final int clusterId;
    private final String basePath;
    private final long minId;
    private final long maxId;
    private final long localMinId;
    private final long localMaxId;
    private final Duration keepAliveInterval;
    private final long leaseTtlSeconds;

    // Default classpath location
    private static final String DEFAULT_CONFIG_FILE_CLASSPATH = "application.yml";

    public IdentityAllocatorConfig() {
        this(null);
    }

    /**
     * Build the configuration from an already parsed model. A null model means
     * "load application.yml".
     */
    public IdentityAllocatorConfig(ConfigModel model) {
        ConfigModel config = model != null ? model : loadYamlConfig();
        IdentitySection identity = config.getIdentity() != null ? config.getIdentity() : new IdentitySection();

        this.etcdEndpoints = parseEndpoints(config);
        this.nodeName = identity.getNodeName() != null && !identity.getNodeName().isBlank()
            ? identity.getNodeName()
            : EnvironmentUtils.getNodeName(ENV_NODE_NAME);
        this.clusterName = orDefault(identity.getClusterName(), DEFAULT_CLUSTER_NAME);
        this.clusterId = parseClusterId(identity);
        this.basePath = orDefault(identity.getBasePath(), DEFAULT_BASE_PATH);
        this.minId = identity.getMinId() != null ? identity.getMinId() : MINIMAL_ALLOCATION_IDENTITY;
        this.maxId = identity.getMaxId() != null ? identity.getMaxId() : MAXIMUM_ALLOCATION_IDENTITY;
        this.localMinId = identity.getLocalMinId() != null ? identity.getLocalMinId() : DEFAULT_LOCAL_MIN_ID;
        this.localMaxId = identity.getLocalMaxId() != null ? identity.getLocalMaxId() : DEFAULT_LOCAL_MAX_ID;
        this.keepAliveInterval = Duration.ofSeconds(identity.getKeepaliveSeconds() != null
            ? identity.getKeepaliveSeconds() : DEFAULT_KEEPALIVE_SECONDS);
        this.leaseTtlSeconds = identity.getLeaseTtlSeconds() != null
            ? identity.getLeaseTtlSeconds() : DEFAULT_LEASE_TTL_SECONDS;

        if (minId > maxId) {
            throw new IllegalArgumentException("identity.minId (" + minId + ") must not exceed identity.maxId (" + maxId + ")");
        }
        if (localMinId > localMaxId) {
            throw new IllegalArgumentException("identity.localMinId must not exceed identity.localMaxId");
        }

        log.info("Loaded identity allocator config - etcd endpoints: {}, cluster: {} (id {}), node: {}, range: [{}, {}]",
                String.join(", ", etcdEndpoints), clusterName, clusterId, nodeName, minId, maxId);
    }

    /**
     * Cluster prefix OR'ed into every globally allocated identity.
     */
    public long getPrefixMask() {
        return ((long) clusterId) << CLUSTER_ID_SHIFT;
    }

    private ConfigModel loadYamlConfig() {
        Constructor constructor = new Constructor(ConfigModel.class, new LoaderOptions());
        // application.yml is shared with Spring, skip the keys only Spring reads
        constructor.getPropertyUtils().setSkipMissingProperties(true);
        Yaml yaml = new Yaml(constructor);
        InputStream inputStream = null;
        String loadedFrom = "";

        // 1. Check environment variable for external config file path
        String externalConfigPath = System.getenv(ENV_CONFIG_FILE);
        if (externalConfigPath != null && !externalConfigPath.trim().isEmpty()) {
            log.info("External config file path specified via {}: {}", ENV_CONFIG_FILE, externalConfigPath);
            try {
                if (Files.exists(Paths.get(externalConfigPath))) {
                    inputStream = new FileInputStream(externalConfigPath);
                    loadedFrom = "external file (" + externalConfigPath + ")";
                } else {
                    log.warn("External config file specified but not found at path: {}. Falling back.", externalConfigPath);
                }
            } catch (IOException e) {
                log.warn("Error opening external config file {}: {}. Falling back.", externalConfigPath, e.getMessage());
            } catch (SecurityException se) {
                log.warn("Permission denied accessing external config file {}: {}. Falling back.", externalConfigPath, se.getMessage());
            }
        } else {
            log.debug("{} environment variable not set, looking for config on classpath.", ENV_CONFIG_FILE);
        }

        // 2. If external file wasn't loaded, try classpath
        if (inputStream == null) {
            log.info("Loading config from classpath: {}", DEFAULT_CONFIG_FILE_CLASSPATH);
            inputStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_CONFIG_FILE_CLASSPATH);
            loadedFrom = "classpath (" + DEFAULT_CONFIG_FILE_CLASSPATH + ")";
            if (inputStream == null) {
                log.warn("Config file not found on classpath: {}. Using defaults.", DEFAULT_CONFIG_FILE_CLASSPATH);
                return new ConfigModel();
            }
        }

        // 3. Load from the determined InputStream
        try (InputStream in = inputStream) {
            ConfigModel config = yaml.load(in);
            log.info("Successfully loaded configuration from {}", loadedFrom);
            return config != null ? config : new ConfigModel();
        } catch (Exception e) {
            log.warn("Failed to parse configuration from {}: {}. Using defaults.", loadedFrom, e.getMessage());
            return new ConfigModel();
        }
    }

    private String[] parseEndpoints(ConfigModel config) {
        if (config.getEtcd() != null && config.getEtcd().getEndpoints() != null) {
            var endpoints = config.getEtcd().getEndpoints();
            if (!endpoints.isEmpty()) {
                return endpoints.toArray(new String[0]);
            }
        }
        return new String[]{DEFAULT_ETCD_ENDPOINT};
    }

    private int parseClusterId(IdentitySection identity) {
        int id = identity.getClusterId() != null ? identity.getClusterId() : 0;
        if (id < 0 || id > CLUSTER_ID_MAX) {
            throw new IllegalArgumentException("identity.clusterId must be within [0, " + CLUSTER_ID_MAX + "], got " + id);
        }
        return id;
    }

    private static String orDefault(String value, String defaultValue) {
        return value != null && !value.isBlank() ? value : defaultValue;
    }

    /**
     * Configuration model for the application.yml file.
     */
    @Data
    public static class ConfigModel {
        private Etcd etcd;
        private IdentitySection identity;
    }

    @Data
    public static class Etcd {
        private List<String> endpoints;
    }

    @Data
    public static class IdentitySection {
        private String nodeName;
        private String clusterName;
        private Integer clusterId;
        private String basePath;
        private Long minId;
        private Long maxId;
        private Long localMinId;
        private Long localMaxId;
        private Long keepaliveSeconds;
        private Long leaseTtlSeconds;
    }
}
