package io.identityallocator.backend.etcd;

import io.identityallocator.labels.KeyEncoder;

import static io.identityallocator.config.Constants.*;

/**
 * etcd key layout of one identity key space.
 *
 * <pre>
 * &lt;base&gt;/id/&lt;id&gt;                       master key, value is the canonical label key
 * &lt;base&gt;/value/&lt;encoded-key&gt;/&lt;suffix&gt;  per-node key, value is the id, bound to the node lease
 * &lt;base&gt;/locks/&lt;encoded-key&gt;            allocation lock
 * </pre>
 */
public class EtcdKeyLayout {

    private final String basePath;

    public EtcdKeyLayout(String basePath) {
        String trimmed = basePath.endsWith(PATH_DELIMITER)
            ? basePath.substring(0, basePath.length() - 1)
            : basePath;
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("base path must not be empty");
        }
        this.basePath = trimmed;
    }

    public String getBasePath() {
        return basePath;
    }

    // =================================================================
    // MASTER KEYS
    // =================================================================

    /**
     * Pattern: &lt;base&gt;/id/
     */
    public String getIdPrefix() {
        return basePath + PATH_DELIMITER + PATH_ID + PATH_DELIMITER;
    }

    /**
     * Pattern: &lt;base&gt;/id/&lt;id&gt;
     */
    public String getIdPath(long id) {
        return getIdPrefix() + id;
    }

    /**
     * Numeric id of a master key path, or -1 if the path is not one.
     */
    public long parseIdPath(String path) {
        String prefix = getIdPrefix();
        if (!path.startsWith(prefix)) {
            return -1;
        }
        try {
            return Long.parseLong(path.substring(prefix.length()));
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    // =================================================================
    // PER-NODE KEYS
    // =================================================================

    /**
     * Pattern: &lt;base&gt;/value/&lt;encoded-key&gt;/
     */
    public String getValuePrefix(String canonicalKey) {
        return basePath + PATH_DELIMITER + PATH_VALUE + PATH_DELIMITER
            + KeyEncoder.encode(canonicalKey) + PATH_DELIMITER;
    }

    /**
     * Pattern: &lt;base&gt;/value/&lt;encoded-key&gt;/&lt;suffix&gt;
     */
    public String getValuePath(String canonicalKey, String suffix) {
        return getValuePrefix(canonicalKey) + suffix;
    }

    // =================================================================
    // LOCKS
    // =================================================================

    /**
     * Pattern: &lt;base&gt;/locks/&lt;encoded-key&gt;
     */
    public String getLockPath(String canonicalKey) {
        return basePath + PATH_DELIMITER + PATH_LOCKS + PATH_DELIMITER + KeyEncoder.encode(canonicalKey);
    }
}
