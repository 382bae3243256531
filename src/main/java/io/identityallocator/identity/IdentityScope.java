package io.identityallocator.identity;

import io.identityallocator.labels.Label;
import io.identityallocator.labels.LabelSource;
import io.identityallocator.labels.Labels;

/**
 * Decides whether a label set needs a cluster-wide identity.
 */
public final class IdentityScope {

    private IdentityScope() {
        // Utility class
    }

    /**
     * A label set needs a global identity unless every label comes from a node-local
     * source (CIDR prefixes and reserved labels). An empty set is global.
     */
    public static boolean requiresGlobalIdentity(Labels labels) {
        if (labels.isEmpty()) {
            return true;
        }
        for (Label label : labels.toList()) {
            if (!label.hasSource(LabelSource.CIDR) && !label.hasSource(LabelSource.RESERVED)) {
                return true;
            }
        }
        return false;
    }
}
