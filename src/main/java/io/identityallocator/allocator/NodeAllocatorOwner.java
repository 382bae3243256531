package io.identityallocator.allocator;

import lombok.extern.slf4j.Slf4j;

/**
 * Standalone owner used when the allocator runs as a service: logs policy triggers and
 * uses the node name as key suffix.
 */
@Slf4j
public class NodeAllocatorOwner implements IdentityAllocatorOwner {

    private final String nodeName;

    public NodeAllocatorOwner(String nodeName) {
        this.nodeName = nodeName;
    }

    @Override
    public void triggerPolicyUpdates(boolean force, String reason) {
        log.info("Policy update triggered (force={}): {}", force, reason);
    }

    @Override
    public String getNodeSuffix() {
        return nodeName;
    }
}
