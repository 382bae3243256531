package io.identityallocator.allocator;

/**
 * Component the allocator notifies about identity changes and asks for node-specific
 * naming. Typically the policy engine of the node.
 */
public interface IdentityAllocatorOwner {

    /**
     * Called after a batch of identity changes was observed.
     *
     * @param force  recompute even if nothing appears to have changed
     * @param reason human readable trigger, used for logging
     */
    void triggerPolicyUpdates(boolean force, String reason);

    /**
     * Suffix that distinguishes this node's keys in the distributed backend.
     */
    String getNodeSuffix();
}
