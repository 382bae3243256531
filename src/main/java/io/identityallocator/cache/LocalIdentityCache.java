package io.identityallocator.cache;

import io.identityallocator.exceptions.IdentityAllocationException;
import io.identityallocator.identity.AllocationResult;
import io.identityallocator.identity.Identity;
import io.identityallocator.labels.Labels;

/**
 * Node-local store for identities whose label sets never need cluster-wide agreement.
 */
public interface LocalIdentityCache {

    /**
     * Return the identity for {@code labels}, creating one if needed, and take a reference.
     */
    AllocationResult lookupOrCreate(Labels labels) throws IdentityAllocationException;

    /**
     * Drop one reference.
     *
     * @return true iff this was the last reference and the identity was removed
     */
    boolean release(Identity identity);

    Identity lookup(Labels labels);

    Identity lookupById(long id);

    int size();
}
