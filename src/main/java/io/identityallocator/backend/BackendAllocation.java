package io.identityallocator.backend;

import lombok.Value;

/**
 * Numeric id the backend resolved for a key, and whether it was newly created.
 */
@Value
public class BackendAllocation {
    long id;
    boolean isNew;
}
