package io.identityallocator.identity;

import lombok.Value;

/**
 * Outcome of resolving a label set: the identity and whether this call created it.
 */
@Value
public class AllocationResult {
    Identity identity;
    boolean isNew;
}
