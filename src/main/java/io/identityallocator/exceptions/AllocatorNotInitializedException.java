package io.identityallocator.exceptions;

/**
 * Thrown when an operation needs the distributed backend but no allocator is live,
 * typically because a close() raced the call.
 */
public class AllocatorNotInitializedException extends IdentityAllocationException {

    public AllocatorNotInitializedException() {
        super("allocator not initialized");
    }
}
