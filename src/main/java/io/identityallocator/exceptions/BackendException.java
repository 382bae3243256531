package io.identityallocator.exceptions;

/**
 * Failure reported by the distributed allocator backend.
 */
public class BackendException extends IdentityAllocationException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
