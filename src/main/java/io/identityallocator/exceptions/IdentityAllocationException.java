package io.identityallocator.exceptions;

/**
 * Base exception for identity allocation failures returned to callers.
 */
public class IdentityAllocationException extends Exception {

    public IdentityAllocationException(String message) {
        super(message);
    }

    public IdentityAllocationException(String message, Throwable cause) {
        super(message, cause);
    }
}
