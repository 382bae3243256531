package io.identityallocator.exceptions;

/**
 * Thrown when the caller's operation context was cancelled or its deadline elapsed
 * before the operation could complete.
 */
public class OperationCancelledException extends IdentityAllocationException {

    public OperationCancelledException(String message) {
        super(message);
    }

    public OperationCancelledException(String message, Throwable cause) {
        super(message, cause);
    }
}
