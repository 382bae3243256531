package io.identityallocator.exceptions;

/**
 * Lifecycle contract violation: init() twice without close(), or close() without init().
 * Indicates a caller bug; embedders decide whether to abort the process.
 */
public class InvalidAllocatorStateException extends IllegalStateException {

    public InvalidAllocatorStateException(String message) {
        super(message);
    }

    public InvalidAllocatorStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
