package io.identityallocator.tasks;

import lombok.Value;

import java.time.Instant;

/**
 * Point-in-time view of a background task's run history.
 */
@Value
public class TaskStatus {
    String name;
    long successCount;
    long failureCount;
    long consecutiveFailures;
    String lastError;
    Instant lastSuccess;
}
