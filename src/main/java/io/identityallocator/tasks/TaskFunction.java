package io.identityallocator.tasks;

import io.identityallocator.context.OperationContext;

/**
 * Body of a background task. Invoked repeatedly until the task is removed; the context
 * fires when that happens.
 */
@FunctionalInterface
public interface TaskFunction {

    void run(OperationContext ctx) throws Exception;
}
