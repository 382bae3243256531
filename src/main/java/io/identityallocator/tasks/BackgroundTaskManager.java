package io.identityallocator.tasks;

import io.identityallocator.context.OperationContext;
import io.identityallocator.exceptions.OperationCancelledException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs named background tasks, each on its own thread, repeating the task body with a
 * fixed pause between runs. Removal cancels the task and waits for its thread to finish,
 * so once {@link #removeTaskAndWait(String)} returns the body will not run again.
 */
@Slf4j
public class BackgroundTaskManager {

    private final String name;
    private final ExecutorService executor;
    private final ConcurrentMap<String, ManagedTask> tasks = new ConcurrentHashMap<>();

    public BackgroundTaskManager(String name) {
        this.name = name;
        this.executor = Executors.newCachedThreadPool(daemonThreads(name));
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Start {@code taskName}, or replace the body and interval of the running task of that
     * name. A replaced body takes effect from the next run.
     */
    public void updateOrCreateTask(String taskName, TaskFunction function, Duration interval) {
        tasks.compute(taskName, (key, existing) -> {
            if (existing != null) {
                log.debug("[{}] Updating task {}", name, taskName);
                existing.function = function;
                existing.interval = interval;
                return existing;
            }
            ManagedTask task = new ManagedTask(taskName, function, interval);
            task.future = executor.submit(task::loop);
            log.debug("[{}] Started task {}", name, taskName);
            return task;
        });
    }

    /**
     * Cancel {@code taskName} and block until its current run, if any, has returned.
     *
     * @return true if the task existed
     */
    public boolean removeTaskAndWait(String taskName) {
        ManagedTask task = tasks.remove(taskName);
        if (task == null) {
            return false;
        }
        stopAndWait(task);
        log.debug("[{}] Removed task {}", name, taskName);
        return true;
    }

    public void removeAllTasksAndWait() {
        for (String taskName : Set.copyOf(tasks.keySet())) {
            removeTaskAndWait(taskName);
        }
    }

    private void stopAndWait(ManagedTask task) {
        task.ctx.cancel();
        try {
            task.future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[{}] Interrupted while waiting for task {} to stop", name, task.name);
        } catch (ExecutionException | CancellationException e) {
            log.warn("[{}] Task {} terminated abnormally: {}", name, task.name, e.getMessage());
        }
    }

    public Set<String> getTaskNames() {
        return new TreeSet<>(tasks.keySet());
    }

    public Optional<TaskStatus> getStatus(String taskName) {
        ManagedTask task = tasks.get(taskName);
        return task != null ? Optional.of(task.snapshot()) : Optional.empty();
    }

    /**
     * Remove every task and release the worker threads.
     */
    public void shutdown() {
        removeAllTasksAndWait();
        executor.shutdown();
        log.info("[{}] Task manager stopped", name);
    }

    private final class ManagedTask {
        private final String name;
        private final OperationContext ctx = OperationContext.background();
        private volatile TaskFunction function;
        private volatile Duration interval;
        private Future<?> future;

        private long successCount;
        private long failureCount;
        private long consecutiveFailures;
        private String lastError;
        private Instant lastSuccess;

        private ManagedTask(String name, TaskFunction function, Duration interval) {
            this.name = name;
            this.function = function;
            this.interval = interval;
        }

        private void loop() {
            while (!ctx.isDone()) {
                runOnce();
                try {
                    ctx.sleep(interval);
                } catch (OperationCancelledException e) {
                    return;
                }
            }
        }

        private void runOnce() {
            try {
                function.run(ctx);
                recordSuccess();
            } catch (OperationCancelledException e) {
                log.debug("[{}] Task {} cancelled: {}", BackgroundTaskManager.this.name, name, e.getMessage());
            } catch (Exception e) {
                recordFailure(e);
                log.warn("[{}] Task {} failed: {}", BackgroundTaskManager.this.name, name, e.getMessage());
            }
        }

        private synchronized void recordSuccess() {
            successCount++;
            consecutiveFailures = 0;
            lastError = null;
            lastSuccess = Instant.now();
        }

        private synchronized void recordFailure(Exception e) {
            failureCount++;
            consecutiveFailures++;
            lastError = e.getMessage();
        }

        private synchronized TaskStatus snapshot() {
            return new TaskStatus(name, successCount, failureCount, consecutiveFailures, lastError, lastSuccess);
        }
    }
}
