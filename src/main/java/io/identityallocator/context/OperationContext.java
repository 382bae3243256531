package io.identityallocator.context;

import io.identityallocator.exceptions.BackendException;
import io.identityallocator.exceptions.OperationCancelledException;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cancellation and deadline signal handed to every blocking allocator call.
 *
 * A context fires exactly once, either through {@link #cancel()} or when its deadline
 * elapses. Blocking helpers ({@link #await(CompletableFuture)}, {@link #sleep(Duration)})
 * return as soon as it fires, with an {@link OperationCancelledException}.
 */
public final class OperationContext {

    private static final String CANCELLED = "operation cancelled";
    private static final String DEADLINE_EXCEEDED = "deadline exceeded";

    private final CompletableFuture<String> done = new CompletableFuture<>();
    private final Instant deadline;

    private OperationContext(Instant deadline) {
        this.deadline = deadline;
        if (deadline != null) {
            long millis = Math.max(0, Duration.between(Instant.now(), deadline).toMillis());
            done.completeOnTimeout(DEADLINE_EXCEEDED, millis, TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Context without deadline; fires only when cancelled.
     */
    public static OperationContext background() {
        return new OperationContext(null);
    }

    public static OperationContext withTimeout(Duration timeout) {
        return new OperationContext(Instant.now().plus(timeout));
    }

    /**
     * Derived context that fires when this one fires, with this one's reason. Cancelling
     * the child leaves this context untouched.
     */
    public OperationContext child() {
        return derive(deadline);
    }

    /**
     * Derived context that additionally fires after {@code timeout}. The child's deadline
     * never extends past this context's own deadline.
     */
    public OperationContext child(Duration timeout) {
        Instant childDeadline = Instant.now().plus(timeout);
        if (deadline != null && deadline.isBefore(childDeadline)) {
            childDeadline = deadline;
        }
        return derive(childDeadline);
    }

    private OperationContext derive(Instant childDeadline) {
        OperationContext child = new OperationContext(childDeadline);
        done.thenAccept(child.done::complete);
        return child;
    }

    public void cancel() {
        done.complete(CANCELLED);
    }

    public boolean isDone() {
        return done.isDone();
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Why the context fired, or null while it is still live.
     */
    public String reason() {
        return done.getNow(null);
    }

    public void throwIfDone() throws OperationCancelledException {
        if (done.isDone()) {
            throw new OperationCancelledException(reason());
        }
    }

    /**
     * Wait for {@code future} unless this context fires first.
     *
     * @return the future's value
     * @throws OperationCancelledException if the context fired before the future completed
     * @throws BackendException if the future completed exceptionally
     */
    public <T> T await(CompletableFuture<T> future) throws OperationCancelledException, BackendException {
        if (!future.isDone()) {
            try {
                CompletableFuture.anyOf(future, done).get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException("interrupted while waiting", e);
            } catch (ExecutionException | CancellationException e) {
                // the awaited future failed, unwrapped below
            }
        }
        if (!future.isDone()) {
            throw new OperationCancelledException(reason());
        }
        try {
            return future.join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof BackendException) {
                throw (BackendException) cause;
            }
            if (cause instanceof OperationCancelledException) {
                throw (OperationCancelledException) cause;
            }
            if (cause instanceof TimeoutException) {
                throw new BackendException("backend operation timed out", cause);
            }
            throw new BackendException(String.valueOf(cause.getMessage()), cause);
        }
    }

    /**
     * Sleep for {@code duration} or until the context fires.
     *
     * @throws OperationCancelledException if the context fired during the sleep
     */
    public void sleep(Duration duration) throws OperationCancelledException {
        try {
            done.get(duration.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("interrupted while sleeping", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("context signal completed exceptionally", e);
        }
        throw new OperationCancelledException(reason());
    }
}
