package com.repairline.engine.concurrent;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A call submitted to an executor whose end can be observed even after it was cancelled.
 *
 * Cancelling a plain {@link Future} only interrupts the thread; the caller stops waiting
 * while the call may go on running. {@link #outcome()} here completes only once the call
 * has returned or thrown, or when it was cancelled before it started.
 */
public final class TrackedCall<T> {

    private final AtomicBoolean claimed = new AtomicBoolean(false);
    private final CompletableFuture<T> outcome = new CompletableFuture<>();
    private final Future<?> future;

    private TrackedCall(ExecutorService executor, Callable<T> body) {
        this.future = executor.submit(() -> {
            if (!claimed.compareAndSet(false, true)) {
                return;
            }
            try {
                outcome.complete(body.call());
            } catch (Throwable t) {
                outcome.completeExceptionally(t);
            }
        });
    }

    public static <T> TrackedCall<T> submit(ExecutorService executor, Callable<T> body) {
        return new TrackedCall<>(executor, body);
    }

    /**
     * Completes with the call's result or exception once it is no longer running.
     */
    public CompletableFuture<T> outcome() {
        return outcome;
    }

    /**
     * Wait for the result.
     *
     * @throws ExecutionException wrapping whatever the call threw
     */
    public T get(Duration timeout) throws ExecutionException, InterruptedException, TimeoutException {
        return outcome.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Interrupt the call. It keeps running if it ignores the interrupt.
     */
    public void cancel() {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            outcome.completeExceptionally(new CancellationException("Cancelled before it started"));
        }
    }

    public boolean hasExited() {
        return outcome.isDone();
    }

    /**
     * Whether the call ran to completion and returned a value.
     */
    public boolean hasReturned() {
        return outcome.isDone() && !outcome.isCompletedExceptionally();
    }

    /**
     * Wait up to {@code timeout} for the call to stop running. Interrupts received while
     * waiting are deferred: the interrupt status is set again before this returns.
     *
     * @return true if the call has exited
     */
    public boolean awaitExit(Duration timeout) {
        boolean interrupted = Thread.interrupted();
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (!outcome.isDone()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return false;
                }
                try {
                    outcome.get(remaining, TimeUnit.NANOSECONDS);
                } catch (InterruptedException e) {
                    interrupted = true;
                } catch (ExecutionException | CancellationException | TimeoutException e) {
                    // The loop condition decides.
                    continue;
                }
            }
            return true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
