package com.ghlinker.tasks;

import com.ghlinker.observability.BotMetrics;
import com.ghlinker.platform.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Starts fire-and-forget work and reports its failure exactly once.
 *
 * <p>The caller has usually returned by the time the work fails, so failures are
 * never rethrown. Cancellation and failures whose {@link FailureKind} the caller
 * listed as suppressed are expected outcomes; everything else is logged at
 * ERROR with the task's label and stack trace.
 */
public class SupervisedTaskRunner {

    private static final Logger log = LoggerFactory.getLogger(SupervisedTaskRunner.class);
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final Executor executor;
    private final BotMetrics metrics;

    public SupervisedTaskRunner(Executor executor) {
        this(executor, new BotMetrics());
    }

    public SupervisedTaskRunner(Executor executor, BotMetrics metrics) {
        this.executor = executor;
        this.metrics = metrics;
    }

    public <T> TaskHandle<T> spawn(Supplier<? extends CompletionStage<T>> work,
                                   Set<FailureKind> suppressed, String label) {
        return spawn(work, suppressed, label, executor);
    }

    public <T> TaskHandle<T> spawn(Supplier<? extends CompletionStage<T>> work,
                                   Set<FailureKind> suppressed, String label, Executor executor) {
        var completion = new CompletableFuture<T>();
        var id = SEQUENCE.incrementAndGet();
        var handle = new TaskHandle<>(label != null ? label : "task-" + id, id, Set.copyOf(suppressed), completion);
        completion.whenComplete((result, error) -> report(handle, error));
        try {
            executor.execute(() -> start(work, completion));
        } catch (RejectedExecutionException e) {
            completion.completeExceptionally(e);
        }
        return handle;
    }

    /**
     * Blocking variant: {@code work} occupies an executor thread until it returns.
     */
    public <T> TaskHandle<T> submit(Callable<T> work, Set<FailureKind> suppressed, String label) {
        return spawn(() -> {
            try {
                return CompletableFuture.completedFuture(work.call());
            } catch (Exception e) {
                return CompletableFuture.failedFuture(e);
            }
        }, suppressed, label);
    }

    private static <T> void start(Supplier<? extends CompletionStage<T>> work, CompletableFuture<T> completion) {
        // cancelled before the executor got to it
        if (completion.isDone()) return;
        try {
            work.get().whenComplete((result, error) -> {
                if (error != null) {
                    completion.completeExceptionally(error);
                } else {
                    completion.complete(result);
                }
            });
        } catch (RuntimeException e) {
            completion.completeExceptionally(e);
        }
    }

    private void report(TaskHandle<?> task, Throwable error) {
        if (error == null) return;
        var cause = FailureKind.unwrap(error);
        if (cause instanceof CancellationException) {
            log.debug("Task {} cancelled", task);
            return;
        }
        var kind = FailureKind.of(cause);
        if (task.suppressed().contains(kind)) {
            metrics.tasksSuppressed().increment();
            log.debug("Task {} failed with suppressed {}: {}", task, kind, cause.getMessage());
            return;
        }
        metrics.tasksFailed().increment();
        log.error("Error in task {} {}!", task.label(), task.id(), cause);
    }
}
