package com.ghlinker.tasks;

import com.ghlinker.platform.FailureKind;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * A unit of background work started by {@link SupervisedTaskRunner}.
 */
public final class TaskHandle<T> {

    private final String label;
    private final long id;
    private final Set<FailureKind> suppressed;
    private final CompletableFuture<T> completion;

    TaskHandle(String label, long id, Set<FailureKind> suppressed, CompletableFuture<T> completion) {
        this.label = label;
        this.id = id;
        this.suppressed = suppressed;
        this.completion = completion;
    }

    public String label() { return label; }

    public long id() { return id; }

    public Set<FailureKind> suppressed() { return suppressed; }

    /**
     * Completion of the work. Failures are already reported by the runner;
     * callers only need this to wait for or chain on the result.
     */
    public CompletableFuture<T> completion() { return completion; }

    public boolean isDone() {
        return completion.isDone();
    }

    public boolean cancel() {
        return completion.cancel(false);
    }

    @Override
    public String toString() {
        return label + " " + id;
    }
}
