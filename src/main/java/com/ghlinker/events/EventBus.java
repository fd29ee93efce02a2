package com.ghlinker.events;

import com.ghlinker.shared.model.GatewayEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Delivers gateway events to waiters on a single dispatcher thread.
 *
 * <p>Events reach the waiting predicates in the order they were published. A waiter
 * resolves once: with the first event its predicate accepts, with a
 * {@link TimeoutException} when its deadline passes, or exceptionally when its
 * predicate throws. An expiring deadline is queued behind events that were already
 * published, so an event arriving at the deadline instant still wins.
 */
public class EventBus implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ScheduledThreadPoolExecutor dispatcher;
    private final List<Waiter> waiters = new CopyOnWriteArrayList<>();

    public EventBus() {
        this.dispatcher = new ScheduledThreadPoolExecutor(1, r -> {
            var t = new Thread(r, "event-dispatch");
            t.setDaemon(true);
            return t;
        });
        // resolved waiters must not stay reachable from the timer queue
        dispatcher.setRemoveOnCancelPolicy(true);
    }

    public void publish(GatewayEvent event) {
        try {
            dispatcher.execute(() -> dispatch(event));
        } catch (RejectedExecutionException e) {
            log.debug("Event bus closed, dropping {}", event);
        }
    }

    /**
     * Waits for the first published event matching {@code check}.
     *
     * @param timeout maximum wait, or {@code null} to wait without a deadline
     * @return the matching event; completes with {@link TimeoutException} on expiry.
     *         Cancelling the future stops the wait.
     */
    public CompletableFuture<GatewayEvent> waitFor(Predicate<GatewayEvent> check, Duration timeout) {
        var waiter = new Waiter(check);
        waiters.add(waiter);
        waiter.future.whenComplete((event, error) -> {
            if (waiter.future.isCancelled()) waiters.remove(waiter);
            waiter.cancelDeadline();
        });
        try {
            if (timeout != null) {
                waiter.deadline = dispatcher.schedule(() -> runOnDispatcher(() -> expire(waiter)),
                        Math.max(0, timeout.toNanos()), TimeUnit.NANOSECONDS);
                if (waiter.future.isDone()) waiter.cancelDeadline();
            }
        } catch (RejectedExecutionException e) {
            log.debug("Event bus closed, cancelling wait");
            waiter.future.cancel(false);
        }
        return waiter.future;
    }

    private void dispatch(GatewayEvent event) {
        if (waiters.isEmpty()) return;
        for (var waiter : waiters) {
            if (waiter.future.isDone()) {
                waiters.remove(waiter);
                continue;
            }
            boolean matched;
            try {
                matched = waiter.check.test(event);
            } catch (RuntimeException e) {
                waiters.remove(waiter);
                waiter.future.completeExceptionally(e);
                continue;
            }
            if (matched) {
                waiters.remove(waiter);
                waiter.future.complete(event);
            }
        }
    }

    private void expire(Waiter waiter) {
        if (waiters.remove(waiter)) {
            waiter.future.completeExceptionally(new TimeoutException("No matching event before deadline"));
        }
    }

    /**
     * Tasks still queued on the dispatcher, deadlines included.
     */
    int queuedTasks() {
        return dispatcher.getQueue().size();
    }

    private void runOnDispatcher(Runnable task) {
        try {
            dispatcher.execute(task);
        } catch (RejectedExecutionException e) {
            log.debug("Event bus closed, skipping dispatcher task");
        }
    }

    @Override
    public void close() {
        dispatcher.shutdownNow();
        for (var waiter : waiters) {
            waiter.future.cancel(false);
        }
    }

    private static final class Waiter {
        final Predicate<GatewayEvent> check;
        final CompletableFuture<GatewayEvent> future = new CompletableFuture<>();
        volatile ScheduledFuture<?> deadline;

        Waiter(Predicate<GatewayEvent> check) {
            this.check = check;
        }

        void cancelDeadline() {
            var d = deadline;
            if (d != null) d.cancel(false);
        }
    }
}
