package com.ghlinker.reactions;

import com.ghlinker.events.EventBus;
import com.ghlinker.observability.BotMetrics;
import com.ghlinker.platform.FailureKind;
import com.ghlinker.platform.MessagePlatform;
import com.ghlinker.shared.config.DeletionConfig;
import com.ghlinker.shared.model.ChannelDeleteEvent;
import com.ghlinker.shared.model.GatewayEvent;
import com.ghlinker.shared.model.MessageDeleteEvent;
import com.ghlinker.shared.model.MessageRef;
import com.ghlinker.shared.model.ReactionAddEvent;
import com.ghlinker.tasks.SupervisedTaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * Lets the users who caused a bot message delete it by reacting, for a limited time.
 *
 * <p>The prompt attaches the deletion emoji to the message and waits for one of the
 * allowed users to react with one of them. Matching reactions from anyone else are
 * removed in the background and do not end the wait. The prompt resolves exactly once:
 * <ul>
 *   <li>{@link Outcome#DELETED}: an allowed user reacted and the message was deleted
 *       (or was already gone);</li>
 *   <li>{@link Outcome#EXPIRED}: the timeout passed and the reactions were cleared
 *       (or the message was already gone);</li>
 *   <li>{@link Outcome#ABORTED}: the message (or its channel) was deleted by someone else first; no
 *       further calls are made.</li>
 * </ul>
 * The wait starts before the emoji are attached, so the timeout covers attaching too, and a
 * deletion seen while attaching still aborts. A reaction that reaches the event bus no
 * later than the deadline wins over the expiry.
 * Any other failure of the final delete or clear completes the returned future
 * exceptionally with the {@link com.ghlinker.platform.PlatformException}.
 */
public class DeletionPrompt {

    private static final Logger log = LoggerFactory.getLogger(DeletionPrompt.class);

    private final MessagePlatform platform;
    private final EventBus bus;
    private final SupervisedTaskRunner tasks;
    private final String selfId;
    private final DeletionConfig defaults;
    private final BotMetrics metrics;

    public DeletionPrompt(MessagePlatform platform, EventBus bus, SupervisedTaskRunner tasks, String selfId) {
        this(platform, bus, tasks, selfId, DeletionConfig.defaults(), new BotMetrics());
    }

    public DeletionPrompt(MessagePlatform platform, EventBus bus, SupervisedTaskRunner tasks, String selfId,
                          DeletionConfig defaults, BotMetrics metrics) {
        this.platform = platform;
        this.bus = bus;
        this.tasks = tasks;
        this.selfId = selfId;
        this.defaults = defaults;
        this.metrics = metrics;
    }

    public CompletableFuture<Outcome> waitForDeletion(MessageRef message, Collection<String> userIds) {
        return waitForDeletion(message, userIds, defaults.emoji(),
                Duration.ofSeconds(defaults.timeoutSeconds()), true);
    }

    /**
     * @throws InvalidContextException if the message was not sent in a guild
     */
    public CompletableFuture<Outcome> waitForDeletion(MessageRef message, Collection<String> userIds,
                                                      List<String> deletionEmoji, Duration timeout,
                                                      boolean attachEmoji) {
        if (!message.isInGuild()) {
            throw new InvalidContextException("Message " + message.id() + " must be sent in a guild");
        }
        var check = new ReactionCheck(selfId, message.id(), deletionEmoji, Set.copyOf(userIds));

        // registered before attaching so a deletion or reaction during attach is not missed
        var wait = bus.waitFor(event -> accept(event, check, message), timeout);
        var attached = attachEmoji
                ? attach(message, check.allowedEmoji(), wait)
                : CompletableFuture.completedFuture(true);

        var outcome = attached
                .thenCompose(present -> present ? await(message, wait) : aborted(message, wait))
                .thenApply(result -> {
                    metrics.deletionOutcome(result.name().toLowerCase(Locale.ROOT)).increment();
                    return result;
                });

        outcome.whenComplete((result, error) -> wait.cancel(false));
        return outcome;
    }

    private CompletableFuture<Outcome> await(MessageRef message, CompletableFuture<GatewayEvent> wait) {
        return wait.handle((event, error) -> resolve(message, event, error))
                .thenCompose(Function.identity());
    }

    private static CompletableFuture<Outcome> aborted(MessageRef message, CompletableFuture<GatewayEvent> wait) {
        wait.cancel(false);
        log.debug("Aborting wait for deletion: message {} deleted prematurely.", message.id());
        return CompletableFuture.completedFuture(Outcome.ABORTED);
    }

    /**
     * Adds the emoji one by one. Stops early when the message is gone, or when the wait
     * already resolved and further emoji would be pointless.
     */
    private CompletableFuture<Boolean> attach(MessageRef message, List<String> emoji,
                                              CompletableFuture<GatewayEvent> wait) {
        var chain = CompletableFuture.completedFuture(true);
        for (var e : emoji) {
            chain = chain.thenCompose(present -> present && !wait.isDone()
                    ? recoverNotFound(platform.addReaction(message, e), true, false)
                    : CompletableFuture.completedFuture(false));
        }
        return chain;
    }

    private boolean accept(GatewayEvent event, ReactionCheck check, MessageRef message) {
        if (event instanceof MessageDeleteEvent deleted) {
            return deleted.messageId().equals(message.id());
        }
        if (event instanceof ChannelDeleteEvent gone) {
            return gone.channelId().equals(message.channelId());
        }
        if (!(event instanceof ReactionAddEvent reaction) || !check.matches(reaction)) {
            return false;
        }
        if (check.isAuthorized(reaction)) {
            log.debug("Allowed reaction {} by {} on {}.", reaction.emoji(), reaction.actorId(), message.id());
            return true;
        }
        log.debug("Removing reaction {} by {} on {}: disallowed user.",
                reaction.emoji(), reaction.actorId(), message.id());
        tasks.spawn(() -> platform.removeReaction(message, reaction.emoji(), reaction.actorId()),
                EnumSet.of(FailureKind.NOT_FOUND),
                "remove_reaction-" + reaction.emoji() + "-" + message.id() + "-" + reaction.actorId());
        return false;
    }

    private CompletableFuture<Outcome> resolve(MessageRef message, GatewayEvent event, Throwable error) {
        if (error != null) {
            var cause = FailureKind.unwrap(error);
            if (cause instanceof TimeoutException) {
                return recoverNotFound(platform.clearReactions(message), Outcome.EXPIRED, Outcome.EXPIRED);
            }
            return CompletableFuture.failedFuture(cause);
        }
        if (event instanceof MessageDeleteEvent || event instanceof ChannelDeleteEvent) {
            log.debug("Wait for deletion: message {} deleted by someone else.", message.id());
            return CompletableFuture.completedFuture(Outcome.ABORTED);
        }
        return recoverNotFound(platform.deleteMessage(message), Outcome.DELETED, Outcome.DELETED);
    }

    private static <T> CompletableFuture<T> recoverNotFound(CompletableFuture<Void> call, T done, T missing) {
        return call.handle((v, error) -> {
            if (error == null) return done;
            if (FailureKind.of(error) == FailureKind.NOT_FOUND) {
                log.debug("Platform call skipped, target is gone: {}", FailureKind.unwrap(error).getMessage());
                return missing;
            }
            throw error instanceof CompletionException ce ? ce : new CompletionException(error);
        });
    }
}
