package com.ghlinker.platform;

import com.ghlinker.shared.model.MessageRef;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound commands against the chat platform. Every call completes
 * exceptionally with a {@link PlatformException} on failure; a message or
 * reaction that vanished in the meantime is reported as {@link FailureKind#NOT_FOUND}.
 */
public interface MessagePlatform {

    CompletableFuture<Void> addReaction(MessageRef message, String emoji);

    CompletableFuture<Void> removeReaction(MessageRef message, String emoji, String actorId);

    CompletableFuture<Void> clearReactions(MessageRef message);

    CompletableFuture<Void> deleteMessage(MessageRef message);

    CompletableFuture<Void> joinThread(String threadId);
}
