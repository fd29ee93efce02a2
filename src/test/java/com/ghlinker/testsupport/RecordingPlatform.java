package com.ghlinker.testsupport;

import com.ghlinker.platform.FailureKind;
import com.ghlinker.platform.MessagePlatform;
import com.ghlinker.platform.PlatformException;
import com.ghlinker.shared.model.MessageRef;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Records every platform call as {@code op:target[:args]} and fails the ones
 * configured with {@link #failOn(String, FailureKind)}. Calls of an operation passed
 * to {@link #hold(String)} stay pending until the test completes the returned future.
 */
public class RecordingPlatform implements MessagePlatform {

    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final Map<String, FailureKind> failures = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<Void>> held = new ConcurrentHashMap<>();

    public RecordingPlatform failOn(String op, FailureKind kind) {
        failures.put(op, kind);
        return this;
    }

    public CompletableFuture<Void> hold(String op) {
        return held.computeIfAbsent(op, k -> new CompletableFuture<>());
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public long count(String op) {
        return calls.stream().filter(c -> c.startsWith(op + ":")).count();
    }

    @Override
    public CompletableFuture<Void> addReaction(MessageRef message, String emoji) {
        return record("add", message.id() + ":" + emoji);
    }

    @Override
    public CompletableFuture<Void> removeReaction(MessageRef message, String emoji, String actorId) {
        return record("remove", message.id() + ":" + emoji + ":" + actorId);
    }

    @Override
    public CompletableFuture<Void> clearReactions(MessageRef message) {
        return record("clear", message.id());
    }

    @Override
    public CompletableFuture<Void> deleteMessage(MessageRef message) {
        return record("delete", message.id());
    }

    @Override
    public CompletableFuture<Void> joinThread(String threadId) {
        return record("join", threadId);
    }

    private CompletableFuture<Void> record(String op, String target) {
        calls.add(op + ":" + target);
        var pending = held.get(op);
        if (pending != null) {
            return pending;
        }
        var kind = failures.get(op);
        if (kind != null) {
            return CompletableFuture.failedFuture(new PlatformException(kind, op + " failed for " + target));
        }
        return CompletableFuture.completedFuture(null);
    }
}
