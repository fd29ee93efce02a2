package com.ghlinker.platform;

import com.ghlinker.shared.model.MessageRef;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.entities.User;
import net.dv8tion.jda.api.entities.channel.middleman.GuildMessageChannel;
import net.dv8tion.jda.api.entities.emoji.Emoji;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.requests.RestAction;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link MessagePlatform} backed by JDA. Rate limiting and request ordering are
 * left to JDA's requester.
 */
public class JdaMessagePlatform implements MessagePlatform {

    private final JDA jda;

    public JdaMessagePlatform(JDA jda) {
        this.jda = jda;
    }

    @Override
    public CompletableFuture<Void> addReaction(MessageRef message, String emoji) {
        var channel = channel(message);
        if (channel == null) return missingChannel(message);
        return submit(channel.addReactionById(message.id(), Emoji.fromFormatted(emoji)));
    }

    @Override
    public CompletableFuture<Void> removeReaction(MessageRef message, String emoji, String actorId) {
        var channel = channel(message);
        if (channel == null) return missingChannel(message);
        return submit(channel.removeReactionById(message.id(), Emoji.fromFormatted(emoji), User.fromId(actorId)));
    }

    @Override
    public CompletableFuture<Void> clearReactions(MessageRef message) {
        var channel = channel(message);
        if (channel == null) return missingChannel(message);
        return submit(channel.clearReactionsById(message.id()));
    }

    @Override
    public CompletableFuture<Void> deleteMessage(MessageRef message) {
        var channel = channel(message);
        if (channel == null) return missingChannel(message);
        return submit(channel.deleteMessageById(message.id()));
    }

    @Override
    public CompletableFuture<Void> joinThread(String threadId) {
        var thread = jda.getThreadChannelById(threadId);
        if (thread == null) {
            return CompletableFuture.failedFuture(PlatformException.notFound("Unknown thread " + threadId));
        }
        return submit(thread.join());
    }

    private GuildMessageChannel channel(MessageRef message) {
        return jda.getChannelById(GuildMessageChannel.class, message.channelId());
    }

    private static CompletableFuture<Void> missingChannel(MessageRef message) {
        return CompletableFuture.failedFuture(
                PlatformException.notFound("Unknown channel " + message.channelId() + " for message " + message.id()));
    }

    private static CompletableFuture<Void> submit(RestAction<?> action) {
        return action.submit().handle((result, error) -> {
            if (error != null) {
                throw new CompletionException(translate(error));
            }
            return null;
        });
    }

    static PlatformException translate(Throwable error) {
        var cause = FailureKind.unwrap(error);
        if (cause instanceof PlatformException pe) {
            return pe;
        }
        if (cause instanceof ErrorResponseException ere) {
            return new PlatformException(kindOf(ere), ere.getMeaning(), ere);
        }
        var msg = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new PlatformException(FailureKind.TRANSPORT, msg, cause);
    }

    private static FailureKind kindOf(ErrorResponseException error) {
        switch (error.getErrorResponse()) {
            case UNKNOWN_MESSAGE:
            case UNKNOWN_CHANNEL:
            case UNKNOWN_EMOJI:
            case UNKNOWN_USER:
                return FailureKind.NOT_FOUND;
            case MISSING_ACCESS:
            case MISSING_PERMISSIONS:
                return FailureKind.FORBIDDEN;
            default:
                return FailureKind.TRANSPORT;
        }
    }
}
