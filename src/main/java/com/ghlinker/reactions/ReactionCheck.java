package com.ghlinker.reactions;

import com.ghlinker.shared.model.ReactionAddEvent;

import java.util.List;
import java.util.Set;

/**
 * Decides whether a reaction targets a deletion prompt. Authorization is a separate
 * question: a matching reaction from someone outside {@code allowedUsers} is removed,
 * not obeyed.
 */
public record ReactionCheck(
    String selfId,
    String messageId,
    List<String> allowedEmoji,
    Set<String> allowedUsers
) {
    public ReactionCheck {
        allowedEmoji = List.copyOf(allowedEmoji);
        allowedUsers = Set.copyOf(allowedUsers);
    }

    public boolean matches(ReactionAddEvent event) {
        return !event.actorId().equals(selfId)
                && event.messageId().equals(messageId)
                && allowedEmoji.contains(event.emoji());
    }

    public boolean isAuthorized(ReactionAddEvent event) {
        return allowedUsers.contains(event.actorId());
    }
}
