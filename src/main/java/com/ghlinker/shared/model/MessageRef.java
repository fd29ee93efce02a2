package com.ghlinker.shared.model;

/**
 * A message owned by the chat platform. {@code guildId} is null for direct messages.
 */
public record MessageRef(
    String id,
    String channelId,
    String guildId
) {
    public boolean isInGuild() {
        return guildId != null;
    }
}
