package com.ghlinker.shared.model;

public record ReactionAddEvent(
    String emoji,
    String actorId,
    String messageId
) implements GatewayEvent {}
