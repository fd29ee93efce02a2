package com.ghlinker.shared.model;

public record MessageDeleteEvent(
    String messageId,
    String channelId
) implements GatewayEvent {}
