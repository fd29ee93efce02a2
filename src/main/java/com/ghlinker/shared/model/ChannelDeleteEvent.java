package com.ghlinker.shared.model;

public record ChannelDeleteEvent(
    String channelId
) implements GatewayEvent {}
