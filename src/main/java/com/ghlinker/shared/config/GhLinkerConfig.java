package com.ghlinker.shared.config;

public record GhLinkerConfig(
    String discordBotToken,
    int taskThreads,
    DeletionConfig deletion
) {}
