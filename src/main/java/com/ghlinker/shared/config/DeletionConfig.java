package com.ghlinker.shared.config;

import java.util.List;

public record DeletionConfig(
    List<String> emoji,
    long timeoutSeconds
) {
    public static final String TRASHCAN = "<:trashcan:637136429717389331>";

    public static DeletionConfig defaults() {
        return new DeletionConfig(List.of(TRASHCAN), 300);
    }
}
