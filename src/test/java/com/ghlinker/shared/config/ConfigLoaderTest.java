package com.ghlinker.shared.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsWhenFileMissing() {
        var cfg = ConfigLoader.load(tempDir.resolve("missing.yaml"), Map.of());
        assertEquals("", cfg.discordBotToken());
        assertEquals(2, cfg.taskThreads());
        assertEquals(List.of(DeletionConfig.TRASHCAN), cfg.deletion().emoji());
        assertEquals(300, cfg.deletion().timeoutSeconds());
    }

    @Test
    void parsesFullConfig() throws IOException {
        var yaml = """
            discord:
              bot-token: abc
            deletion:
              emoji: ["✅", "<:trash:123>"]
              timeout: 60
            tasks:
              threads: 4
            """;
        var cfg = writeAndLoad(yaml, Map.of());
        assertEquals("abc", cfg.discordBotToken());
        assertEquals(4, cfg.taskThreads());
        assertEquals(List.of("✅", "<:trash:123>"), cfg.deletion().emoji());
        assertEquals(60, cfg.deletion().timeoutSeconds());
    }

    @Test
    void singleEmojiIsAccepted() throws IOException {
        var cfg = writeAndLoad("deletion:\n  emoji: \"🗑\"\n", Map.of());
        assertEquals(List.of("🗑"), cfg.deletion().emoji());
        assertEquals(300, cfg.deletion().timeoutSeconds());
    }

    @Test
    void environmentOverridesToken() throws IOException {
        var yaml = "discord:\n  bot-token: from-file\n";
        assertEquals("from-env", writeAndLoad(yaml, Map.of("GHLINKER_DISCORD_TOKEN", "from-env")).discordBotToken());
        assertEquals("legacy", writeAndLoad(yaml, Map.of("BOT_TOKEN", "legacy")).discordBotToken());
        assertEquals("from-env", writeAndLoad(yaml,
                Map.of("GHLINKER_DISCORD_TOKEN", "from-env", "BOT_TOKEN", "legacy")).discordBotToken());
    }

    @Test
    void emptyFileFallsBackToDefaults() throws IOException {
        var cfg = writeAndLoad("", Map.of());
        assertEquals(300, cfg.deletion().timeoutSeconds());
    }

    @Test
    void keysWithoutValuesFallBackToDefaults() throws IOException {
        var cfg = writeAndLoad("discord:\n  bot-token:\ndeletion:\n  timeout:\ntasks:\n", Map.of());
        assertEquals("", cfg.discordBotToken());
        assertEquals(300, cfg.deletion().timeoutSeconds());
        assertEquals(2, cfg.taskThreads());
    }

    private GhLinkerConfig writeAndLoad(String yaml, Map<String, String> env) throws IOException {
        var file = tempDir.resolve("config.yaml");
        Files.writeString(file, yaml);
        return ConfigLoader.load(file, env);
    }
}
