package com.ghlinker.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".ghlinker", "config.yaml"
    );

    public static GhLinkerConfig load() {
        return load(DEFAULT_PATH);
    }

    public static GhLinkerConfig load(Path path) {
        return load(path, System.getenv());
    }

    static GhLinkerConfig load(Path path, Map<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new RuntimeException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var discord = section(raw, "discord");
        var deletion = section(raw, "deletion");
        var tasks = section(raw, "tasks");

        // BOT_TOKEN 兼容旧的 .env 部署
        var token = firstNonNull(env.get("GHLINKER_DISCORD_TOKEN"), env.get("BOT_TOKEN"),
                stringOrNull(discord.get("bot-token")));

        return new GhLinkerConfig(
            token,
            Integer.parseInt(String.valueOf(valueOr(tasks, "threads", 2))),
            parseDeletionConfig(deletion)
        );
    }

    private static DeletionConfig parseDeletionConfig(Map<String, Object> deletion) {
        var defaults = DeletionConfig.defaults();
        var emoji = defaults.emoji();
        var rawEmoji = deletion.get("emoji");
        if (rawEmoji instanceof List<?> list) {
            emoji = list.stream().map(String::valueOf).toList();
        } else if (rawEmoji != null) {
            emoji = List.of(String.valueOf(rawEmoji));
        }
        return new DeletionConfig(
            emoji,
            Long.parseLong(String.valueOf(valueOr(deletion, "timeout", defaults.timeoutSeconds())))
        );
    }

    // a key written without a value ("discord:") loads as null
    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> raw, String key) {
        var value = raw.get(key);
        return value instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static Object valueOr(Map<String, Object> section, String key, Object fallback) {
        var value = section.get(key);
        return value != null ? value : fallback;
    }

    private static String stringOrNull(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    private static String firstNonNull(String... values) {
        for (var v : values) {
            if (v != null) return v;
        }
        return "";
    }
}
