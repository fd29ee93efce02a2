package com.ghlinker.gateway;

import com.ghlinker.channels.DiscordGateway;
import com.ghlinker.channels.ThreadJoiner;
import com.ghlinker.events.EventBus;
import com.ghlinker.observability.BotMetrics;
import com.ghlinker.platform.JdaMessagePlatform;
import com.ghlinker.reactions.DeletionPrompt;
import com.ghlinker.shared.config.ConfigLoader;
import com.ghlinker.tasks.SupervisedTaskRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.concurrent.Executors;

@SpringBootApplication(scanBasePackages = "com.ghlinker")
public class GhLinkerApp {

    private static final Logger log = LoggerFactory.getLogger(GhLinkerApp.class);

    public static void main(String[] args) {
        var ctx = SpringApplication.run(GhLinkerApp.class, args);
        var config = ConfigLoader.load();

        var token = config.discordBotToken();
        if (token == null || token.isBlank()) {
            log.warn("Discord bot token not configured. Set discord.bot-token in ~/.ghlinker/config.yaml or BOT_TOKEN");
            ctx.close();
            return;
        }

        // Background work
        var metrics = new BotMetrics();
        var taskPool = Executors.newFixedThreadPool(Math.max(1, config.taskThreads()));
        var tasks = new SupervisedTaskRunner(taskPool, metrics);
        var bus = new EventBus();

        // Discord
        var gateway = new DiscordGateway(token, bus);
        gateway.start();
        var platform = new JdaMessagePlatform(gateway.getJda());
        gateway.setThreadJoiner(new ThreadJoiner(platform, tasks));

        var deletionPrompt = new DeletionPrompt(platform, bus, tasks, gateway.selfId(), config.deletion(), metrics);
        ctx.getBeanFactory().registerSingleton("deletionPrompt", deletionPrompt);
        log.info("Deletion prompts enabled: emoji={} timeout={}s",
                config.deletion().emoji(), config.deletion().timeoutSeconds());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            gateway.stop();
            bus.close();
            taskPool.shutdown();
            ctx.close();
        }, "bot-shutdown"));
    }
}
