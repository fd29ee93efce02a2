package com.ghlinker.channels;

import com.ghlinker.events.EventBus;
import com.ghlinker.shared.model.ChannelDeleteEvent;
import com.ghlinker.shared.model.MessageDeleteEvent;
import com.ghlinker.shared.model.ReactionAddEvent;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.events.channel.ChannelCreateEvent;
import net.dv8tion.jda.api.events.message.MessageBulkDeleteEvent;
import net.dv8tion.jda.api.events.message.react.MessageReactionAddEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.requests.GatewayIntent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bridges the JDA gateway to the bot: reaction and deletion events go to the
 * {@link EventBus}, new threads go to the {@link ThreadJoiner}.
 */
public class DiscordGateway extends ListenerAdapter {

    private static final Logger log = LoggerFactory.getLogger(DiscordGateway.class);

    private final String botToken;
    private final EventBus bus;
    private ThreadJoiner threadJoiner;
    private JDA jda;

    public DiscordGateway(String botToken, EventBus bus) {
        this.botToken = botToken;
        this.bus = bus;
    }

    public JDA getJda() {
        return jda;
    }

    public String selfId() {
        return jda.getSelfUser().getId();
    }

    public void setThreadJoiner(ThreadJoiner threadJoiner) {
        this.threadJoiner = threadJoiner;
    }

    public void start() {
        try {
            jda = JDABuilder.createDefault(botToken)
                    .enableIntents(GatewayIntent.GUILD_MESSAGES, GatewayIntent.GUILD_MESSAGE_REACTIONS)
                    .addEventListeners(this)
                    .build();
            jda.awaitReady();
            log.info("Discord bot started as {}", jda.getSelfUser().getName());
        } catch (Exception e) {
            throw new RuntimeException("Failed to start Discord bot", e);
        }
    }

    @Override
    public void onMessageReactionAdd(MessageReactionAddEvent event) {
        // 私信里无法管理反应
        if (!event.isFromGuild()) return;
        bus.publish(new ReactionAddEvent(event.getEmoji().getFormatted(), event.getUserId(), event.getMessageId()));
    }

    @Override
    public void onMessageDelete(net.dv8tion.jda.api.events.message.MessageDeleteEvent event) {
        bus.publish(new MessageDeleteEvent(event.getMessageId(), event.getChannel().getId()));
    }

    @Override
    public void onMessageBulkDelete(MessageBulkDeleteEvent event) {
        var channelId = event.getChannel().getId();
        for (var messageId : event.getMessageIds()) {
            bus.publish(new MessageDeleteEvent(messageId, channelId));
        }
    }

    @Override
    public void onChannelDelete(net.dv8tion.jda.api.events.channel.ChannelDeleteEvent event) {
        bus.publish(new ChannelDeleteEvent(event.getChannel().getId()));
    }

    @Override
    public void onChannelCreate(ChannelCreateEvent event) {
        if (threadJoiner == null || !event.getChannelType().isThread()) return;
        var thread = event.getChannel().asThreadChannel();
        threadJoiner.onThreadCreated(thread.getId(), thread.isJoined());
    }

    public void stop() {
        if (jda != null) {
            jda.shutdown();
        }
    }
}
