package com.ghlinker.channels;

import com.ghlinker.platform.FailureKind;
import com.ghlinker.platform.MessagePlatform;
import com.ghlinker.tasks.SupervisedTaskRunner;
import com.ghlinker.tasks.TaskHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;

/**
 * Joins newly created threads so the bot sees messages posted in them.
 * Threads the bot may not join are skipped silently.
 */
public class ThreadJoiner {

    private static final Logger log = LoggerFactory.getLogger(ThreadJoiner.class);

    private final MessagePlatform platform;
    private final SupervisedTaskRunner tasks;

    public ThreadJoiner(MessagePlatform platform, SupervisedTaskRunner tasks) {
        this.platform = platform;
        this.tasks = tasks;
    }

    /**
     * @return the join task, or {@code null} when the bot is already a member
     */
    public TaskHandle<Void> onThreadCreated(String threadId, boolean alreadyJoined) {
        if (alreadyJoined) return null;
        log.debug("Joining new thread {}", threadId);
        return tasks.spawn(() -> platform.joinThread(threadId),
                EnumSet.of(FailureKind.FORBIDDEN),
                "join_thread-" + threadId);
    }
}
