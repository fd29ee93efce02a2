package com.ghlinker.channels;

import com.ghlinker.platform.FailureKind;
import com.ghlinker.tasks.SupervisedTaskRunner;
import com.ghlinker.testsupport.LogCapture;
import com.ghlinker.testsupport.RecordingPlatform;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ThreadJoinerTest {

    private final RecordingPlatform platform = new RecordingPlatform();
    private final ThreadJoiner joiner = new ThreadJoiner(platform, new SupervisedTaskRunner(Runnable::run));

    @Test
    void joinsNewThread() {
        var task = joiner.onThreadCreated("T1", false);

        assertNotNull(task);
        assertEquals("join_thread-T1", task.label());
        assertEquals(List.of("join:T1"), platform.calls());
    }

    @Test
    void skipsThreadAlreadyJoined() {
        assertNull(joiner.onThreadCreated("T1", true));
        assertTrue(platform.calls().isEmpty());
    }

    @Test
    void forbiddenJoinIsSilent() {
        platform.failOn("join", FailureKind.FORBIDDEN);
        try (var logs = new LogCapture(SupervisedTaskRunner.class)) {
            var task = joiner.onThreadCreated("T1", false);

            assertTrue(task.completion().isCompletedExceptionally());
            assertTrue(logs.errors().isEmpty());
        }
    }

    @Test
    void otherJoinFailuresAreLogged() {
        platform.failOn("join", FailureKind.TRANSPORT);
        try (var logs = new LogCapture(SupervisedTaskRunner.class)) {
            joiner.onThreadCreated("T2", false);

            assertEquals(1, logs.errors().size());
            assertTrue(logs.errors().get(0).getFormattedMessage().contains("join_thread-T2"));
        }
    }
}
