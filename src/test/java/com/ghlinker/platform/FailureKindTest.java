package com.ghlinker.platform;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class FailureKindTest {

    @Test
    void classifiesPlatformExceptionByKind() {
        assertEquals(FailureKind.NOT_FOUND, FailureKind.of(PlatformException.notFound("gone")));
        assertEquals(FailureKind.FORBIDDEN, FailureKind.of(new PlatformException(FailureKind.FORBIDDEN, "no")));
    }

    @Test
    void unwrapsFutureWrappers() {
        var cause = new PlatformException(FailureKind.TRANSPORT, "502");
        var wrapped = new CompletionException(new ExecutionException(cause));
        assertEquals(FailureKind.TRANSPORT, FailureKind.of(wrapped));
        assertSame(cause, FailureKind.unwrap(wrapped));
    }

    @Test
    void anythingElseIsUnexpected() {
        assertEquals(FailureKind.UNEXPECTED, FailureKind.of(new IllegalStateException("bug")));
        assertEquals(FailureKind.UNEXPECTED, FailureKind.of(new CompletionException(null)));
    }
}
