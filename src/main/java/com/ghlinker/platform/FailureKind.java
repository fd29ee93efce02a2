package com.ghlinker.platform;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Classification of platform call failures. Callers declare which kinds they
 * consider an expected outcome instead of matching on exception types.
 */
public enum FailureKind {
    /** The message, reaction, channel or user no longer exists. */
    NOT_FOUND,
    /** The bot lacks access or permissions for the call. */
    FORBIDDEN,
    /** Any other failure reported by the platform or the connection to it. */
    TRANSPORT,
    /** A failure that did not come from a platform call at all. */
    UNEXPECTED;

    public static FailureKind of(Throwable error) {
        var cause = unwrap(error);
        if (cause instanceof PlatformException pe) {
            return pe.kind();
        }
        return UNEXPECTED;
    }

    public static Throwable unwrap(Throwable error) {
        var t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
