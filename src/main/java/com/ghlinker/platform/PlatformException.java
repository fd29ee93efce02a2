package com.ghlinker.platform;

public class PlatformException extends RuntimeException {

    private final FailureKind kind;

    public PlatformException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public PlatformException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }

    public static PlatformException notFound(String message) {
        return new PlatformException(FailureKind.NOT_FOUND, message);
    }
}
