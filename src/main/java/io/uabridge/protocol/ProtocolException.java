package io.uabridge.protocol;

public class ProtocolException extends Exception {
    public enum Kind {
        TIMEOUT,
        TYPE_MISMATCH,
        NOT_CONNECTED,
        FAILURE
    }

    private final Kind kind;

    public ProtocolException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProtocolException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static ProtocolException notConnected() {
        return new ProtocolException(Kind.NOT_CONNECTED, "not connected");
    }

    public Kind kind() {
        return kind;
    }

    public boolean isTimeout() {
        return kind == Kind.TIMEOUT;
    }

    public boolean isTypeMismatch() {
        return kind == Kind.TYPE_MISMATCH;
    }
}
