package io.postrelay.error;

import java.util.Objects;

/**
 * A recoverable failure of one relay operation. Nothing was written to any store when this is
 * thrown; the caller decides whether to turn it into an error acknowledgement, report it, or drop
 * the packet.
 */
public class PostRelayException extends Exception {
    private final ErrorKind kind;

    public PostRelayException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public PostRelayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }

    @Override
    public String getMessage() {
        return kind + ": " + super.getMessage();
    }
}
