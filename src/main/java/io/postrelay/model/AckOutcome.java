package io.postrelay.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Outcome relayed back to the sender for a delivered packet.
 */
public sealed interface AckOutcome permits AckOutcome.Success, AckOutcome.Failure {

    static AckOutcome success(byte[] result) {
        return new Success(result);
    }

    static AckOutcome failure(String message) {
        return new Failure(message);
    }

    /** The receiver applied the packet; {@code result} holds the encoded {@link AckResult}. */
    record Success(byte[] result) implements AckOutcome {
        public Success {
            result = result == null ? new byte[0] : result.clone();
        }

        @Override
        public byte[] result() {
            return result.clone();
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Success other && Arrays.equals(result, other.result);
        }

        @Override
        public int hashCode() {
            return Arrays.hashCode(result);
        }

        @Override
        public String toString() {
            return "Success[" + result.length + "B]";
        }
    }

    /** The receiver rejected the packet. */
    record Failure(String message) implements AckOutcome {
        public Failure {
            message = Objects.requireNonNullElse(message, "");
        }
    }
}
