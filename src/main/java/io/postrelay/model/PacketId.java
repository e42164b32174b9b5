package io.postrelay.model;

public record PacketId(String sourcePort, String sourceChannel, long sequence) {
    @Override
    public String toString() {
        return sourcePort + "/" + sourceChannel + "/" + Long.toUnsignedString(sequence);
    }
}
