package io.postrelay.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * One unit of cross-chain transmission. Built once by the transmitter and never changed; the
 * payload bytes are copied on the way in and on the way out.
 */
public record Packet(
        long sequence,
        String sourcePort,
        String sourceChannel,
        String destPort,
        String destChannel,
        Height timeoutHeight,
        long timeoutTimestamp,
        byte[] data
) {
    public Packet {
        Objects.requireNonNull(sourcePort, "sourcePort");
        Objects.requireNonNull(sourceChannel, "sourceChannel");
        Objects.requireNonNull(destPort, "destPort");
        Objects.requireNonNull(destChannel, "destChannel");
        timeoutHeight = timeoutHeight == null ? Height.ZERO : timeoutHeight;
        data = data == null ? new byte[0] : data.clone();
    }

    @Override
    public byte[] data() {
        return data.clone();
    }

    public PacketId id() {
        return new PacketId(sourcePort, sourceChannel, sequence);
    }

    /** {@code destPort-destChannel}, the chain label stored on sent and timed-out posts. */
    public String destinationChain() {
        return destPort + "-" + destChannel;
    }

    /** {@code sourcePort-sourceChannel-}, prefixed to the creator of every post received from this packet. */
    public String sourcePrefix() {
        return sourcePort + "-" + sourceChannel + "-";
    }

    public boolean hasTimeout() {
        return !timeoutHeight.isZero() || timeoutTimestamp != 0L;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Packet other)) {
            return false;
        }
        return sequence == other.sequence
                && timeoutTimestamp == other.timeoutTimestamp
                && sourcePort.equals(other.sourcePort)
                && sourceChannel.equals(other.sourceChannel)
                && destPort.equals(other.destPort)
                && destChannel.equals(other.destChannel)
                && timeoutHeight.equals(other.timeoutHeight)
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(sequence, sourcePort, sourceChannel, destPort, destChannel, timeoutHeight, timeoutTimestamp);
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Packet[" + id()
                + " -> " + destPort + "/" + destChannel
                + ", timeoutHeight=" + timeoutHeight
                + ", timeoutTimestamp=" + Long.toUnsignedString(timeoutTimestamp)
                + ", data=" + data.length + "B]";
    }
}
