package io.postrelay.relay;

import io.postrelay.channel.Capability;
import io.postrelay.channel.CapabilityKeeper;
import io.postrelay.channel.CapabilityPaths;
import io.postrelay.channel.ChannelEnd;
import io.postrelay.channel.ChannelKeeper;
import io.postrelay.codec.PacketCodec;
import io.postrelay.error.ErrorKind;
import io.postrelay.error.PostRelayException;
import io.postrelay.model.Height;
import io.postrelay.model.Packet;
import io.postrelay.model.PostPayload;
import io.postrelay.observability.NullPacketEventSink;
import io.postrelay.observability.PacketEventSink;

import java.util.OptionalLong;

/**
 * Builds the packet for a post and hands it to the channel keeper. Sequence advancement belongs to
 * the keeper; nothing local is written here.
 */
public final class PostTransmitter {
    private final ChannelKeeper channelKeeper;
    private final CapabilityKeeper capabilityKeeper;
    private final PacketCodec codec;
    private final PacketEventSink events;

    public PostTransmitter(ChannelKeeper channelKeeper, CapabilityKeeper capabilityKeeper) {
        this(channelKeeper, capabilityKeeper, PacketCodec.JSON, NullPacketEventSink.INSTANCE);
    }

    public PostTransmitter(ChannelKeeper channelKeeper, CapabilityKeeper capabilityKeeper, PacketCodec codec, PacketEventSink events) {
        this.channelKeeper = channelKeeper;
        this.capabilityKeeper = capabilityKeeper;
        this.codec = codec;
        this.events = events;
    }

    /**
     * Sends {@code payload} over {@code (sourcePort, sourceChannel)}.
     *
     * @param timeoutTimestamp absolute timeout in unix nanoseconds, 0 for none
     * @return the packet the keeper accepted
     * @throws PostRelayException {@code CHANNEL_NOT_FOUND}, {@code SEQUENCE_NOT_FOUND},
     *                            {@code CAPABILITY_MISSING}, {@code ENCODING_ERROR}, or whatever the
     *                            keeper raised while sending
     */
    public Packet send(PostPayload payload, String sourcePort, String sourceChannel, Height timeoutHeight, long timeoutTimestamp)
            throws PostRelayException {
        ChannelEnd sourceChannelEnd = channelKeeper.channel(sourcePort, sourceChannel)
                .orElseThrow(() -> new PostRelayException(ErrorKind.CHANNEL_NOT_FOUND,
                        "port ID (" + sourcePort + ") channel ID (" + sourceChannel + ")"));

        String destinationPort = sourceChannelEnd.counterpartyPortId();
        String destinationChannel = sourceChannelEnd.counterpartyChannelId();

        OptionalLong sequence = channelKeeper.nextSequenceSend(sourcePort, sourceChannel);
        if (sequence.isEmpty()) {
            throw new PostRelayException(ErrorKind.SEQUENCE_NOT_FOUND,
                    "source port: " + sourcePort + ", source channel: " + sourceChannel);
        }

        Capability channelCap = capabilityKeeper.capability(CapabilityPaths.channelCapabilityPath(sourcePort, sourceChannel))
                .orElseThrow(() -> new PostRelayException(ErrorKind.CAPABILITY_MISSING,
                        "module does not own channel capability"));

        byte[] packetBytes = codec.encodePostPacket(payload);

        Packet packet = new Packet(
                sequence.getAsLong(),
                sourcePort,
                sourceChannel,
                destinationPort,
                destinationChannel,
                timeoutHeight,
                timeoutTimestamp,
                packetBytes
        );

        channelKeeper.sendPacket(channelCap, packet);
        events.onPacketSent(packet, payload);
        return packet;
    }
}
