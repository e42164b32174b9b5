package io.postrelay.channel;

import io.postrelay.error.PostRelayException;
import io.postrelay.model.Packet;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * Transport side of a channel. Implementations own channel ends and send sequences; callers only
 * read them and hand over finished packets.
 */
public interface ChannelKeeper {
    Optional<ChannelEnd> channel(String portId, String channelId);

    OptionalLong nextSequenceSend(String portId, String channelId);

    /**
     * Commits {@code packet} for delivery and advances the send sequence of its source channel.
     *
     * @throws PostRelayException if the capability does not authorize the source channel or the
     *                            transport refuses the packet
     */
    void sendPacket(Capability capability, Packet packet) throws PostRelayException;
}
