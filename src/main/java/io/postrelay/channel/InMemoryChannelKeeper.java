package io.postrelay.channel;

import io.postrelay.error.ErrorKind;
import io.postrelay.error.PostRelayException;
import io.postrelay.model.Packet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Channel keeper backed by process memory. Sequences start at 1 per channel unless the opener
 * picks another first sequence. Committed packets are
 * handed to the registered {@link PacketListener}, which is how {@code LoopbackRelay} picks them up.
 *
 * <p>On the receiving side an {@link ChannelOrder#ORDERED} channel accepts packets only in sequence
 * order, an {@link ChannelOrder#UNORDERED} one in any order but each sequence once.
 */
public final class InMemoryChannelKeeper implements ChannelKeeper {
    private static final Logger log = LoggerFactory.getLogger(InMemoryChannelKeeper.class);

    private final Map<String, ChannelEnd> channels = new ConcurrentHashMap<>();
    private final Map<String, Long> nextSequenceSend = new ConcurrentHashMap<>();
    private final Map<String, Long> nextSequenceRecv = new ConcurrentHashMap<>();
    private final Map<String, Set<Long>> received = new ConcurrentHashMap<>();
    private final List<Packet> committed = new CopyOnWriteArrayList<>();
    private volatile PacketListener listener;

    public void openChannel(ChannelEnd end) {
        openChannel(end, 1L);
    }

    public void openChannel(ChannelEnd end, long firstSequence) {
        String key = key(end.portId(), end.channelId());
        channels.put(key, end);
        nextSequenceSend.putIfAbsent(key, firstSequence);
        nextSequenceRecv.putIfAbsent(key, 1L);
        received.putIfAbsent(key, ConcurrentHashMap.newKeySet());
    }

    /** Sets the sequence an ordered channel expects next from its counterparty. */
    public void expectSequenceRecv(String portId, String channelId, long sequence) {
        nextSequenceRecv.put(key(portId, channelId), sequence);
    }

    /**
     * Removes the channel end. Sends on it fail from then on, and so do deliveries to it.
     */
    public synchronized void closeChannel(String portId, String channelId) {
        String key = key(portId, channelId);
        if (channels.remove(key) != null) {
            log.info("Closed channel {}", key);
        }
        nextSequenceSend.remove(key);
        nextSequenceRecv.remove(key);
        received.remove(key);
    }

    /** Drops the sequence counter while keeping the channel end, as a half-initialized channel would look. */
    public void clearSequence(String portId, String channelId) {
        nextSequenceSend.remove(key(portId, channelId));
    }

    public void setListener(PacketListener listener) {
        this.listener = listener;
    }

    public List<Packet> committedPackets() {
        return new ArrayList<>(committed);
    }

    @Override
    public Optional<ChannelEnd> channel(String portId, String channelId) {
        return Optional.ofNullable(channels.get(key(portId, channelId)));
    }

    @Override
    public OptionalLong nextSequenceSend(String portId, String channelId) {
        Long next = nextSequenceSend.get(key(portId, channelId));
        return next == null ? OptionalLong.empty() : OptionalLong.of(next);
    }

    @Override
    public synchronized void sendPacket(Capability capability, Packet packet) throws PostRelayException {
        String key = key(packet.sourcePort(), packet.sourceChannel());
        String expectedPath = CapabilityPaths.channelCapabilityPath(packet.sourcePort(), packet.sourceChannel());
        if (capability == null || !expectedPath.equals(capability.path())) {
            throw new PostRelayException(ErrorKind.CAPABILITY_MISSING,
                    "caller does not own capability for channel, port ID (" + packet.sourcePort()
                            + ") channel ID (" + packet.sourceChannel() + ")");
        }
        ChannelEnd end = channels.get(key);
        if (end == null) {
            throw new PostRelayException(ErrorKind.CHANNEL_NOT_FOUND,
                    "port ID (" + packet.sourcePort() + ") channel ID (" + packet.sourceChannel() + ")");
        }
        if (!end.counterpartyPortId().equals(packet.destPort()) || !end.counterpartyChannelId().equals(packet.destChannel())) {
            throw new PostRelayException(ErrorKind.PACKET_REJECTED,
                    "packet destination " + packet.destPort() + "/" + packet.destChannel()
                            + " does not match counterparty " + end.counterpartyPortId() + "/" + end.counterpartyChannelId());
        }
        Long next = nextSequenceSend.get(key);
        if (next == null) {
            throw new PostRelayException(ErrorKind.SEQUENCE_NOT_FOUND,
                    "source port: " + packet.sourcePort() + ", source channel: " + packet.sourceChannel());
        }
        if (next != packet.sequence()) {
            throw new PostRelayException(ErrorKind.PACKET_REJECTED,
                    "packet sequence " + Long.toUnsignedString(packet.sequence())
                            + " does not match next send sequence " + Long.toUnsignedString(next));
        }
        if (!packet.hasTimeout()) {
            throw new PostRelayException(ErrorKind.PACKET_REJECTED, "packet timeout height and timeout timestamp cannot both be 0");
        }
        nextSequenceSend.put(key, next + 1L);
        committed.add(packet);
        log.debug("Committed packet {}", packet.id());
        PacketListener current = listener;
        if (current != null) {
            current.onPacketCommitted(packet);
        }
    }

    /**
     * Accepts delivery of {@code packet} on its destination channel end.
     *
     * @throws PostRelayException {@code CHANNEL_NOT_FOUND} if the destination end is closed or
     *                            unknown, {@code PACKET_REJECTED} if the packet does not come from the
     *                            counterparty, is out of order on an ordered channel, or was already
     *                            received
     */
    public synchronized void recvPacket(Packet packet) throws PostRelayException {
        String key = key(packet.destPort(), packet.destChannel());
        ChannelEnd end = channels.get(key);
        if (end == null) {
            throw new PostRelayException(ErrorKind.CHANNEL_NOT_FOUND,
                    "port ID (" + packet.destPort() + ") channel ID (" + packet.destChannel() + ")");
        }
        if (!end.counterpartyPortId().equals(packet.sourcePort()) || !end.counterpartyChannelId().equals(packet.sourceChannel())) {
            throw new PostRelayException(ErrorKind.PACKET_REJECTED,
                    "packet source " + packet.sourcePort() + "/" + packet.sourceChannel()
                            + " does not match counterparty " + end.counterpartyPortId() + "/" + end.counterpartyChannelId());
        }
        if (end.ordering() == ChannelOrder.ORDERED) {
            long expected = nextSequenceRecv.getOrDefault(key, 1L);
            if (expected != packet.sequence()) {
                throw new PostRelayException(ErrorKind.PACKET_REJECTED,
                        "packet sequence " + Long.toUnsignedString(packet.sequence())
                                + " does not match next receive sequence " + Long.toUnsignedString(expected));
            }
            nextSequenceRecv.put(key, expected + 1L);
            return;
        }
        if (!received.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(packet.sequence())) {
            throw new PostRelayException(ErrorKind.PACKET_REJECTED,
                    "packet " + packet.id() + " was already received");
        }
    }

    private static String key(String portId, String channelId) {
        return portId + "/" + channelId;
    }

    @FunctionalInterface
    public interface PacketListener {
        void onPacketCommitted(Packet packet);
    }
}
