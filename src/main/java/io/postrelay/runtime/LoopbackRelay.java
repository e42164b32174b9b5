package io.postrelay.runtime;

import io.postrelay.channel.CapabilityPaths;
import io.postrelay.channel.ChannelEnd;
import io.postrelay.channel.ChannelOrder;
import io.postrelay.channel.InMemoryCapabilityKeeper;
import io.postrelay.channel.InMemoryChannelKeeper;
import io.postrelay.codec.AcknowledgementCodec;
import io.postrelay.config.PostRelayConfig;
import io.postrelay.error.PostRelayException;
import io.postrelay.model.AckOutcome;
import io.postrelay.model.Height;
import io.postrelay.model.Packet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Two chains in one process joined by a single channel, with a relayer that moves packets and
 * acknowledgements between them on demand.
 *
 * <p>Each delivered packet advances the receiving chain by one block. A packet whose timeout height
 * or timeout timestamp the receiving chain has already reached is timed out on the sender instead
 * of being delivered. A timeout on an {@link ChannelOrder#ORDERED} channel closes both ends; every
 * packet still pending on it is then timed out as well and later sends fail.
 *
 * <p>A packet stays pending until its outcome has been handled on the sender, so a relay pass that
 * fails midway picks the same packet up again on the next call.
 */
public final class LoopbackRelay {
    public static final String PORT = "post";

    private static final Logger log = LoggerFactory.getLogger(LoopbackRelay.class);

    private final Endpoint a;
    private final Endpoint b;
    private final LongSupplier nanoClock;

    private LoopbackRelay(Endpoint a, Endpoint b, LongSupplier nanoClock) {
        this.a = a;
        this.b = b;
        this.nanoClock = nanoClock;
    }

    public static LoopbackRelay open(PostRelayConfig configA, PostRelayConfig configB, ChannelOrder ordering, LongSupplier nanoClock) {
        Endpoint a = new Endpoint(configA, new ChannelEnd(PORT, "channel-0", PORT, "channel-1", ordering), nanoClock);
        Endpoint b = new Endpoint(configB, new ChannelEnd(PORT, "channel-1", PORT, "channel-0", ordering), nanoClock);
        a.open();
        b.open();
        a.channelKeeper.expectSequenceRecv(a.channel.portId(), a.channel.channelId(), b.firstSequenceSend);
        b.channelKeeper.expectSequenceRecv(b.channel.portId(), b.channel.channelId(), a.firstSequenceSend);
        return new LoopbackRelay(a, b, nanoClock);
    }

    public Endpoint a() {
        return a;
    }

    public Endpoint b() {
        return b;
    }

    /**
     * Delivers every packet committed so far, in commit order per direction, and relays the outcome
     * back to its sender.
     */
    public RelayReport relayPending() throws PostRelayException {
        RelayReport ab = relay(a, b);
        RelayReport ba = relay(b, a);
        return ab.plus(ba);
    }

    private RelayReport relay(Endpoint from, Endpoint to) throws PostRelayException {
        int delivered = 0;
        int acknowledged = 0;
        int refused = 0;
        int timedOut = 0;
        InFlight entry;
        while ((entry = from.pending.peekFirst()) != null) {
            Packet packet = entry.packet;
            if (entry.acknowledgement == null) {
                if (isClosed(to) || hasExpired(packet, to)) {
                    from.runtime.module().onTimeoutPacket(packet);
                    from.pending.removeFirst();
                    timedOut++;
                    if (from.channel.ordering() == ChannelOrder.ORDERED) {
                        close();
                    }
                    continue;
                }
                to.channelKeeper.recvPacket(packet);
                entry.acknowledgement = to.runtime.module().onRecvPacket(packet);
                to.height = to.height.increment(1L);
                delivered++;
            }
            boolean failure = AcknowledgementCodec.JSON.decode(entry.acknowledgement) instanceof AckOutcome.Failure;
            from.runtime.module().onAcknowledgementPacket(packet, entry.acknowledgement);
            from.pending.removeFirst();
            if (failure) {
                refused++;
            } else {
                acknowledged++;
            }
        }
        if (delivered + timedOut > 0) {
            log.debug("Relayed {} -> {}: delivered={} timedOut={}", from.chainId(), to.chainId(), delivered, timedOut);
        }
        return new RelayReport(delivered, acknowledged, refused, timedOut);
    }

    private void close() {
        a.channelKeeper.closeChannel(a.channel.portId(), a.channel.channelId());
        b.channelKeeper.closeChannel(b.channel.portId(), b.channel.channelId());
    }

    private static boolean isClosed(Endpoint endpoint) {
        return endpoint.channelKeeper.channel(endpoint.channel.portId(), endpoint.channel.channelId()).isEmpty();
    }

    private boolean hasExpired(Packet packet, Endpoint destination) {
        if (!packet.timeoutHeight().isZero() && destination.height.compareTo(packet.timeoutHeight()) >= 0) {
            return true;
        }
        return packet.timeoutTimestamp() != 0L
                && Long.compareUnsigned(nanoClock.getAsLong(), packet.timeoutTimestamp()) >= 0;
    }

    public static final class Endpoint {
        private final ChannelEnd channel;
        private final InMemoryChannelKeeper channelKeeper;
        private final InMemoryCapabilityKeeper capabilityKeeper;
        private final PostRelayRuntime runtime;
        private final Deque<InFlight> pending = new ArrayDeque<>();
        private Height height = new Height(1L, 1L);
        private long firstSequenceSend = 1L;

        private Endpoint(PostRelayConfig config, ChannelEnd channel, LongSupplier nanoClock) {
            this.channel = channel;
            this.channelKeeper = new InMemoryChannelKeeper();
            this.capabilityKeeper = new InMemoryCapabilityKeeper();
            this.runtime = new PostRelayRuntime(config, channelKeeper, capabilityKeeper, nanoClock);
        }

        private void open() {
            runtime.init();
            firstSequenceSend = runtime.resolutionStore()
                    .lastSequence(channel.portId(), channel.channelId())
                    .orElse(0L) + 1L;
            channelKeeper.openChannel(channel, firstSequenceSend);
            capabilityKeeper.claim(CapabilityPaths.channelCapabilityPath(channel.portId(), channel.channelId()));
            channelKeeper.setListener(packet -> pending.addLast(new InFlight(packet)));
        }

        public String chainId() {
            return runtime.config().chainId();
        }

        public PostRelayRuntime runtime() {
            return runtime;
        }

        public ChannelEnd channel() {
            return channel;
        }

        public InMemoryChannelKeeper channelKeeper() {
            return channelKeeper;
        }

        public InMemoryCapabilityKeeper capabilityKeeper() {
            return capabilityKeeper;
        }

        public Height height() {
            return height;
        }

        public void advanceHeight(long blocks) {
            height = height.increment(blocks);
        }

        public List<Packet> pendingPackets() {
            List<Packet> out = new ArrayList<>(pending.size());
            for (InFlight entry : pending) {
                out.add(entry.packet);
            }
            return out;
        }
    }

    /** A committed packet and, once delivered, the acknowledgement still to be relayed back. */
    private static final class InFlight {
        private final Packet packet;
        private byte[] acknowledgement;

        private InFlight(Packet packet) {
            this.packet = packet;
        }
    }

    public record RelayReport(int delivered, int acknowledged, int refused, int timedOut) {
        RelayReport plus(RelayReport other) {
            return new RelayReport(
                    delivered + other.delivered,
                    acknowledged + other.acknowledged,
                    refused + other.refused,
                    timedOut + other.timedOut
            );
        }
    }
}
