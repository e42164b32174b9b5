package io.postrelay.observability;

import io.postrelay.error.PostRelayException;
import io.postrelay.model.Packet;
import io.postrelay.model.PacketResolution;
import io.postrelay.model.PostPayload;
import io.postrelay.model.PostRecord;
import io.postrelay.model.SentPostRecord;
import io.postrelay.model.TimedOutPostRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production implementation of PacketEventSink that emits logs via SLF4J.
 */
public final class Slf4jPacketEventSink implements PacketEventSink {
    private static final Logger log = LoggerFactory.getLogger(Slf4jPacketEventSink.class);

    private final String chainId;

    public Slf4jPacketEventSink(String chainId) {
        this.chainId = chainId;
    }

    @Override
    public void onPacketSent(Packet packet, PostPayload payload) {
        log.info("[{}] Sent post '{}' by {} as packet {} to {}",
                chainId, payload.title(), payload.creator(), packet.id(), packet.destinationChain());
    }

    @Override
    public void onPostReceived(Packet packet, PostRecord record) {
        log.info("[{}] Received post {} from packet {} (creator {})",
                chainId, Long.toUnsignedString(record.id()), packet.id(), record.creator());
    }

    @Override
    public void onPacketRejected(Packet packet, PostRelayException error) {
        log.warn("[{}] Rejected packet {}: {}", chainId, packet.id(), error.getMessage());
    }

    @Override
    public void onAcknowledged(Packet packet, SentPostRecord record) {
        log.info("[{}] Packet {} acknowledged by {} as post {}",
                chainId, packet.id(), record.chain(), record.postId());
    }

    @Override
    public void onNegativeAcknowledgement(Packet packet, PostPayload payload, String message) {
        log.warn("[{}] Packet {} with post '{}' was refused by {}: {}",
                chainId, packet.id(), payload.title(), packet.destinationChain(), message);
    }

    @Override
    public void onTimedOut(Packet packet, TimedOutPostRecord record) {
        log.info("[{}] Packet {} timed out before reaching {}", chainId, packet.id(), record.chain());
    }

    @Override
    public void onDuplicateResolution(Packet packet, PacketResolution attempted) {
        log.warn("[{}] Packet {} already resolved, ignoring {}", chainId, packet.id(), attempted);
    }
}
