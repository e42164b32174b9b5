package io.postrelay.relay;

import io.postrelay.codec.AcknowledgementCodec;
import io.postrelay.codec.PacketCodec;
import io.postrelay.error.PostRelayException;
import io.postrelay.model.AckOutcome;
import io.postrelay.model.AckResult;
import io.postrelay.model.Packet;
import io.postrelay.model.PostPayload;
import io.postrelay.model.SentPostRecord;
import io.postrelay.model.TimedOutPostRecord;
import io.postrelay.observability.PacketEventSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Transport callbacks of the post port. Decodes packet bytes, runs the matching relay operation
 * and, for inbound packets, turns the result or the error into acknowledgement bytes.
 */
public final class PostPacketModule {
    private static final Logger log = LoggerFactory.getLogger(PostPacketModule.class);

    private final PacketCodec codec;
    private final AcknowledgementCodec ackCodec;
    private final PostReceiver receiver;
    private final AckReconciler ackReconciler;
    private final TimeoutReconciler timeoutReconciler;
    private final PacketEventSink events;

    public PostPacketModule(
            PacketCodec codec,
            AcknowledgementCodec ackCodec,
            PostReceiver receiver,
            AckReconciler ackReconciler,
            TimeoutReconciler timeoutReconciler,
            PacketEventSink events
    ) {
        this.codec = codec;
        this.ackCodec = ackCodec;
        this.receiver = receiver;
        this.ackReconciler = ackReconciler;
        this.timeoutReconciler = timeoutReconciler;
        this.events = events;
    }

    /**
     * Applies an inbound packet. Every failure to apply becomes an error acknowledgement.
     *
     * @return acknowledgement bytes to write back to the sender
     * @throws PostRelayException only if the acknowledgement itself cannot be encoded
     */
    public byte[] onRecvPacket(Packet packet) throws PostRelayException {
        AckOutcome outcome;
        try {
            PostPayload payload = codec.decodePostPacket(packet.data());
            AckResult result = receiver.receive(packet, payload);
            outcome = AckOutcome.success(codec.encodeAckResult(result));
        } catch (PostRelayException e) {
            log.debug("Inbound packet {} rejected", packet.id(), e);
            events.onPacketRejected(packet, e);
            outcome = AckOutcome.failure(e.getMessage());
        }
        return ackCodec.encode(outcome);
    }

    public Optional<SentPostRecord> onAcknowledgementPacket(Packet packet, byte[] acknowledgement) throws PostRelayException {
        AckOutcome outcome = ackCodec.decode(acknowledgement);
        PostPayload payload = codec.decodePostPacket(packet.data());
        return ackReconciler.handleAck(packet, payload, outcome);
    }

    public Optional<TimedOutPostRecord> onTimeoutPacket(Packet packet) throws PostRelayException {
        PostPayload payload = codec.decodePostPacket(packet.data());
        return timeoutReconciler.handleTimeout(packet, payload);
    }
}
