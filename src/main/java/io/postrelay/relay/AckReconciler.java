package io.postrelay.relay;

import io.postrelay.codec.PacketCodec;
import io.postrelay.error.ErrorKind;
import io.postrelay.error.PostRelayException;
import io.postrelay.model.AckOutcome;
import io.postrelay.model.AckResult;
import io.postrelay.model.Packet;
import io.postrelay.model.PacketResolution;
import io.postrelay.model.PostPayload;
import io.postrelay.model.SentPostRecord;
import io.postrelay.observability.PacketEventSink;
import io.postrelay.storage.PacketResolutionStore;
import io.postrelay.storage.SentPostStore;

import java.util.Optional;

/**
 * Settles an originated packet once the counterparty's acknowledgement comes back.
 */
public final class AckReconciler {
    private final SentPostStore sentPostStore;
    private final PacketResolutionStore resolutionStore;
    private final PacketCodec codec;
    private final PacketEventSink events;

    public AckReconciler(SentPostStore sentPostStore, PacketResolutionStore resolutionStore, PacketCodec codec, PacketEventSink events) {
        this.sentPostStore = sentPostStore;
        this.resolutionStore = resolutionStore;
        this.codec = codec;
        this.events = events;
    }

    /**
     * A success outcome records a sent post. A failure outcome changes no post log: the message is
     * passed to {@link PacketEventSink#onNegativeAcknowledgement} and the packet is marked resolved.
     *
     * @return the sent post, or empty for a failure outcome or an already resolved packet
     * @throws PostRelayException {@code ACK_DECODE_ERROR} if the success bytes are not an
     *                            acknowledgement result, {@code UNSUPPORTED_ACK_FORMAT} for any
     *                            other outcome
     */
    public Optional<SentPostRecord> handleAck(Packet packet, PostPayload payload, AckOutcome outcome) throws PostRelayException {
        if (outcome instanceof AckOutcome.Failure failure) {
            // No compensation for refused posts yet; the sender's own post log stays as it is.
            if (!resolutionStore.recordAckError(packet.id(), failure.message())) {
                events.onDuplicateResolution(packet, PacketResolution.ACK_ERROR);
                return Optional.empty();
            }
            events.onNegativeAcknowledgement(packet, payload, failure.message());
            return Optional.empty();
        }
        if (outcome instanceof AckOutcome.Success success) {
            AckResult result = codec.decodeAckResult(success.result());
            Optional<SentPostRecord> sent = sentPostStore.appendForPacket(
                    packet.id(),
                    payload.creator(),
                    result.postId(),
                    payload.title(),
                    packet.destinationChain()
            );
            if (sent.isEmpty()) {
                events.onDuplicateResolution(packet, PacketResolution.ACKNOWLEDGED);
                return Optional.empty();
            }
            events.onAcknowledged(packet, sent.get());
            return sent;
        }
        throw new PostRelayException(ErrorKind.UNSUPPORTED_ACK_FORMAT,
                "the counter-party module does not implement the correct acknowledgment format");
    }
}
