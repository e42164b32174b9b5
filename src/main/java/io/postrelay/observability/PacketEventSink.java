package io.postrelay.observability;

import io.postrelay.error.PostRelayException;
import io.postrelay.model.Packet;
import io.postrelay.model.PacketResolution;
import io.postrelay.model.PostPayload;
import io.postrelay.model.PostRecord;
import io.postrelay.model.SentPostRecord;
import io.postrelay.model.TimedOutPostRecord;

/**
 * Receives packet lifecycle events from the relay components. Implementations can provide
 * logging, auditing or metrics and must not throw.
 */
public interface PacketEventSink {
    /**
     * Called after the transport accepted an outbound packet.
     * @param packet the committed packet
     * @param payload the post it carries
     */
    void onPacketSent(Packet packet, PostPayload payload);

    /**
     * Called after a post received from another chain was appended.
     * @param packet the inbound packet
     * @param record the stored post, with its prefixed creator
     */
    void onPostReceived(Packet packet, PostRecord record);

    /**
     * Called when an inbound packet could not be applied and an error acknowledgement goes back.
     * @param packet the inbound packet
     * @param error why it was rejected
     */
    void onPacketRejected(Packet packet, PostRelayException error);

    /**
     * Called after a positive acknowledgement was recorded as a sent post.
     * @param packet the originated packet
     * @param record the stored sent post
     */
    void onAcknowledged(Packet packet, SentPostRecord record);

    /**
     * Called when the counterparty answered with an error acknowledgement. No store is changed for
     * this outcome; this hook is the only place the message surfaces.
     * @param packet the originated packet
     * @param payload the post it carried
     * @param message the error reported by the counterparty
     */
    void onNegativeAcknowledgement(Packet packet, PostPayload payload, String message);

    /**
     * Called after a timeout was recorded as a timed-out post.
     * @param packet the originated packet
     * @param record the stored timed-out post
     */
    void onTimedOut(Packet packet, TimedOutPostRecord record);

    /**
     * Called when a packet that already reached a terminal state is reconciled again.
     * @param packet the originated packet
     * @param attempted the outcome that was refused
     */
    void onDuplicateResolution(Packet packet, PacketResolution attempted);

    static PacketEventSink both(PacketEventSink first, PacketEventSink second) {
        return new FanOutPacketEventSink(first, second);
    }
}
