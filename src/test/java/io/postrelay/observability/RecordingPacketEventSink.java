package io.postrelay.observability;

import io.postrelay.error.PostRelayException;
import io.postrelay.model.Packet;
import io.postrelay.model.PacketResolution;
import io.postrelay.model.PostPayload;
import io.postrelay.model.PostRecord;
import io.postrelay.model.SentPostRecord;
import io.postrelay.model.TimedOutPostRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Test sink that records events for assertions.
 */
public final class RecordingPacketEventSink implements PacketEventSink {
    private final List<String> events = new ArrayList<>();
    private final List<String> negativeAckMessages = new ArrayList<>();

    @Override
    public synchronized void onPacketSent(Packet packet, PostPayload payload) {
        events.add("sent:" + packet.id());
    }

    @Override
    public synchronized void onPostReceived(Packet packet, PostRecord record) {
        events.add("received:" + packet.id());
    }

    @Override
    public synchronized void onPacketRejected(Packet packet, PostRelayException error) {
        events.add("rejected:" + packet.id() + ":" + error.kind());
    }

    @Override
    public synchronized void onAcknowledged(Packet packet, SentPostRecord record) {
        events.add("acknowledged:" + packet.id());
    }

    @Override
    public synchronized void onNegativeAcknowledgement(Packet packet, PostPayload payload, String message) {
        events.add("nack:" + packet.id());
        negativeAckMessages.add(message);
    }

    @Override
    public synchronized void onTimedOut(Packet packet, TimedOutPostRecord record) {
        events.add("timeout:" + packet.id());
    }

    @Override
    public synchronized void onDuplicateResolution(Packet packet, PacketResolution attempted) {
        events.add("duplicate:" + packet.id() + ":" + attempted);
    }

    public synchronized List<String> events() {
        return new ArrayList<>(events);
    }

    public synchronized List<String> negativeAckMessages() {
        return new ArrayList<>(negativeAckMessages);
    }
}
