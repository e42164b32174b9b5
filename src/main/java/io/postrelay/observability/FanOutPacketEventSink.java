package io.postrelay.observability;

import io.postrelay.error.PostRelayException;
import io.postrelay.model.Packet;
import io.postrelay.model.PacketResolution;
import io.postrelay.model.PostPayload;
import io.postrelay.model.PostRecord;
import io.postrelay.model.SentPostRecord;
import io.postrelay.model.TimedOutPostRecord;

import java.util.List;
import java.util.Objects;

final class FanOutPacketEventSink implements PacketEventSink {
    private final List<PacketEventSink> sinks;

    FanOutPacketEventSink(PacketEventSink... sinks) {
        this.sinks = List.of(sinks);
        this.sinks.forEach(Objects::requireNonNull);
    }

    @Override
    public void onPacketSent(Packet packet, PostPayload payload) {
        sinks.forEach(s -> s.onPacketSent(packet, payload));
    }

    @Override
    public void onPostReceived(Packet packet, PostRecord record) {
        sinks.forEach(s -> s.onPostReceived(packet, record));
    }

    @Override
    public void onPacketRejected(Packet packet, PostRelayException error) {
        sinks.forEach(s -> s.onPacketRejected(packet, error));
    }

    @Override
    public void onAcknowledged(Packet packet, SentPostRecord record) {
        sinks.forEach(s -> s.onAcknowledged(packet, record));
    }

    @Override
    public void onNegativeAcknowledgement(Packet packet, PostPayload payload, String message) {
        sinks.forEach(s -> s.onNegativeAcknowledgement(packet, payload, message));
    }

    @Override
    public void onTimedOut(Packet packet, TimedOutPostRecord record) {
        sinks.forEach(s -> s.onTimedOut(packet, record));
    }

    @Override
    public void onDuplicateResolution(Packet packet, PacketResolution attempted) {
        sinks.forEach(s -> s.onDuplicateResolution(packet, attempted));
    }
}
