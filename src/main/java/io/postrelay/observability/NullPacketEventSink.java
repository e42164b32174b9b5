package io.postrelay.observability;

import io.postrelay.error.PostRelayException;
import io.postrelay.model.Packet;
import io.postrelay.model.PacketResolution;
import io.postrelay.model.PostPayload;
import io.postrelay.model.PostRecord;
import io.postrelay.model.SentPostRecord;
import io.postrelay.model.TimedOutPostRecord;

/**
 * No-op implementation of PacketEventSink.
 */
public final class NullPacketEventSink implements PacketEventSink {
    public static final NullPacketEventSink INSTANCE = new NullPacketEventSink();

    private NullPacketEventSink() {}

    @Override
    public void onPacketSent(Packet packet, PostPayload payload) {}

    @Override
    public void onPostReceived(Packet packet, PostRecord record) {}

    @Override
    public void onPacketRejected(Packet packet, PostRelayException error) {}

    @Override
    public void onAcknowledged(Packet packet, SentPostRecord record) {}

    @Override
    public void onNegativeAcknowledgement(Packet packet, PostPayload payload, String message) {}

    @Override
    public void onTimedOut(Packet packet, TimedOutPostRecord record) {}

    @Override
    public void onDuplicateResolution(Packet packet, PacketResolution attempted) {}
}
