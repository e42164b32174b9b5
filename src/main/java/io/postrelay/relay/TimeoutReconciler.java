package io.postrelay.relay;

import io.postrelay.model.Packet;
import io.postrelay.model.PacketResolution;
import io.postrelay.model.PostPayload;
import io.postrelay.model.TimedOutPostRecord;
import io.postrelay.observability.PacketEventSink;
import io.postrelay.storage.TimedOutPostStore;

import java.util.Optional;

public final class TimeoutReconciler {
    private final TimedOutPostStore timedOutPostStore;
    private final PacketEventSink events;

    public TimeoutReconciler(TimedOutPostStore timedOutPostStore, PacketEventSink events) {
        this.timedOutPostStore = timedOutPostStore;
        this.events = events;
    }

    /**
     * Records that {@code packet} never reached the counterparty.
     *
     * @return the timed-out post, or empty if the packet was already resolved another way
     */
    public Optional<TimedOutPostRecord> handleTimeout(Packet packet, PostPayload payload) {
        Optional<TimedOutPostRecord> timedOut = timedOutPostStore.appendForPacket(
                packet.id(),
                payload.creator(),
                payload.title(),
                packet.destinationChain()
        );
        if (timedOut.isEmpty()) {
            events.onDuplicateResolution(packet, PacketResolution.TIMED_OUT);
            return Optional.empty();
        }
        events.onTimedOut(packet, timedOut.get());
        return timedOut;
    }
}
