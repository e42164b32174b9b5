package io.postrelay.observability;

import io.postrelay.error.PostRelayException;
import io.postrelay.model.Packet;
import io.postrelay.model.PacketResolution;
import io.postrelay.model.PostPayload;
import io.postrelay.model.PostRecord;
import io.postrelay.model.SentPostRecord;
import io.postrelay.model.TimedOutPostRecord;

import java.util.Map;

/**
 * Writes every packet lifecycle event to the chain's {@link AuditLogger}.
 */
public final class AuditPacketEventSink implements PacketEventSink {
    private final AuditLogger auditLogger;

    public AuditPacketEventSink(AuditLogger auditLogger) {
        this.auditLogger = auditLogger;
    }

    @Override
    public void onPacketSent(Packet packet, PostPayload payload) {
        auditLogger.log(AuditLogger.AuditEvent.of("packet.send", packet.id().toString(), "ok", Map.of(
                "creator", text(payload.creator()),
                "title", text(payload.title()),
                "chain", packet.destinationChain(),
                "timeout_height", packet.timeoutHeight().toString(),
                "timeout_timestamp", Long.toUnsignedString(packet.timeoutTimestamp())
        )));
    }

    @Override
    public void onPostReceived(Packet packet, PostRecord record) {
        auditLogger.log(AuditLogger.AuditEvent.of("packet.recv", packet.id().toString(), "ok", Map.of(
                "post_id", Long.toUnsignedString(record.id()),
                "creator", text(record.creator())
        )));
    }

    @Override
    public void onPacketRejected(Packet packet, PostRelayException error) {
        auditLogger.log(AuditLogger.AuditEvent.of("packet.recv", packet.id().toString(), "rejected", Map.of(
                "kind", error.kind().name(),
                "error", text(error.getMessage())
        )));
    }

    @Override
    public void onAcknowledged(Packet packet, SentPostRecord record) {
        auditLogger.log(AuditLogger.AuditEvent.of("packet.ack", packet.id().toString(), "ok", Map.of(
                "post_id", text(record.postId()),
                "chain", record.chain()
        )));
    }

    @Override
    public void onNegativeAcknowledgement(Packet packet, PostPayload payload, String message) {
        auditLogger.log(AuditLogger.AuditEvent.of("packet.ack", packet.id().toString(), "error", Map.of(
                "title", text(payload.title()),
                "chain", packet.destinationChain(),
                "error", text(message)
        )));
    }

    @Override
    public void onTimedOut(Packet packet, TimedOutPostRecord record) {
        auditLogger.log(AuditLogger.AuditEvent.of("packet.timeout", packet.id().toString(), "ok", Map.of(
                "title", text(record.title()),
                "chain", record.chain()
        )));
    }

    @Override
    public void onDuplicateResolution(Packet packet, PacketResolution attempted) {
        auditLogger.log(AuditLogger.AuditEvent.of("packet.resolve", packet.id().toString(), "duplicate", Map.of(
                "attempted", attempted.name()
        )));
    }

    private static String text(String value) {
        return value == null ? "" : value;
    }
}
