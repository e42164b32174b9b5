package io.postrelay.channel;

import io.postrelay.error.ErrorKind;
import io.postrelay.error.PostRelayException;
import io.postrelay.model.Height;
import io.postrelay.model.Packet;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

final class InMemoryChannelKeeperTest {
    private static final String CAP_PATH = "capabilities/ports/post/channels/channel-0";

    private InMemoryChannelKeeper keeper;
    private Capability capability;

    @BeforeEach
    void setUp() {
        keeper = new InMemoryChannelKeeper();
        keeper.openChannel(new ChannelEnd("post", "channel-0", "post", "channel-1", ChannelOrder.ORDERED), 5L);
        capability = new InMemoryCapabilityKeeper().claim(CapabilityPaths.channelCapabilityPath("post", "channel-0"));
    }

    @Test
    void capabilityPathFollowsPortAndChannel() {
        Assertions.assertEquals(CAP_PATH, capability.path());
    }

    @Test
    void acceptedPacketAdvancesSequenceAndNotifiesListener() throws Exception {
        List<Packet> seen = new ArrayList<>();
        keeper.setListener(seen::add);

        Packet packet = packet(5L, "channel-1", new Height(1L, 10L), 0L);
        keeper.sendPacket(capability, packet);

        Assertions.assertEquals(6L, keeper.nextSequenceSend("post", "channel-0").getAsLong());
        Assertions.assertEquals(List.of(packet), seen);
        Assertions.assertEquals(List.of(packet), keeper.committedPackets());
    }

    @Test
    void wrongCapabilityIsRejected() {
        Capability other = new Capability(9L, "capabilities/ports/post/channels/channel-7");
        assertKind(ErrorKind.CAPABILITY_MISSING, other, packet(5L, "channel-1", new Height(1L, 10L), 0L));
    }

    @Test
    void mismatchedDestinationIsRejected() {
        assertKind(ErrorKind.PACKET_REJECTED, capability, packet(5L, "channel-4", new Height(1L, 10L), 0L));
    }

    @Test
    void outOfOrderSequenceIsRejected() {
        assertKind(ErrorKind.PACKET_REJECTED, capability, packet(6L, "channel-1", new Height(1L, 10L), 0L));
    }

    @Test
    void packetWithoutAnyTimeoutIsRejected() {
        assertKind(ErrorKind.PACKET_REJECTED, capability, packet(5L, "channel-1", Height.ZERO, 0L));
    }

    @Test
    void clearedSequenceIsSequenceNotFound() {
        keeper.clearSequence("post", "channel-0");
        Assertions.assertTrue(keeper.nextSequenceSend("post", "channel-0").isEmpty());
        assertKind(ErrorKind.SEQUENCE_NOT_FOUND, capability, packet(5L, "channel-1", Height.ZERO, 7L));
    }

    @Test
    void orderedChannelReceivesOnlyInSequence() throws Exception {
        keeper.expectSequenceRecv("post", "channel-0", 3L);

        PostRelayException skipped = Assertions.assertThrows(PostRelayException.class,
                () -> keeper.recvPacket(inbound(4L)));
        Assertions.assertEquals(ErrorKind.PACKET_REJECTED, skipped.kind());

        keeper.recvPacket(inbound(3L));
        keeper.recvPacket(inbound(4L));
        PostRelayException replayed = Assertions.assertThrows(PostRelayException.class,
                () -> keeper.recvPacket(inbound(4L)));
        Assertions.assertEquals(ErrorKind.PACKET_REJECTED, replayed.kind());
    }

    @Test
    void unorderedChannelReceivesAnyOrderButEachSequenceOnce() throws Exception {
        keeper.openChannel(new ChannelEnd("post", "channel-5", "post", "channel-6", ChannelOrder.UNORDERED));
        Packet later = new Packet(9L, "post", "channel-6", "post", "channel-5", Height.ZERO, 1L, new byte[]{1});
        Packet earlier = new Packet(2L, "post", "channel-6", "post", "channel-5", Height.ZERO, 1L, new byte[]{1});

        keeper.recvPacket(later);
        keeper.recvPacket(earlier);

        PostRelayException e = Assertions.assertThrows(PostRelayException.class, () -> keeper.recvPacket(later));
        Assertions.assertEquals(ErrorKind.PACKET_REJECTED, e.kind());
    }

    @Test
    void packetFromStrangerIsRejected() {
        Packet stranger = new Packet(1L, "post", "channel-9", "post", "channel-0", Height.ZERO, 1L, new byte[]{1});
        PostRelayException e = Assertions.assertThrows(PostRelayException.class, () -> keeper.recvPacket(stranger));
        Assertions.assertEquals(ErrorKind.PACKET_REJECTED, e.kind());
    }

    @Test
    void closedChannelRefusesSendAndReceive() {
        keeper.closeChannel("post", "channel-0");

        Assertions.assertTrue(keeper.channel("post", "channel-0").isEmpty());
        assertKind(ErrorKind.CHANNEL_NOT_FOUND, capability, packet(5L, "channel-1", new Height(1L, 10L), 0L));
        PostRelayException e = Assertions.assertThrows(PostRelayException.class, () -> keeper.recvPacket(inbound(1L)));
        Assertions.assertEquals(ErrorKind.CHANNEL_NOT_FOUND, e.kind());
    }

    private void assertKind(ErrorKind expected, Capability cap, Packet packet) {
        PostRelayException e = Assertions.assertThrows(PostRelayException.class, () -> keeper.sendPacket(cap, packet));
        Assertions.assertEquals(expected, e.kind());
        Assertions.assertTrue(keeper.committedPackets().isEmpty());
    }

    private static Packet packet(long sequence, String destChannel, Height timeoutHeight, long timeoutTimestamp) {
        return new Packet(sequence, "post", "channel-0", "post", destChannel, timeoutHeight, timeoutTimestamp, new byte[]{1});
    }

    private static Packet inbound(long sequence) {
        return new Packet(sequence, "post", "channel-1", "post", "channel-0", new Height(1L, 10L), 0L, new byte[]{1});
    }
}
