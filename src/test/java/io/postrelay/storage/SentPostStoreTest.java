package io.postrelay.storage;

import io.postrelay.model.PacketId;
import io.postrelay.model.PacketResolution;
import io.postrelay.model.SentPostRecord;
import io.postrelay.testsupport.TempChains;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalLong;

class SentPostStoreTest {

    @Test
    void appendClaimsPacketResolution() throws Exception {
        Path root = Files.createTempDirectory("postrelay-test-sent-");
        try {
            Database db = TempChains.database(root, "earth");
            SentPostStore store = new SentPostStore(db);
            PacketResolutionStore resolutions = new PacketResolutionStore(db);
            PacketId packetId = new PacketId("post", "channel-0", 4L);

            SentPostRecord sent = store.appendForPacket(packetId, "bob", "7", "Hi", "post-channel-1").orElseThrow();

            Assertions.assertEquals(new SentPostRecord(0L, "bob", "7", "Hi", "post-channel-1"), sent);
            Assertions.assertEquals(sent, store.get(0L).orElseThrow());
            Assertions.assertEquals(PacketResolution.ACKNOWLEDGED, resolutions.find(packetId).orElseThrow().outcome());
            Assertions.assertEquals(OptionalLong.of(4L), resolutions.lastSequence("post", "channel-0"));
            Assertions.assertTrue(resolutions.lastSequence("post", "channel-9").isEmpty());
        } finally {
            TempChains.deleteRecursively(root);
        }
    }

    @Test
    void alreadyResolvedPacketWritesNothing() throws Exception {
        Path root = Files.createTempDirectory("postrelay-test-sent-");
        try {
            Database db = TempChains.database(root, "earth");
            SentPostStore store = new SentPostStore(db);
            PacketResolutionStore resolutions = new PacketResolutionStore(db);
            PacketId packetId = new PacketId("post", "channel-0", 1L);

            Assertions.assertTrue(resolutions.recordAckError(packetId, "refused"));
            Assertions.assertFalse(resolutions.recordAckError(packetId, "again"));
            Assertions.assertTrue(store.appendForPacket(packetId, "bob", "7", "Hi", "post-channel-1").isEmpty());
            Assertions.assertEquals(0L, store.count());
        } finally {
            TempChains.deleteRecursively(root);
        }
    }

    @Test
    void lastSequenceComparesUnsigned() throws Exception {
        Path root = Files.createTempDirectory("postrelay-test-sent-");
        try {
            PacketResolutionStore resolutions = new PacketResolutionStore(TempChains.database(root, "earth"));
            resolutions.recordAckError(new PacketId("post", "channel-0", 5L), "refused");
            resolutions.recordAckError(new PacketId("post", "channel-0", Long.MIN_VALUE), "refused");
            resolutions.recordAckError(new PacketId("post", "channel-0", Long.MIN_VALUE + 3L), "refused");
            resolutions.recordAckError(new PacketId("post", "channel-0", Long.MAX_VALUE), "refused");

            Assertions.assertEquals(OptionalLong.of(Long.MIN_VALUE + 3L), resolutions.lastSequence("post", "channel-0"));
        } finally {
            TempChains.deleteRecursively(root);
        }
    }
}
