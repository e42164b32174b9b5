package io.postrelay.runtime;

import io.postrelay.channel.CapabilityPaths;
import io.postrelay.channel.ChannelEnd;
import io.postrelay.channel.ChannelOrder;
import io.postrelay.channel.InMemoryCapabilityKeeper;
import io.postrelay.channel.InMemoryChannelKeeper;
import io.postrelay.config.PostRelayConfig;
import io.postrelay.error.ErrorKind;
import io.postrelay.error.PostRelayException;
import io.postrelay.model.Height;
import io.postrelay.model.Packet;
import io.postrelay.model.PostRecord;
import io.postrelay.testsupport.TempChains;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class PostRelayRuntimeTest {
    private static final long NOW = 5_000_000_000L;

    private Path root;

    @BeforeEach
    void setUp() throws Exception {
        root = Files.createTempDirectory("postrelay-test-runtime-");
    }

    @AfterEach
    void tearDown() throws Exception {
        TempChains.deleteRecursively(root);
    }

    @Test
    void createPostAppendsLocalPost() throws Exception {
        PostRelayRuntime runtime = runtime(new InMemoryChannelKeeper(), new InMemoryCapabilityKeeper());

        PostRecord post = runtime.createPost("alice", "Hello", null);

        Assertions.assertEquals(new PostRecord(0L, "alice", "Hello", ""), post);
        Assertions.assertEquals(1L, runtime.stats().posts());
    }

    @Test
    void localCreatorWithDashIsRejected() {
        PostRelayRuntime runtime = runtime(new InMemoryChannelKeeper(), new InMemoryCapabilityKeeper());

        PostRelayException e = Assertions.assertThrows(PostRelayException.class,
                () -> runtime.createPost("post-channel-0-alice", "spoof", ""));

        Assertions.assertEquals(ErrorKind.VALIDATION_ERROR, e.kind());
        Assertions.assertEquals(0L, runtime.stats().posts());
    }

    @Test
    void sendPostWithoutTimeoutUsesRelativeTimestamp() throws Exception {
        InMemoryChannelKeeper channels = new InMemoryChannelKeeper();
        InMemoryCapabilityKeeper capabilities = new InMemoryCapabilityKeeper();
        PostRelayRuntime runtime = runtime(channels, capabilities);
        openChannel(channels, capabilities);

        Packet packet = runtime.sendPost(new PostRelayRuntime.SendPostRequest("alice", "T", "C", "post", "channel-0", null, 0L));

        Assertions.assertEquals(Height.ZERO, packet.timeoutHeight());
        Assertions.assertEquals(NOW + 600_000_000_000L, packet.timeoutTimestamp());
    }

    @Test
    void explicitTimeoutIsKept() throws Exception {
        InMemoryChannelKeeper channels = new InMemoryChannelKeeper();
        InMemoryCapabilityKeeper capabilities = new InMemoryCapabilityKeeper();
        PostRelayRuntime runtime = runtime(channels, capabilities);
        openChannel(channels, capabilities);

        Packet packet = runtime.sendPost(new PostRelayRuntime.SendPostRequest(
                "alice", "T", "C", "post", "channel-0", new Height(2L, 40L), 0L));

        Assertions.assertEquals(new Height(2L, 40L), packet.timeoutHeight());
        Assertions.assertEquals(0L, packet.timeoutTimestamp());
    }

    @Test
    void sendPostOnUnknownChannelFails() {
        PostRelayRuntime runtime = runtime(new InMemoryChannelKeeper(), new InMemoryCapabilityKeeper());

        PostRelayException e = Assertions.assertThrows(PostRelayException.class, () -> runtime.sendPost(
                new PostRelayRuntime.SendPostRequest("alice", "T", "C", "post", "channel-9", null, 0L)));

        Assertions.assertEquals(ErrorKind.CHANNEL_NOT_FOUND, e.kind());
    }

    @Test
    void settingsFileOverridesDefaults() throws Exception {
        PostRelayConfig config = PostRelayConfig.fromRoot(root.toString(), "earth");
        Files.createDirectories(config.rootDir());
        Files.writeString(config.settingsFile(),
                "{\"packetTimeoutRelativeMs\":1000,\"auditEnabled\":false,\"defaultListLimit\":2}",
                StandardCharsets.UTF_8);
        InMemoryChannelKeeper channels = new InMemoryChannelKeeper();
        InMemoryCapabilityKeeper capabilities = new InMemoryCapabilityKeeper();
        PostRelayRuntime runtime = new PostRelayRuntime(config, channels, capabilities, () -> NOW);
        runtime.init();
        openChannel(channels, capabilities);

        Packet packet = runtime.sendPost(new PostRelayRuntime.SendPostRequest("alice", "T", "C", "post", "channel-0", Height.ZERO, 0L));
        for (int i = 0; i < 3; i++) {
            runtime.createPost("alice", "post " + i, "");
        }

        Assertions.assertEquals(NOW + 1_000_000_000L, packet.timeoutTimestamp());
        Assertions.assertTrue(runtime.auditLogger().isEmpty());
        Assertions.assertEquals(2, runtime.listPosts(0, 0).size());
        Assertions.assertEquals(3, runtime.listPosts(10, 0).size());
    }

    @Test
    void auditLogRecordsSentPackets() throws Exception {
        InMemoryChannelKeeper channels = new InMemoryChannelKeeper();
        InMemoryCapabilityKeeper capabilities = new InMemoryCapabilityKeeper();
        PostRelayRuntime runtime = runtime(channels, capabilities);
        openChannel(channels, capabilities);

        runtime.sendPost(new PostRelayRuntime.SendPostRequest("alice", "T", "C", "post", "channel-0", null, 0L));

        Assertions.assertEquals("packet.send",
                runtime.auditLogger().orElseThrow().tail(1).get(0).path("action").asText());
    }

    private PostRelayRuntime runtime(InMemoryChannelKeeper channels, InMemoryCapabilityKeeper capabilities) {
        PostRelayRuntime runtime = new PostRelayRuntime(
                PostRelayConfig.fromRoot(root.toString(), "earth"), channels, capabilities, () -> NOW);
        runtime.init();
        return runtime;
    }

    private static void openChannel(InMemoryChannelKeeper channels, InMemoryCapabilityKeeper capabilities) {
        channels.openChannel(new ChannelEnd("post", "channel-0", "post", "channel-1", ChannelOrder.UNORDERED));
        capabilities.claim(CapabilityPaths.channelCapabilityPath("post", "channel-0"));
    }
}
