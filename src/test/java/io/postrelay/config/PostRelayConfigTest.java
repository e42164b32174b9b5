package io.postrelay.config;

import io.postrelay.testsupport.TempChains;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

class PostRelayConfigTest {

    @Test
    void chainLivesUnderRootChainsDirectory() throws Exception {
        Path root = Files.createTempDirectory("postrelay-test-config-");
        try {
            PostRelayConfig config = PostRelayConfig.fromRoot(root.toString(), "Mars Base");
            Path base = root.toAbsolutePath().normalize();

            Assertions.assertEquals("mars-base", config.chainId());
            Assertions.assertEquals(base, config.rootBaseDir());
            Assertions.assertEquals(base.resolve("chains").resolve("mars-base"), config.rootDir());
            Assertions.assertEquals(config.rootDir().resolve("postrelay.db"), config.dbFile());
            Assertions.assertEquals(config.rootDir().resolve(PostRelayConfig.SETTINGS_FILE), config.settingsFile());
        } finally {
            TempChains.deleteRecursively(root);
        }
    }

    @Test
    void chainIdIsSanitized() {
        Assertions.assertEquals(PostRelayConfig.DEFAULT_CHAIN_ID, PostRelayConfig.sanitizeChainId(null));
        Assertions.assertEquals(PostRelayConfig.DEFAULT_CHAIN_ID, PostRelayConfig.sanitizeChainId("  "));
        Assertions.assertEquals("a-b", PostRelayConfig.sanitizeChainId("a//b"));
        Assertions.assertEquals("chain.hidden", PostRelayConfig.sanitizeChainId(".hidden"));
    }

    @Test
    void settingsFallBackPerField() throws Exception {
        Path root = Files.createTempDirectory("postrelay-test-settings-");
        try {
            Assertions.assertEquals(RelaySettings.defaults(), RelaySettings.load(root.resolve("missing.json")));

            Path file = root.resolve("settings.json");
            Files.writeString(file, "{\"defaultListLimit\":5,\"packetTimeoutRelativeMs\":-1,\"extra\":true}", StandardCharsets.UTF_8);
            RelaySettings settings = RelaySettings.load(file);

            Assertions.assertEquals(5, settings.defaultListLimit());
            Assertions.assertEquals(RelaySettings.DEFAULT_PACKET_TIMEOUT_RELATIVE_MS, settings.packetTimeoutRelativeMs());
            Assertions.assertTrue(settings.auditEnabled());
        } finally {
            TempChains.deleteRecursively(root);
        }
    }
}
