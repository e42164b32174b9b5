package io.postrelay.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.postrelay.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables read from {@code postrelay-settings.json}. Missing fields fall back to {@link #defaults()}.
 */
public record RelaySettings(
        long packetTimeoutRelativeMs,
        boolean auditEnabled,
        int defaultListLimit
) {
    public static final long DEFAULT_PACKET_TIMEOUT_RELATIVE_MS = 10L * 60L * 1_000L;
    public static final int DEFAULT_LIST_LIMIT = 100;

    public static RelaySettings defaults() {
        return new RelaySettings(DEFAULT_PACKET_TIMEOUT_RELATIVE_MS, true, DEFAULT_LIST_LIMIT);
    }

    public static RelaySettings load(Path file) {
        RelaySettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return new RelaySettings(
                    raw.packetTimeoutRelativeMs() == null || raw.packetTimeoutRelativeMs() <= 0L
                            ? defaults.packetTimeoutRelativeMs()
                            : raw.packetTimeoutRelativeMs(),
                    raw.auditEnabled() == null ? defaults.auditEnabled() : raw.auditEnabled(),
                    raw.defaultListLimit() == null || raw.defaultListLimit() <= 0
                            ? defaults.defaultListLimit()
                            : raw.defaultListLimit()
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to read settings: " + file, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private record SettingsFile(
            Long packetTimeoutRelativeMs,
            Boolean auditEnabled,
            Integer defaultListLimit
    ) {
    }
}
