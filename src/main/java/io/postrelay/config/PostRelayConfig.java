package io.postrelay.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Filesystem layout of one chain. Every chain gets its own root so that the post, sent-post and
 * timed-out-post logs of two chains never share a database file.
 */
public final class PostRelayConfig {
    public static final String DEFAULT_CHAIN_ID = "planet";
    public static final String CHAINS_DIR = "chains";
    public static final String SETTINGS_FILE = "postrelay-settings.json";

    private final Path rootDir;
    private final Path rootBaseDir;
    private final String chainId;

    public PostRelayConfig(Path rootDir, Path rootBaseDir, String chainId) {
        this.rootDir = rootDir;
        this.rootBaseDir = rootBaseDir;
        this.chainId = chainId;
    }

    public static PostRelayConfig fromRoot(String root) {
        return fromRoot(root, DEFAULT_CHAIN_ID);
    }

    public static PostRelayConfig fromRoot(String root, String chainId) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get("data")
                : Paths.get(root);
        Path base = resolved.toAbsolutePath().normalize();
        String safeChainId = sanitizeChainId(chainId);
        return new PostRelayConfig(base.resolve(CHAINS_DIR).resolve(safeChainId), base, safeChainId);
    }

    static String sanitizeChainId(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_CHAIN_ID : raw.trim().toLowerCase();
        StringBuilder sb = new StringBuilder(normalized.length());
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z')
                    || (ch >= '0' && ch <= '9')
                    || ch == '_' || ch == '-' || ch == '.';
            sb.append(ok ? ch : '-');
        }
        String value = sb.toString();
        while (value.contains("--")) {
            value = value.replace("--", "-");
        }
        if (value.startsWith(".")) {
            value = "chain" + value;
        }
        return value;
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path rootBaseDir() {
        return rootBaseDir;
    }

    public String chainId() {
        return chainId;
    }

    public Path dbFile() {
        return rootDir.resolve("postrelay.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }
}
