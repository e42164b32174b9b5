package io.postrelay.observability;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.postrelay.util.Hashing;
import io.postrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON lines audit file. Each row carries the hash of the previous row, so a removed
 * or edited line breaks {@link #verify()}.
 */
public final class AuditLogger {
    private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
    };

    private final Path auditFile;
    private final String chainId;
    private String previousHash;

    public AuditLogger(Path auditFile, String chainId) {
        this.auditFile = auditFile;
        this.chainId = chainId == null || chainId.isBlank() ? "unknown" : chainId.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("chain_id", chainId);
        row.put("action", event.action());
        row.put("packet", event.packet());
        row.put("result", event.result());
        row.put("details", event.details() == null ? Map.of() : event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized List<JsonNode> tail(int limit) {
        List<JsonNode> rows = readRows();
        int from = Math.max(0, rows.size() - Math.max(1, limit));
        return rows.subList(from, rows.size());
    }

    /** Recomputes the hash chain from the first row. */
    public synchronized VerifyResult verify() {
        String expectedPrev = "";
        int checked = 0;
        for (JsonNode node : readRows()) {
            String prev = node.path("prev_hash").asText("");
            String hash = node.path("hash").asText("");
            Map<String, Object> row = Jsons.mapper().convertValue(node, ROW_TYPE);
            row.remove("hash");
            if (!expectedPrev.equals(prev) || !Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                return new VerifyResult(false, checked, checked + 1);
            }
            expectedPrev = hash;
            checked++;
        }
        return new VerifyResult(true, checked, -1);
    }

    private List<JsonNode> readRows() {
        List<JsonNode> out = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(Jsons.mapper().readTree(line));
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<JsonNode> rows = readRows();
        if (rows.isEmpty()) {
            return "";
        }
        return rows.get(rows.size() - 1).path("hash").asText("");
    }

    public record AuditEvent(
            String action,
            String packet,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String packet, String result, Map<String, Object> details) {
            return new AuditEvent(action, packet, result, details == null ? Map.of() : details);
        }
    }

    /**
     * @param firstBadLine 1-based line of the first broken row, or -1 when the chain is intact
     */
    public record VerifyResult(boolean valid, int checkedRows, int firstBadLine) {
    }
}
