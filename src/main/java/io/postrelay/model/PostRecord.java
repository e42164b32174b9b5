package io.postrelay.model;

public record PostRecord(
        long id,
        String creator,
        String title,
        String content
) {
}
