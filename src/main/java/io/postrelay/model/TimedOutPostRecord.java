package io.postrelay.model;

public record TimedOutPostRecord(
        long id,
        String creator,
        String title,
        String chain
) {
}
