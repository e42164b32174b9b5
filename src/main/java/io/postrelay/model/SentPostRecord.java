package io.postrelay.model;

/**
 * A post the counterparty acknowledged. {@code postId} is the id the counterparty assigned and
 * {@code chain} is {@code destPort-destChannel}.
 */
public record SentPostRecord(
        long id,
        String creator,
        String postId,
        String title,
        String chain
) {
}
