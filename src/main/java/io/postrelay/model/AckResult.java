package io.postrelay.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Success payload returned by the receiving chain: the id it gave the replicated post. */
public record AckResult(@JsonProperty("postID") String postId) {
    public static AckResult of(long postId) {
        return new AckResult(Long.toUnsignedString(postId));
    }
}
