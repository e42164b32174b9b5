package io.postrelay.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.postrelay.error.ErrorKind;
import io.postrelay.error.PostRelayException;

/**
 * Application content replicated to the counterparty chain.
 */
public record PostPayload(
        @JsonProperty("creator") String creator,
        @JsonProperty("title") String title,
        @JsonProperty("content") String content
) {
    public PostPayload {
        creator = creator == null ? "" : creator;
        title = title == null ? "" : title;
        content = content == null ? "" : content;
    }

    public void validate() throws PostRelayException {
        if (creator == null || creator.isBlank()) {
            throw new PostRelayException(ErrorKind.VALIDATION_ERROR, "post creator cannot be empty");
        }
        if (title == null || title.isBlank()) {
            throw new PostRelayException(ErrorKind.VALIDATION_ERROR, "post title cannot be empty");
        }
    }
}
