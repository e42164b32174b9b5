package io.postrelay.codec;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.postrelay.error.ErrorKind;
import io.postrelay.error.PostRelayException;
import io.postrelay.model.AckOutcome;
import io.postrelay.util.Jsons;

import java.io.IOException;
import java.util.Base64;
import java.util.Objects;

/**
 * Channel acknowledgement envelope: {@code {"result":"<base64>"}} or {@code {"error":"<message>"}}.
 */
public final class AcknowledgementCodec {
    public static final AcknowledgementCodec JSON = new AcknowledgementCodec(Jsons.wire());

    private static final String RESULT = "result";
    private static final String ERROR = "error";

    private final ObjectMapper mapper;

    public AcknowledgementCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public byte[] encode(AckOutcome outcome) throws PostRelayException {
        ObjectNode node = mapper.createObjectNode();
        if (outcome instanceof AckOutcome.Success success) {
            node.put(RESULT, Base64.getEncoder().encodeToString(success.result()));
        } else if (outcome instanceof AckOutcome.Failure failure) {
            node.put(ERROR, failure.message());
        } else {
            throw new PostRelayException(ErrorKind.UNSUPPORTED_ACK_FORMAT, "cannot encode acknowledgement: " + outcome);
        }
        try {
            return mapper.writeValueAsBytes(node);
        } catch (IOException e) {
            throw new PostRelayException(ErrorKind.ENCODING_ERROR, "cannot marshal acknowledgement", e);
        }
    }

    public AckOutcome decode(byte[] bytes) throws PostRelayException {
        JsonNode node;
        try {
            node = mapper.readTree(bytes);
        } catch (IOException e) {
            throw new PostRelayException(ErrorKind.UNSUPPORTED_ACK_FORMAT,
                    "the counter-party module does not implement the correct acknowledgment format", e);
        }
        if (node == null || !node.isObject()) {
            throw unsupported();
        }
        JsonNode result = node.get(RESULT);
        JsonNode error = node.get(ERROR);
        if (result != null && error == null && result.isTextual()) {
            try {
                return AckOutcome.success(Base64.getDecoder().decode(result.asText()));
            } catch (IllegalArgumentException e) {
                throw new PostRelayException(ErrorKind.UNSUPPORTED_ACK_FORMAT, "acknowledgement result is not base64", e);
            }
        }
        if (error != null && result == null && error.isTextual()) {
            return AckOutcome.failure(error.asText());
        }
        throw unsupported();
    }

    private static PostRelayException unsupported() {
        return new PostRelayException(ErrorKind.UNSUPPORTED_ACK_FORMAT,
                "the counter-party module does not implement the correct acknowledgment format");
    }
}
