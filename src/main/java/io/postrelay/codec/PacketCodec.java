package io.postrelay.codec;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.postrelay.error.ErrorKind;
import io.postrelay.error.PostRelayException;
import io.postrelay.model.AckResult;
import io.postrelay.model.PostPayload;
import io.postrelay.util.Jsons;

import java.io.IOException;
import java.util.Objects;

/**
 * JSON codec for post packet data and acknowledgement results.
 *
 * <p>Packet data is wrapped in a typed envelope so the receiving module can tell a post packet
 * apart from any other packet sent on the same port:
 *
 * <pre>{"ibcPostPacket":{"content":"C","creator":"alice","title":"T"}}</pre>
 *
 * <p>The acknowledgement result is {@code {"postID":"7"}}. Keys are sorted and output is compact,
 * so independently built chains produce identical bytes for equal values.
 */
public final class PacketCodec {
    public static final PacketCodec JSON = new PacketCodec(Jsons.wire());

    private final ObjectMapper mapper;

    public PacketCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public byte[] encodePostPacket(PostPayload payload) throws PostRelayException {
        try {
            return mapper.writeValueAsBytes(new PostPacketData(payload));
        } catch (JsonProcessingException e) {
            throw new PostRelayException(ErrorKind.ENCODING_ERROR, "cannot marshal the packet: " + e.getOriginalMessage(), e);
        }
    }

    public PostPayload decodePostPacket(byte[] data) throws PostRelayException {
        PostPacketData envelope;
        try {
            envelope = mapper.readValue(data, PostPacketData.class);
        } catch (IOException e) {
            throw new PostRelayException(ErrorKind.UNKNOWN_PACKET_TYPE, "cannot unmarshal packet data: " + e.getMessage(), e);
        }
        if (envelope == null || envelope.ibcPostPacket() == null) {
            throw new PostRelayException(ErrorKind.UNKNOWN_PACKET_TYPE, "unrecognized packet type");
        }
        return envelope.ibcPostPacket();
    }

    public byte[] encodeAckResult(AckResult result) throws PostRelayException {
        try {
            return mapper.writeValueAsBytes(result);
        } catch (JsonProcessingException e) {
            throw new PostRelayException(ErrorKind.ENCODING_ERROR, "cannot marshal acknowledgment: " + e.getOriginalMessage(), e);
        }
    }

    public AckResult decodeAckResult(byte[] data) throws PostRelayException {
        AckResult result;
        try {
            result = mapper.readValue(data, AckResult.class);
        } catch (IOException e) {
            throw new PostRelayException(ErrorKind.ACK_DECODE_ERROR, "cannot unmarshal acknowledgment", e);
        }
        if (result == null || result.postId() == null) {
            throw new PostRelayException(ErrorKind.ACK_DECODE_ERROR, "cannot unmarshal acknowledgment: missing postID");
        }
        return result;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record PostPacketData(@JsonProperty("ibcPostPacket") PostPayload ibcPostPacket) {
    }
}
