package io.postrelay.codec;

import io.postrelay.error.ErrorKind;
import io.postrelay.error.PostRelayException;
import io.postrelay.model.AckResult;
import io.postrelay.model.PostPayload;
import io.postrelay.testsupport.FailingMapper;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

final class PacketCodecTest {

    @Test
    void postPacketUsesSortedTypedEnvelope() throws Exception {
        byte[] bytes = PacketCodec.JSON.encodePostPacket(new PostPayload("alice", "T", "C"));
        Assertions.assertEquals(
                "{\"ibcPostPacket\":{\"content\":\"C\",\"creator\":\"alice\",\"title\":\"T\"}}",
                new String(bytes, StandardCharsets.UTF_8)
        );
    }

    @Test
    void ackResultUsesPostIdFieldName() throws Exception {
        byte[] bytes = PacketCodec.JSON.encodeAckResult(AckResult.of(7L));
        Assertions.assertEquals("{\"postID\":\"7\"}", new String(bytes, StandardCharsets.UTF_8));
    }

    @Test
    void decodeReversesEncode() throws Exception {
        PostPayload payload = new PostPayload("bob", "Hello \"chain\"", "line1\nline2 é");
        Assertions.assertEquals(payload, PacketCodec.JSON.decodePostPacket(PacketCodec.JSON.encodePostPacket(payload)));

        AckResult max = AckResult.of(-1L);
        Assertions.assertEquals("18446744073709551615", max.postId());
        Assertions.assertEquals(max, PacketCodec.JSON.decodeAckResult(PacketCodec.JSON.encodeAckResult(max)));
    }

    @Test
    void decodesPacketWrittenByAnotherChain() throws Exception {
        byte[] foreign = "{ \"ibcPostPacket\" : { \"title\":\"X\", \"creator\":\"carol\", \"content\":\"\" } }"
                .getBytes(StandardCharsets.UTF_8);
        Assertions.assertEquals(new PostPayload("carol", "X", ""), PacketCodec.JSON.decodePostPacket(foreign));
    }

    @Test
    void packetWithoutPostEnvelopeIsUnknownType() {
        PostRelayException noData = Assertions.assertThrows(PostRelayException.class,
                () -> PacketCodec.JSON.decodePostPacket("{}".getBytes(StandardCharsets.UTF_8)));
        Assertions.assertEquals(ErrorKind.UNKNOWN_PACKET_TYPE, noData.kind());

        PostRelayException garbage = Assertions.assertThrows(PostRelayException.class,
                () -> PacketCodec.JSON.decodePostPacket(new byte[]{1, 2, 3}));
        Assertions.assertEquals(ErrorKind.UNKNOWN_PACKET_TYPE, garbage.kind());
    }

    @Test
    void malformedAckResultIsDecodeError() {
        for (String raw : new String[]{"not json", "{}", "{\"postId\":\"7\"}", "[\"7\"]"}) {
            PostRelayException e = Assertions.assertThrows(PostRelayException.class,
                    () -> PacketCodec.JSON.decodeAckResult(raw.getBytes(StandardCharsets.UTF_8)), raw);
            Assertions.assertEquals(ErrorKind.ACK_DECODE_ERROR, e.kind(), raw);
        }
    }

    @Test
    void serializerFailureSurfacesAsEncodingError() {
        PacketCodec broken = new PacketCodec(new FailingMapper());
        PostRelayException e = Assertions.assertThrows(PostRelayException.class,
                () -> broken.encodePostPacket(new PostPayload("alice", "T", "C")));
        Assertions.assertEquals(ErrorKind.ENCODING_ERROR, e.kind());
    }
}
