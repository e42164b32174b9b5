package io.postrelay.codec;

import io.postrelay.error.ErrorKind;
import io.postrelay.error.PostRelayException;
import io.postrelay.model.AckOutcome;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

final class AcknowledgementCodecTest {

    @Test
    void successCarriesBase64Result() throws Exception {
        byte[] result = "{\"postID\":\"7\"}".getBytes(StandardCharsets.UTF_8);
        byte[] ack = AcknowledgementCodec.JSON.encode(AckOutcome.success(result));
        Assertions.assertEquals("{\"result\":\"eyJwb3N0SUQiOiI3In0=\"}", new String(ack, StandardCharsets.UTF_8));

        AckOutcome decoded = AcknowledgementCodec.JSON.decode(ack);
        Assertions.assertInstanceOf(AckOutcome.Success.class, decoded);
        Assertions.assertArrayEquals(result, ((AckOutcome.Success) decoded).result());
    }

    @Test
    void failureCarriesMessage() throws Exception {
        byte[] ack = AcknowledgementCodec.JSON.encode(AckOutcome.failure("post title cannot be empty"));
        Assertions.assertEquals("{\"error\":\"post title cannot be empty\"}", new String(ack, StandardCharsets.UTF_8));
        Assertions.assertEquals(AckOutcome.failure("post title cannot be empty"), AcknowledgementCodec.JSON.decode(ack));
    }

    @Test
    void envelopeWithNeitherOrBothFieldsIsUnsupported() {
        for (String raw : new String[]{"{}", "{\"result\":\"AA==\",\"error\":\"x\"}", "{\"result\":42}", "\"result\"", "%%"}) {
            PostRelayException e = Assertions.assertThrows(PostRelayException.class,
                    () -> AcknowledgementCodec.JSON.decode(raw.getBytes(StandardCharsets.UTF_8)), raw);
            Assertions.assertEquals(ErrorKind.UNSUPPORTED_ACK_FORMAT, e.kind(), raw);
        }
    }
}
