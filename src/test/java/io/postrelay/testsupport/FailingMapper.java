package io.postrelay.testsupport;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Mapper whose serializer always fails. */
public final class FailingMapper extends ObjectMapper {
    @Override
    public byte[] writeValueAsBytes(Object value) throws JsonProcessingException {
        throw JsonMappingException.from((JsonGenerator) null, "serializer unavailable");
    }
}
