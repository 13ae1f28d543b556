package com.tlmbackup.server.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tlmbackup.server.exception.JsonException;
import com.tlmbackup.server.exception.ValidationException;
import org.apache.commons.lang3.ObjectUtils;
import org.apache.commons.lang3.StringUtils;

public class JsonUtil {

    private static final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule()) // jackson to handle field to Instant
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS); // Use ISO-8601 instead of timestamp

    public static String serializeToString(Object object) throws JsonException {
        if (ObjectUtils.isEmpty(object)) {
            throw new ValidationException("serializeToString failed. object is null");
        }
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new JsonException("serializeToString failed. object is %s".formatted(object), e);
        }
    }

    public static <T> T deserialize(String json, TypeReference<T> typeRef) throws JsonException {
        if (StringUtils.isBlank(json)) {
            throw new ValidationException("deserialize failed. json is blank");
        }
        try {
            return objectMapper.readValue(json, typeRef);
        } catch (JsonProcessingException e) {
            throw new JsonException("deserialize failed. json is %s".formatted(json), e);
        }
    }
}
