/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;

/**
 * Holds the {@link ObjectMapper} shared by every Meilisearch request and response.
 * <p>
 * Unset fields of request objects are left out of request bodies, while {@code null} values inside maps are sent
 * as is: a document field set to {@code null} clears it and a search rule set to {@code null} grants the index
 * without a filter. Timestamps are read and written as ISO-8601 strings and fields added to the API by newer
 * Meilisearch versions are ignored.
 */
public final class DefaultObjectMapper {
    public static final ObjectMapper objectMapper = new ObjectMapper();

    static {
        objectMapper.setDefaultPropertyInclusion(JsonInclude.Value.construct(Include.NON_NULL, Include.ALWAYS));
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        objectMapper.disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
    }

    private DefaultObjectMapper() {}

    public static <T> T readValue(InputStream content, Class<T> clazz) throws IOException {
        return objectMapper.readValue(content, clazz);
    }

    public static <T> T readValue(InputStream content, TypeReference<T> type) throws IOException {
        return objectMapper.readValue(content, type);
    }

    public static <T> T readValue(String content, Class<T> clazz) throws IOException {
        return objectMapper.readValue(content, clazz);
    }

    public static String writeValueAsString(Object value) throws JsonProcessingException {
        return objectMapper.writeValueAsString(value);
    }

    public static byte[] writeValueAsBytes(Object value) throws JsonProcessingException {
        return objectMapper.writeValueAsBytes(value);
    }
}
