/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Thrown when Meilisearch answers with a status that is neither 2xx nor ignored by the request.
 * <p>
 * Meilisearch describes its errors in a small JSON object ({@code message}, {@code code}, {@code type} and
 * {@code link}). That body is read once, kept as {@link #getResponseBody()} and appended to the message.
 */
public final class ResponseException extends IOException {

    private final Response response;
    private final String responseBody;

    public ResponseException(Response response) throws IOException {
        this(response, readBody(response));
    }

    private ResponseException(Response response, String responseBody) {
        super(buildMessage(response, responseBody));
        this.response = response;
        this.responseBody = responseBody;
    }

    private static String readBody(Response response) throws IOException {
        HttpEntity entity = response.getEntity();
        if (entity == null) {
            return null;
        }
        if (entity.isRepeatable() == false) {
            // the body stays readable through the response
            ContentType contentType = entity.getContentType() == null ? null : ContentType.parse(entity.getContentType());
            entity = new ByteArrayEntity(EntityUtils.toByteArray(entity), contentType);
            response.getHttpResponse().setEntity(entity);
        }
        try {
            return EntityUtils.toString(entity, StandardCharsets.UTF_8);
        } catch (ParseException e) {
            throw new IOException(e);
        }
    }

    private static String buildMessage(Response response, String responseBody) {
        String message = String.format(
            Locale.ROOT,
            "method [%s], host [%s], URI [%s], status line [%s]",
            response.getRequestLine().getMethod(),
            response.getHost(),
            response.getRequestLine().getUri(),
            response.getStatusLine()
        );
        return responseBody == null || responseBody.isEmpty() ? message : message + "\n" + responseBody;
    }

    public Response getResponse() {
        return response;
    }

    public int getStatusCode() {
        return response.getStatusLine().getStatusCode();
    }

    /**
     * The body Meilisearch sent with the error, {@code null} when there was none.
     */
    public String getResponseBody() {
        return responseBody;
    }
}
