/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.apache.hc.core5.http.ContentType;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A call to one Meilisearch route: the method, the endpoint relative to the client's path prefix, the query
 * parameters and an optional body.
 * <p>
 * The body is held as encoded bytes. Meilisearch accepts JSON for every route and also csv and ndjson when adding or
 * replacing documents, so the content type travels with the bytes.
 */
public final class Request {
    private final String method;
    private final String endpoint;
    private final Map<String, String> parameters = new LinkedHashMap<>();

    private byte[] body;
    private ContentType contentType;
    private RequestOptions options = RequestOptions.DEFAULT;

    /**
     * @param method the HTTP method, upper-cased before it is sent
     * @param endpoint the route, for instance {@code /indexes/movies/search}
     */
    public Request(String method, String endpoint) {
        this.method = Objects.requireNonNull(method, "method cannot be null").toUpperCase(Locale.ROOT);
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint cannot be null");
    }

    public String getMethod() {
        return method;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /**
     * Adds a query string parameter. Meilisearch parameters always carry a value.
     *
     * @throws IllegalArgumentException if a parameter with that name has already been set
     */
    public void addParameter(String name, String value) {
        Objects.requireNonNull(name, "url parameter name cannot be null");
        Objects.requireNonNull(value, "url parameter [" + name + "] cannot have a null value");
        String previous = parameters.putIfAbsent(name, value);
        if (previous != null) {
            throw new IllegalArgumentException("url parameter [" + name + "] has already been set to [" + previous + "]");
        }
    }

    /**
     * Adds every entry of {@code parameters}, in iteration order.
     *
     * @throws IllegalArgumentException if a parameter with one of the names has already been set
     */
    public void addParameters(Map<String, String> parameters) {
        parameters.forEach(this::addParameter);
    }

    /**
     * Unmodifiable view of the query string parameters.
     */
    public Map<String, String> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    /**
     * Sets a JSON body, sent as {@code application/json; charset=UTF-8}.
     */
    public void setJsonBody(byte[] json) {
        setBody(json, ContentType.APPLICATION_JSON);
    }

    /**
     * Sets a body already encoded in {@code contentType}, for instance the content of a csv or ndjson file.
     * A {@code null} body removes it.
     */
    public void setBody(byte[] body, ContentType contentType) {
        Objects.requireNonNull(contentType, "contentType cannot be null");
        this.body = body;
        this.contentType = body == null ? null : contentType;
    }

    /**
     * The encoded body, or {@code null} when the request has none.
     */
    public byte[] getBody() {
        return body;
    }

    public ContentType getContentType() {
        return contentType;
    }

    /**
     * @throws NullPointerException if {@code options} is null
     */
    public void setOptions(RequestOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    public RequestOptions getOptions() {
        return options;
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder("Request{method='").append(method).append("', endpoint='").append(endpoint).append('\'');
        if (parameters.isEmpty() == false) {
            b.append(", params=").append(parameters);
        }
        if (body != null) {
            b.append(", body=[").append(body.length).append(" bytes of ").append(contentType.getMimeType()).append(']');
        }
        if (options != RequestOptions.DEFAULT) {
            b.append(", options=").append(options);
        }
        return b.append('}').toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (obj == null || obj.getClass() != getClass()) {
            return false;
        }
        Request other = (Request) obj;
        return method.equals(other.method)
            && endpoint.equals(other.endpoint)
            && parameters.equals(other.parameters)
            && Arrays.equals(body, other.body)
            && Objects.equals(contentType == null ? null : contentType.toString(), other.contentType == null ? null : other.contentType.toString())
            && options.equals(other.options);
    }

    @Override
    public int hashCode() {
        return Objects.hash(method, endpoint, parameters, Arrays.hashCode(body), options);
    }
}
