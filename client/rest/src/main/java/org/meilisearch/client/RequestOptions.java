/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.message.BasicHeader;
import org.apache.hc.core5.util.Timeout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Per-request settings that override the client's defaults: extra headers, the api key and the response timeout.
 * <p>
 * Searching with a tenant token is the common case: the token replaces the client's key for that one request.
 * Instances are immutable, change them through {@link #toBuilder()}.
 */
public final class RequestOptions {

    public static final RequestOptions DEFAULT = new Builder().build();

    // keyed case-insensitively, a header set twice keeps its last value
    private final Map<String, String> headers;
    private final Timeout responseTimeout;

    private RequestOptions(Builder builder) {
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(builder.headers);
        this.headers = Collections.unmodifiableMap(copy);
        this.responseTimeout = builder.responseTimeout;
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.headers.putAll(headers);
        builder.responseTimeout = responseTimeout;
        return builder;
    }

    /**
     * Headers sent with the request. A default header of the client with the same name is not sent.
     */
    public List<Header> getHeaders() {
        List<Header> list = new ArrayList<>(headers.size());
        headers.forEach((name, value) -> list.add(new BasicHeader(name, value)));
        return list;
    }

    /**
     * The response timeout of this request, or {@code null} to keep the client's.
     */
    public Timeout getResponseTimeout() {
        return responseTimeout;
    }

    @Override
    public String toString() {
        StringBuilder b = new StringBuilder("RequestOptions{");
        String separator = "";
        for (Map.Entry<String, String> header : headers.entrySet()) {
            boolean secret = HttpHeaders.AUTHORIZATION.equalsIgnoreCase(header.getKey());
            b.append(separator).append(header.getKey()).append('=').append(secret ? "<redacted>" : header.getValue());
            separator = ", ";
        }
        if (responseTimeout != null) {
            b.append(separator).append("responseTimeout=").append(responseTimeout);
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
        RequestOptions other = (RequestOptions) obj;
        return headers.equals(other.headers) && Objects.equals(responseTimeout, other.responseTimeout);
    }

    @Override
    public int hashCode() {
        return Objects.hash(headers, responseTimeout);
    }

    public static final class Builder {
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private Timeout responseTimeout;

        private Builder() {}

        /**
         * Sets a header, replacing any value this builder already holds for the same name.
         */
        public Builder addHeader(String name, String value) {
            Objects.requireNonNull(name, "header name cannot be null");
            Objects.requireNonNull(value, "header value cannot be null");
            headers.put(name, value);
            return this;
        }

        /**
         * Authenticates this request with {@code apiKey}, which may also be a tenant token, instead of the client's key.
         */
        public Builder setApiKey(String apiKey) {
            Objects.requireNonNull(apiKey, "apiKey cannot be null");
            return addHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }

        public Builder setResponseTimeout(Timeout responseTimeout) {
            this.responseTimeout = responseTimeout;
            return this;
        }

        public RequestOptions build() {
            return new RequestOptions(this);
        }
    }
}
