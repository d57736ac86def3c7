/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPost;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Converts the instance-wide operations into low level {@link Request}s, and holds the helpers shared by the other
 * request converters.
 */
final class RequestConverters {

    private RequestConverters() {}

    static Request health() {
        return new Request(HttpGet.METHOD_NAME, "/health");
    }

    static Request version() {
        return new Request(HttpGet.METHOD_NAME, "/version");
    }

    static Request stats() {
        return new Request(HttpGet.METHOD_NAME, "/stats");
    }

    static Request createDump() {
        return new Request(HttpPost.METHOD_NAME, "/dumps");
    }

    static byte[] toJson(Object body) throws IOException {
        return DefaultObjectMapper.writeValueAsBytes(body);
    }

    static String endpoint(String... parts) {
        return new EndpointBuilder().addPathPart(parts).build();
    }

    /**
     * Collects the query string parameters of a request. Absent values are skipped, so the result can be handed to
     * {@link Request#addParameters(Map)}.
     */
    static class Params {
        private final Map<String, String> parameters = new LinkedHashMap<>();

        Params() {}

        Params putParam(String name, String value) {
            if (value != null && value.isEmpty() == false) {
                parameters.put(name, value);
            }
            return this;
        }

        Params putParam(String name, Number value) {
            if (value != null) {
                parameters.put(name, value.toString());
            }
            return this;
        }

        Params withOffset(Integer offset) {
            return putParam("offset", offset);
        }

        Params withLimit(Integer limit) {
            return putParam("limit", limit);
        }

        Params withPrimaryKey(String primaryKey) {
            return putParam("primaryKey", primaryKey);
        }

        Params withCommaSeparated(String name, Collection<?> values) {
            if (values != null && values.isEmpty() == false) {
                StringJoiner joiner = new StringJoiner(",");
                for (Object value : values) {
                    joiner.add(String.valueOf(value));
                }
                putParam(name, joiner.toString());
            }
            return this;
        }

        Map<String, String> asMap() {
            return parameters;
        }
    }

    /**
     * Utility class to build request's endpoint given its parts as strings
     */
    static class EndpointBuilder {

        private final StringJoiner joiner = new StringJoiner("/", "/", "");

        EndpointBuilder addPathPart(String... parts) {
            for (String part : parts) {
                if (part != null && part.isEmpty() == false) {
                    joiner.add(encodePart(part));
                }
            }
            return this;
        }

        EndpointBuilder addPathPartAsIs(String... parts) {
            for (String part : parts) {
                if (part != null && part.isEmpty() == false) {
                    joiner.add(part);
                }
            }
            return this;
        }

        String build() {
            return joiner.toString();
        }

        private static String encodePart(String pathPart) {
            try {
                // encode each part (e.g. index uid or document id) separately before merging them into the path
                // we prepend "/" to the path part to make this path absolute, otherwise there can be issues with
                // paths that start with `-` or contain `:`
                // the authority must be an empty string and not null, else paths that begin with slashes could have them
                // misinterpreted as part of the authority.
                URI uri = new URI(null, "", "/" + pathPart, null, null);
                // manually encode any slash that each part may contain
                return uri.getRawPath().substring(1).replaceAll("/", "%2F");
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException("Path part [" + pathPart + "] couldn't be encoded", e);
            }
        }
    }
}
