/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.HttpRequest;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.StatusLine;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Logs the exchanges of {@link RestClient}: one debug line per request, a warning when a proxy in front of
 * Meilisearch adds {@code Warning} headers, and the whole exchange in curl format on the {@code tracer} logger.
 * <p>
 * Traces show request bodies before compression and response bodies after decompression. The api key is replaced
 * by {@code $MEILI_API_KEY} so a trace can be pasted into a shell that defines it.
 */
final class RequestLogger {

    private static final Log tracer = LogFactory.getLog("tracer");

    static final String API_KEY_PLACEHOLDER = "$MEILI_API_KEY";

    private RequestLogger() {}

    static void logResponse(Log logger, HttpRequest httpRequest, Request request, HttpHost host, ClassicHttpResponse httpResponse) {
        if (logger.isDebugEnabled()) {
            logger.debug("request [" + target(httpRequest, host) + "] returned [" + new StatusLine(httpResponse) + "]");
        }
        Header[] warnings = httpResponse.getHeaders("Warning");
        if (warnings.length > 0 && logger.isWarnEnabled()) {
            logger.warn(buildWarningMessage(httpRequest, host, warnings));
        }
        if (tracer.isTraceEnabled()) {
            String trace = buildTraceRequest(httpRequest, request, host);
            try {
                trace += '\n' + buildTraceResponse(httpResponse);
            } catch (IOException e) {
                tracer.trace("error while reading response for trace purposes", e);
            }
            tracer.trace(trace);
        }
    }

    static void logFailedRequest(Log logger, HttpRequest httpRequest, Request request, HttpHost host, Exception e) {
        if (logger.isDebugEnabled()) {
            logger.debug("request [" + target(httpRequest, host) + "] failed", e);
        }
        if (tracer.isTraceEnabled()) {
            tracer.trace(buildTraceRequest(httpRequest, request, host));
        }
    }

    static String buildWarningMessage(HttpRequest httpRequest, HttpHost host, Header[] warnings) {
        StringBuilder message = new StringBuilder("request [").append(target(httpRequest, host))
            .append("] returned ")
            .append(warnings.length)
            .append(" warnings: ");
        for (int i = 0; i < warnings.length; i++) {
            if (i > 0) {
                message.append(',');
            }
            message.append('[').append(warnings[i].getValue()).append(']');
        }
        return message.toString();
    }

    /**
     * Writes the request as a curl command. {@code --data-binary} keeps the line breaks of csv and ndjson bodies.
     */
    static String buildTraceRequest(HttpRequest httpRequest, Request request, HttpHost host) {
        StringBuilder curl = new StringBuilder("curl -iX ").append(httpRequest.getMethod())
            .append(" '")
            .append(host.toURI())
            .append(path(httpRequest))
            .append('\'');
        if (httpRequest.containsHeader(HttpHeaders.AUTHORIZATION)) {
            curl.append(" -H \"Authorization: Bearer ").append(API_KEY_PLACEHOLDER).append('"');
        }
        byte[] body = request.getBody();
        if (body != null) {
            ContentType contentType = request.getContentType();
            curl.append(" -H 'Content-Type: ").append(contentType).append('\'');
            String text = new String(body, charsetOf(contentType));
            curl.append(" --data-binary '").append(text.replace("'", "'\\''")).append('\'');
        }
        return curl.toString();
    }

    static String buildTraceResponse(ClassicHttpResponse httpResponse) throws IOException {
        StringBuilder trace = new StringBuilder("# ").append(new StatusLine(httpResponse));
        for (Header header : httpResponse.getHeaders()) {
            trace.append("\n# ").append(header.getName()).append(": ").append(header.getValue());
        }
        trace.append("\n#");
        HttpEntity entity = httpResponse.getEntity();
        if (entity == null) {
            return trace.toString();
        }
        ContentType contentType = entity.getContentType() == null ? null : ContentType.parse(entity.getContentType());
        if (entity.isRepeatable() == false) {
            entity = new ByteArrayEntity(EntityUtils.toByteArray(entity), contentType);
            httpResponse.setEntity(entity);
        }
        String body;
        try {
            body = EntityUtils.toString(entity, charsetOf(contentType));
        } catch (ParseException e) {
            throw new IOException(e);
        }
        for (String line : body.split("\\R")) {
            trace.append("\n# ").append(line);
        }
        return trace.toString();
    }

    private static String target(HttpRequest httpRequest, HttpHost host) {
        return httpRequest.getMethod() + " " + host.toURI() + path(httpRequest);
    }

    private static String path(HttpRequest httpRequest) {
        String path = httpRequest.getRequestUri();
        if (path == null || path.isEmpty()) {
            return "/";
        }
        return path.startsWith("/") ? path : "/" + path;
    }

    private static Charset charsetOf(ContentType contentType) {
        return contentType == null || contentType.getCharset() == null ? StandardCharsets.UTF_8 : contentType.getCharset();
    }
}
