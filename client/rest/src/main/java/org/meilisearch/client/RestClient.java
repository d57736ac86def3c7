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
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.apache.hc.client5.http.classic.methods.HttpUriRequestBase;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.entity.GzipCompressingEntity;
import org.apache.hc.client5.http.entity.GzipDecompressingEntity;
import org.apache.hc.client5.http.impl.async.CloseableHttpAsyncClient;
import org.apache.hc.client5.http.protocol.HttpClientContext;
import org.apache.hc.core5.concurrent.FutureCallback;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ConnectionClosedException;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.HttpResponse;
import org.apache.hc.core5.http.HttpVersion;
import org.apache.hc.core5.http.Message;
import org.apache.hc.core5.http.io.entity.BufferedHttpEntity;
import org.apache.hc.core5.http.io.entity.ByteArrayEntity;
import org.apache.hc.core5.http.message.BasicClassicHttpResponse;
import org.apache.hc.core5.http.message.RequestLine;
import org.apache.hc.core5.http.nio.AsyncEntityProducer;
import org.apache.hc.core5.http.nio.AsyncRequestProducer;
import org.apache.hc.core5.http.nio.AsyncResponseConsumer;
import org.apache.hc.core5.http.nio.entity.AsyncEntityProducers;
import org.apache.hc.core5.http.nio.entity.BasicAsyncEntityConsumer;
import org.apache.hc.core5.http.nio.support.BasicRequestProducer;
import org.apache.hc.core5.http.nio.support.BasicResponseConsumer;
import org.apache.hc.core5.net.URIAuthority;
import org.apache.hc.core5.net.URIBuilder;

import javax.net.ssl.SSLHandshakeException;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Client that connects to a Meilisearch server through HTTP.
 * <p>
 * Must be created using {@link RestClientBuilder}, which allows to set all the different options or just rely on defaults.
 * <p>
 * The method {@link #performRequest(Request)} allows to send a request to the server. Meilisearch is a single node, so
 * a failed request is reported to the caller as is and never retried.
 * <p>
 * Requests can be either synchronous or asynchronous. The asynchronous variants all end with {@code Async}.
 * <p>
 * Requests can be traced by enabling trace logging for "tracer". The trace logger outputs requests and responses in curl format.
 */
public class RestClient implements Closeable {

    private static final Log logger = LogFactory.getLog(RestClient.class);

    private final CloseableHttpAsyncClient client;
    // We don't rely on default headers supported by HttpAsyncClient as those cannot be replaced.
    // These are package private for tests.
    final List<Header> defaultHeaders;
    private final HttpHost host;
    private final String pathPrefix;
    private final boolean compressionEnabled;
    private final RequestConfig defaultRequestConfig;

    RestClient(
        CloseableHttpAsyncClient client,
        Header[] defaultHeaders,
        HttpHost host,
        String pathPrefix,
        boolean compressionEnabled,
        RequestConfig defaultRequestConfig
    ) {
        this.client = client;
        this.defaultHeaders = Collections.unmodifiableList(Arrays.asList(defaultHeaders));
        this.host = host;
        this.pathPrefix = pathPrefix;
        this.compressionEnabled = compressionEnabled;
        this.defaultRequestConfig = defaultRequestConfig;
    }

    /**
     * Returns a new {@link RestClientBuilder} to help with {@link RestClient} creation.
     * Creates a new builder instance and sets the host that the client will send requests to.
     */
    public static RestClientBuilder builder(HttpHost host) {
        return new RestClientBuilder(host);
    }

    /**
     * Returns a new {@link RestClientBuilder} for the Meilisearch server reachable at the given url,
     * for instance {@code http://localhost:7700}. A path in the url becomes the path prefix of every request.
     *
     * @throws IllegalArgumentException if the url is malformed or has no host
     */
    public static RestClientBuilder builder(String url) {
        Objects.requireNonNull(url, "url must not be null");
        final URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("invalid url [" + url + "]", e);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("url [" + url + "] has no host");
        }
        String scheme = uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase(Locale.ROOT);
        int port = uri.getPort();
        if (port == -1) {
            port = "https".equals(scheme) ? 443 : 80;
        }
        RestClientBuilder builder = new RestClientBuilder(new HttpHost(scheme, uri.getHost(), port));
        String path = uri.getRawPath();
        if (path != null && path.isEmpty() == false && "/".equals(path) == false) {
            builder.setPathPrefix(path.endsWith("/") ? path.substring(0, path.length() - 1) : path);
        }
        return builder;
    }

    /**
     * Get the host that this client sends requests to.
     */
    public HttpHost getHost() {
        return host;
    }

    /**
     * Sends a request to the Meilisearch server that the client points to.
     * Blocks until the request is completed and returns its response or fails
     * by throwing an exception.
     *
     * @param request the request to perform
     * @return the response returned by Meilisearch
     * @throws IOException in case of a problem or the connection was aborted
     * @throws ResponseException in case Meilisearch responded with a status code that indicated an error
     */
    public Response performRequest(Request request) throws IOException {
        InternalRequest internalRequest = new InternalRequest(request);
        Message<HttpResponse, byte[]> message;
        try {
            message = client.execute(internalRequest.requestProducer(), newResponseConsumer(), internalRequest.context(), null).get();
        } catch (Exception e) {
            RequestLogger.logFailedRequest(logger, internalRequest.httpRequest, request, host, e);
            Exception cause = extractAndWrapCause(e);
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("unexpected exception type: must be either RuntimeException or IOException", cause);
        }
        return convertResponse(internalRequest, message);
    }

    /**
     * Sends a request to the Meilisearch server that the client points to.
     * The request is executed asynchronously and the provided
     * {@link ResponseListener} gets notified upon request completion or
     * failure.
     *
     * @param request the request to perform
     * @param responseListener the {@link ResponseListener} to notify when the
     *      request is completed or fails
     */
    public Cancellable performRequestAsync(Request request, ResponseListener responseListener) {
        try {
            InternalRequest internalRequest = new InternalRequest(request);
            performRequestAsync(internalRequest, responseListener);
            return internalRequest.cancellable;
        } catch (Exception e) {
            responseListener.onFailure(e);
            return Cancellable.NO_OP;
        }
    }

    private void performRequestAsync(final InternalRequest request, final ResponseListener listener) {
        request.cancellable.runIfNotCancelled(() -> {
            Future<Message<HttpResponse, byte[]>> future = client.execute(
                request.requestProducer(),
                newResponseConsumer(),
                request.context(),
                new FutureCallback<Message<HttpResponse, byte[]>>() {
                    @Override
                    public void completed(Message<HttpResponse, byte[]> message) {
                        Response response;
                        try {
                            response = convertResponse(request, message);
                        } catch (Exception e) {
                            listener.onFailure(e);
                            return;
                        }
                        listener.onSuccess(response);
                    }

                    @Override
                    public void failed(Exception failure) {
                        RequestLogger.logFailedRequest(logger, request.httpRequest, request.request, host, failure);
                        listener.onFailure(failure);
                    }

                    @Override
                    public void cancelled() {
                        listener.onFailure(Cancellable.newCancellationException());
                    }
                }
            );
            request.httpRequest.setDependency(() -> future.cancel(true));
        });
    }

    private Response convertResponse(InternalRequest request, Message<HttpResponse, byte[]> message) throws IOException {
        ClassicHttpResponse httpResponse = toClassicResponse(message);
        int statusCode = httpResponse.getCode();

        HttpEntity entity = httpResponse.getEntity();
        if (entity != null && entity.getContentEncoding() != null && "gzip".equalsIgnoreCase(entity.getContentEncoding())) {
            httpResponse.setEntity(new BufferedHttpEntity(new GzipDecompressingEntity(entity)));
        }
        RequestLogger.logResponse(logger, request.httpRequest, request.request, host, httpResponse);

        RequestLine requestLine = new RequestLine(request.httpRequest.getMethod(), request.httpRequest.getRequestUri(), HttpVersion.HTTP_1_1);
        Response response = new Response(requestLine, host, httpResponse);
        if (isSuccessfulResponse(statusCode) || request.ignoreErrorCodes.contains(statusCode)) {
            return response;
        }
        throw new ResponseException(response);
    }

    private static ClassicHttpResponse toClassicResponse(Message<HttpResponse, byte[]> message) {
        HttpResponse head = message.getHead();
        BasicClassicHttpResponse httpResponse = new BasicClassicHttpResponse(head.getCode(), head.getReasonPhrase());
        httpResponse.setVersion(head.getVersion());
        httpResponse.setHeaders(head.getHeaders());
        byte[] body = message.getBody();
        if (body != null) {
            Header contentType = head.getFirstHeader(HttpHeaders.CONTENT_TYPE);
            Header contentEncoding = head.getFirstHeader(HttpHeaders.CONTENT_ENCODING);
            httpResponse.setEntity(
                new ByteArrayEntity(
                    body,
                    contentType == null ? null : ContentType.parse(contentType.getValue()),
                    contentEncoding == null ? null : contentEncoding.getValue()
                )
            );
        }
        return httpResponse;
    }

    private static AsyncResponseConsumer<Message<HttpResponse, byte[]>> newResponseConsumer() {
        return new BasicResponseConsumer<>(new BasicAsyncEntityConsumer());
    }

    @Override
    public void close() throws IOException {
        client.close();
    }

    private static boolean isSuccessfulResponse(int statusCode) {
        return statusCode < 300;
    }

    static URI buildUri(String pathPrefix, String path, Map<String, String> params) {
        Objects.requireNonNull(path, "path must not be null");
        try {
            String fullPath;
            if (pathPrefix != null && pathPrefix.isEmpty() == false) {
                if (pathPrefix.endsWith("/") && path.startsWith("/")) {
                    fullPath = pathPrefix.substring(0, pathPrefix.length() - 1) + path;
                } else if (pathPrefix.endsWith("/") || path.startsWith("/")) {
                    fullPath = pathPrefix + path;
                } else {
                    fullPath = pathPrefix + "/" + path;
                }
            } else {
                fullPath = path;
            }

            URIBuilder uriBuilder = new URIBuilder(fullPath);
            for (Map.Entry<String, String> param : params.entrySet()) {
                uriBuilder.addParameter(param.getKey(), param.getValue());
            }
            return uriBuilder.build();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException(e.getMessage(), e);
        }
    }

    private class InternalRequest {
        private final Request request;
        private final Set<Integer> ignoreErrorCodes;
        private final HttpUriRequestBase httpRequest;
        private final Cancellable cancellable;
        private byte[] body;

        InternalRequest(Request request) throws IOException {
            this.request = request;
            Map<String, String> params = new LinkedHashMap<>(request.getParameters());
            // ignore is a special parameter supported by the clients, shouldn't be sent to Meilisearch
            String ignoreString = params.remove("ignore");
            this.ignoreErrorCodes = getIgnoreErrorCodes(ignoreString, request.getMethod());
            URI uri = buildUri(pathPrefix, request.getEndpoint(), params);
            this.httpRequest = new HttpUriRequestBase(request.getMethod().toUpperCase(Locale.ROOT), uri);
            this.httpRequest.setScheme(host.getSchemeName());
            this.httpRequest.setAuthority(new URIAuthority(host.getHostName(), host.getPort()));
            this.cancellable = Cancellable.fromDependency(httpRequest);
            setHeaders(request.getOptions().getHeaders());
            setBody(request.getBody(), request.getContentType());
        }

        private void setHeaders(Collection<Header> requestHeaders) {
            // request headers override default headers, so we don't add default headers if they exist as request headers
            final Set<String> requestNames = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
            for (Header requestHeader : requestHeaders) {
                httpRequest.addHeader(requestHeader);
                requestNames.add(requestHeader.getName());
            }
            for (Header defaultHeader : defaultHeaders) {
                if (requestNames.contains(defaultHeader.getName()) == false) {
                    httpRequest.addHeader(defaultHeader);
                }
            }
            if (compressionEnabled) {
                httpRequest.addHeader(HttpHeaders.ACCEPT_ENCODING, "gzip");
            }
        }

        private void setBody(byte[] content, ContentType contentType) throws IOException {
            if (content == null) {
                return;
            }
            if (compressionEnabled) {
                ByteArrayOutputStream out = new ByteArrayOutputStream();
                new GzipCompressingEntity(new ByteArrayEntity(content, contentType)).writeTo(out);
                body = out.toByteArray();
                httpRequest.addHeader(HttpHeaders.CONTENT_ENCODING, "gzip");
            } else {
                body = content;
            }
        }

        AsyncRequestProducer requestProducer() {
            AsyncEntityProducer entityProducer = body == null ? null : AsyncEntityProducers.create(body, request.getContentType());
            return new BasicRequestProducer(httpRequest, entityProducer);
        }

        HttpClientContext context() {
            HttpClientContext context = HttpClientContext.create();
            if (request.getOptions().getResponseTimeout() != null) {
                RequestConfig.Builder config = defaultRequestConfig == null ? RequestConfig.custom() : RequestConfig.copy(defaultRequestConfig);
                context.setRequestConfig(config.setResponseTimeout(request.getOptions().getResponseTimeout()).build());
            }
            return context;
        }
    }

    private static Set<Integer> getIgnoreErrorCodes(String ignoreString, String requestMethod) {
        Set<Integer> ignoreErrorCodes;
        if (ignoreString == null) {
            if ("HEAD".equalsIgnoreCase(requestMethod)) {
                // 404 never causes error if returned for a HEAD request
                ignoreErrorCodes = Collections.singleton(404);
            } else {
                ignoreErrorCodes = Collections.emptySet();
            }
        } else {
            String[] ignoresArray = ignoreString.split(",");
            ignoreErrorCodes = new HashSet<>();
            if ("HEAD".equalsIgnoreCase(requestMethod)) {
                // 404 never causes error if returned for a HEAD request
                ignoreErrorCodes.add(404);
            }
            for (String ignoreCode : ignoresArray) {
                try {
                    ignoreErrorCodes.add(Integer.valueOf(ignoreCode.trim()));
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("ignore value should be a number, found [" + ignoreString + "] instead", e);
                }
            }
        }
        return ignoreErrorCodes;
    }

    /**
     * Wrap the exception so the caller's signature shows up in the stack trace, taking care to copy the original type and message
     * where possible so async and sync code don't have to check different exceptions.
     */
    private static Exception extractAndWrapCause(Exception exception) {
        if (exception instanceof InterruptedException) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("thread waiting for the response was interrupted", exception);
        }
        if (exception instanceof ExecutionException) {
            ExecutionException executionException = (ExecutionException) exception;
            Throwable t = executionException.getCause() == null ? executionException : executionException.getCause();
            if (t instanceof Error) {
                throw (Error) t;
            }
            exception = (Exception) t;
        }
        if (exception instanceof ConnectTimeoutException) {
            ConnectTimeoutException e = new ConnectTimeoutException(exception.getMessage());
            e.initCause(exception);
            return e;
        }
        if (exception instanceof SocketTimeoutException) {
            SocketTimeoutException e = new SocketTimeoutException(exception.getMessage());
            e.initCause(exception);
            return e;
        }
        if (exception instanceof ConnectionClosedException) {
            ConnectionClosedException e = new ConnectionClosedException(exception.getMessage());
            e.initCause(exception);
            return e;
        }
        if (exception instanceof SSLHandshakeException) {
            SSLHandshakeException e = new SSLHandshakeException(exception.getMessage());
            e.initCause(exception);
            return e;
        }
        if (exception instanceof ConnectException) {
            ConnectException e = new ConnectException(exception.getMessage());
            e.initCause(exception);
            return e;
        }
        if (exception instanceof IOException) {
            return new IOException(exception.getMessage(), exception);
        }
        if (exception instanceof RuntimeException) {
            return new RuntimeException(exception.getMessage(), exception);
        }
        return new RuntimeException("error while performing request", exception);
    }
}
