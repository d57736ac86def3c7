/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.async.CloseableHttpAsyncClient;
import org.apache.hc.client5.http.impl.async.HttpAsyncClientBuilder;
import org.apache.hc.client5.http.impl.nio.PoolingAsyncClientConnectionManagerBuilder;
import org.apache.hc.client5.http.ssl.ClientTlsStrategyBuilder;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.message.BasicHeader;
import org.apache.hc.core5.ssl.SSLContexts;
import org.apache.hc.core5.util.Timeout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Configures and builds a {@link RestClient} for one Meilisearch server.
 * <p>
 * The connect timeout defaults to one second and the response timeout to thirty. Document uploads can take longer
 * than that to be accepted on a busy server, raise {@link #setResponseTimeout} or set it per request through
 * {@link RequestOptions.Builder#setResponseTimeout}. Anything else the async http client supports can be changed
 * through the two callbacks.
 */
public final class RestClientBuilder {

    public static final Timeout DEFAULT_CONNECT_TIMEOUT = Timeout.ofSeconds(1);

    public static final Timeout DEFAULT_RESPONSE_TIMEOUT = Timeout.ofSeconds(30);

    // a single server, the pool only bounds the number of concurrent exchanges
    static final int MAX_CONNECTIONS = 20;

    private final HttpHost host;
    private final List<Header> defaultHeaders = new ArrayList<>();
    private String apiKey;
    private Timeout connectTimeout = DEFAULT_CONNECT_TIMEOUT;
    private Timeout responseTimeout = DEFAULT_RESPONSE_TIMEOUT;
    private HttpClientConfigCallback httpClientConfigCallback;
    private RequestConfigCallback requestConfigCallback;
    private String pathPrefix;
    private boolean compressionEnabled = false;

    /**
     * @throws IllegalArgumentException if {@code host} is {@code null}
     */
    RestClientBuilder(HttpHost host) {
        if (host == null) {
            throw new IllegalArgumentException("host must not be null");
        }
        this.host = host;
    }

    /**
     * Replaces the headers sent with every request. Headers set on a request through {@link RequestOptions} win over
     * these.
     *
     * @throws NullPointerException if {@code defaultHeaders} or any header is {@code null}
     */
    public RestClientBuilder setDefaultHeaders(Header[] defaultHeaders) {
        Objects.requireNonNull(defaultHeaders, "defaultHeaders must not be null");
        for (Header defaultHeader : defaultHeaders) {
            Objects.requireNonNull(defaultHeader, "default header must not be null");
        }
        this.defaultHeaders.clear();
        this.defaultHeaders.addAll(Arrays.asList(defaultHeaders));
        return this;
    }

    /**
     * Sends {@code Authorization: Bearer <apiKey>} with every request. {@code null} or an empty key, for a server
     * started without a master key, sends no such header.
     */
    public RestClientBuilder setApiKey(String apiKey) {
        this.apiKey = apiKey == null || apiKey.isEmpty() ? null : apiKey;
        return this;
    }

    public RestClientBuilder setConnectTimeout(Timeout connectTimeout) {
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout must not be null");
        return this;
    }

    public RestClientBuilder setResponseTimeout(Timeout responseTimeout) {
        this.responseTimeout = Objects.requireNonNull(responseTimeout, "responseTimeout must not be null");
        return this;
    }

    /**
     * @throws NullPointerException if {@code httpClientConfigCallback} is {@code null}
     */
    public RestClientBuilder setHttpClientConfigCallback(HttpClientConfigCallback httpClientConfigCallback) {
        Objects.requireNonNull(httpClientConfigCallback, "httpClientConfigCallback must not be null");
        this.httpClientConfigCallback = httpClientConfigCallback;
        return this;
    }

    /**
     * @throws NullPointerException if {@code requestConfigCallback} is {@code null}
     */
    public RestClientBuilder setRequestConfigCallback(RequestConfigCallback requestConfigCallback) {
        Objects.requireNonNull(requestConfigCallback, "requestConfigCallback must not be null");
        this.requestConfigCallback = requestConfigCallback;
        return this;
    }

    /**
     * Sets the path under which a reverse proxy exposes Meilisearch, for instance {@code /search} for
     * {@code https://example.com/search/indexes}.
     *
     * @throws NullPointerException if {@code pathPrefix} is {@code null}
     * @throws IllegalArgumentException if {@code pathPrefix} is empty or ends with more than one '/'
     */
    public RestClientBuilder setPathPrefix(String pathPrefix) {
        this.pathPrefix = cleanPathPrefix(pathPrefix);
        return this;
    }

    /**
     * Normalizes a path prefix to the {@code /base/path} form: one leading slash and no trailing one.
     */
    public static String cleanPathPrefix(String pathPrefix) {
        Objects.requireNonNull(pathPrefix, "pathPrefix must not be null");
        if (pathPrefix.isEmpty()) {
            throw new IllegalArgumentException("pathPrefix must not be empty");
        }
        if (pathPrefix.endsWith("//")) {
            throw new IllegalArgumentException("pathPrefix is malformed. too many trailing slashes: [" + pathPrefix + "]");
        }
        String clean = pathPrefix.startsWith("/") ? pathPrefix : "/" + pathPrefix;
        if (clean.length() > 1 && clean.endsWith("/")) {
            clean = clean.substring(0, clean.length() - 1);
        }
        return clean;
    }

    /**
     * Gzips request bodies and asks Meilisearch for gzipped responses.
     */
    public RestClientBuilder setCompressionEnabled(boolean compressionEnabled) {
        this.compressionEnabled = compressionEnabled;
        return this;
    }

    /**
     * Creates and starts the client.
     */
    public RestClient build() {
        RequestConfig.Builder requestConfigBuilder = RequestConfig.custom()
            .setConnectTimeout(connectTimeout)
            .setResponseTimeout(responseTimeout);
        if (requestConfigCallback != null) {
            requestConfigBuilder = requestConfigCallback.customizeRequestConfig(requestConfigBuilder);
        }
        RequestConfig requestConfig = requestConfigBuilder.build();

        HttpAsyncClientBuilder httpClientBuilder = HttpAsyncClientBuilder.create()
            .setDefaultRequestConfig(requestConfig)
            .setConnectionManager(
                PoolingAsyncClientConnectionManagerBuilder.create()
                    .setMaxConnPerRoute(MAX_CONNECTIONS)
                    .setMaxConnTotal(MAX_CONNECTIONS)
                    .setTlsStrategy(ClientTlsStrategyBuilder.create().setSslContext(SSLContexts.createSystemDefault()).build())
                    .build()
            )
            .disableAutomaticRetries();
        if (httpClientConfigCallback != null) {
            httpClientBuilder = httpClientConfigCallback.customizeHttpClient(httpClientBuilder);
        }
        CloseableHttpAsyncClient httpClient = httpClientBuilder.build();
        RestClient restClient = new RestClient(httpClient, headers(), host, pathPrefix, compressionEnabled, requestConfig);
        httpClient.start();
        return restClient;
    }

    Header[] headers() {
        List<Header> headers = new ArrayList<>(defaultHeaders);
        if (apiKey != null) {
            headers.removeIf(header -> HttpHeaders.AUTHORIZATION.equalsIgnoreCase(header.getName()));
            headers.add(new BasicHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey));
        }
        return headers.toArray(new Header[0]);
    }

    /**
     * Changes the {@link RequestConfig} every request starts from, after the timeouts of this builder are applied.
     */
    public interface RequestConfigCallback {
        RequestConfig.Builder customizeRequestConfig(RequestConfig.Builder requestConfigBuilder);
    }

    /**
     * Changes the async http client before it is built, for instance to set a proxy or a custom TLS setup.
     */
    public interface HttpClientConfigCallback {
        HttpAsyncClientBuilder customizeHttpClient(HttpAsyncClientBuilder httpClientBuilder);
    }
}
