/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;

import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.message.BasicHeader;
import org.apache.hc.core5.util.Timeout;
import org.junit.After;
import org.junit.Before;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import static org.meilisearch.client.RestClientTestUtil.getAllErrorStatusCodes;
import static org.meilisearch.client.RestClientTestUtil.getAllStatusCodes;
import static org.meilisearch.client.RestClientTestUtil.randomErrorStatusCode;
import static org.meilisearch.client.RestClientTestUtil.randomHttpMethod;
import static org.meilisearch.client.RestClientTestUtil.randomOkStatusCode;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

/**
 * Integration test to check interaction between {@link RestClient} and the async http client.
 * Works against a real http server.
 */
public class RestClientSingleHostIntegTests extends RestClientTestCase {

    private HttpServer httpServer;
    private RestClient restClient;
    private String pathPrefix;
    private Header[] defaultHeaders;
    private WaitForCancelHandler waitForCancelHandler;

    @Before
    public void startHttpServer() throws Exception {
        pathPrefix = randomBoolean() ? "/testPathPrefix/" + randomAsciiLettersOfLengthBetween(1, 5) : "";
        httpServer = createHttpServer();
        defaultHeaders = RestClientTestUtil.randomHeaders(getRandom(), "Header-default");
        restClient = createRestClient(false);
    }

    private HttpServer createHttpServer() throws Exception {
        HttpServer httpServer = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        httpServer.start();
        // returns a different status code depending on the path
        for (int statusCode : getAllStatusCodes()) {
            httpServer.createContext(pathPrefix + "/" + statusCode, new ResponseHandler(statusCode));
        }
        waitForCancelHandler = new WaitForCancelHandler();
        httpServer.createContext(pathPrefix + "/wait", waitForCancelHandler);
        httpServer.createContext(pathPrefix + "/gzip", new GzipResponseHandler());
        return httpServer;
    }

    private static class WaitForCancelHandler implements HttpHandler {

        private final CountDownLatch cancelHandlerLatch = new CountDownLatch(1);

        void cancelDone() {
            cancelHandlerLatch.countDown();
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            try {
                cancelHandlerLatch.await();
            } catch (InterruptedException ignore) {} finally {
                exchange.sendResponseHeaders(200, 0);
                exchange.close();
            }
        }
    }

    private static class ResponseHandler implements HttpHandler {
        private final int statusCode;

        ResponseHandler(int statusCode) {
            this.statusCode = statusCode;
        }

        @Override
        public void handle(HttpExchange httpExchange) throws IOException {
            // copy request body to response body so we can verify it was sent
            byte[] body = readAll(httpExchange.getRequestBody());
            // copy request headers to response headers so we can verify they were sent
            Headers requestHeaders = httpExchange.getRequestHeaders();
            Headers responseHeaders = httpExchange.getResponseHeaders();
            for (Map.Entry<String, List<String>> header : requestHeaders.entrySet()) {
                responseHeaders.put(header.getKey(), header.getValue());
            }
            httpExchange.sendResponseHeaders(statusCode, body.length == 0 ? -1 : body.length);
            if (body.length > 0) {
                try (OutputStream out = httpExchange.getResponseBody()) {
                    out.write(body);
                }
            }
            httpExchange.close();
        }
    }

    /**
     * Decompresses the request body when needed and sends it back gzipped.
     */
    private static class GzipResponseHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange httpExchange) throws IOException {
            InputStream in = httpExchange.getRequestBody();
            if ("gzip".equals(httpExchange.getRequestHeaders().getFirst("Content-Encoding"))) {
                in = new GZIPInputStream(in);
            }
            byte[] body = readAll(in);
            ByteArrayOutputStream compressed = new ByteArrayOutputStream();
            try (GZIPOutputStream gzip = new GZIPOutputStream(compressed)) {
                gzip.write(body);
            }
            httpExchange.getResponseHeaders().add("Content-Type", "application/json");
            httpExchange.getResponseHeaders().add("Content-Encoding", "gzip");
            httpExchange.sendResponseHeaders(200, compressed.size());
            try (OutputStream out = httpExchange.getResponseBody()) {
                out.write(compressed.toByteArray());
            }
            httpExchange.close();
        }
    }

    private static byte[] readAll(InputStream in) throws IOException {
        try (InputStream input = in) {
            return input.readAllBytes();
        }
    }

    private RestClient createRestClient(boolean compressionEnabled) {
        final HttpHost httpHost = new HttpHost(httpServer.getAddress().getHostString(), httpServer.getAddress().getPort());
        final RestClientBuilder restClientBuilder = RestClient.builder(httpHost)
            .setDefaultHeaders(defaultHeaders)
            .setCompressionEnabled(compressionEnabled);
        if (pathPrefix.length() > 0) {
            restClientBuilder.setPathPrefix(pathPrefix);
        }
        return restClientBuilder.build();
    }

    @After
    public void stopHttpServers() throws IOException {
        restClient.close();
        restClient = null;
        httpServer.stop(0);
        httpServer = null;
    }

    /**
     * Tests sending a bunch of async requests works well (e.g. no TimeoutException from the leased pool)
     */
    public void testManyAsyncRequests() throws Exception {
        int iters = randomIntBetween(50, 200);
        final CountDownLatch latch = new CountDownLatch(iters);
        final List<Exception> exceptions = new CopyOnWriteArrayList<>();
        for (int i = 0; i < iters; i++) {
            Request request = new Request("PUT", "/200");
            request.setJsonBody("{}".getBytes(StandardCharsets.UTF_8));
            restClient.performRequestAsync(request, new ResponseListener() {
                @Override
                public void onSuccess(Response response) {
                    latch.countDown();
                }

                @Override
                public void onFailure(Exception exception) {
                    exceptions.add(exception);
                    latch.countDown();
                }
            });
        }

        assertTrue("timeout waiting for requests to be sent", latch.await(30, TimeUnit.SECONDS));
        if (exceptions.isEmpty() == false) {
            AssertionError error = new AssertionError(
                "expected no failures but got some. see suppressed for first 10 of [" + exceptions.size() + "] failures"
            );
            for (Exception exception : exceptions.subList(0, Math.min(10, exceptions.size()))) {
                error.addSuppressed(exception);
            }
            throw error;
        }
    }

    public void testCancelAsyncRequest() throws Exception {
        Request request = new Request(randomHttpMethod(getRandom()), "/wait");
        CountDownLatch requestLatch = new CountDownLatch(1);
        AtomicReference<Exception> error = new AtomicReference<>();
        Cancellable cancellable = restClient.performRequestAsync(request, new ResponseListener() {
            @Override
            public void onSuccess(Response response) {
                throw new AssertionError("onResponse called unexpectedly");
            }

            @Override
            public void onFailure(Exception exception) {
                error.set(exception);
                requestLatch.countDown();
            }
        });
        cancellable.cancel();
        assertTrue(cancellable.isCancelled());
        waitForCancelHandler.cancelDone();
        assertTrue(requestLatch.await(5, TimeUnit.SECONDS));
        assertThat(error.get(), instanceOf(CancellationException.class));
    }

    /**
     * End to end test for headers. The test http server sends back whatever headers it received.
     */
    public void testHeaders() throws Exception {
        for (String method : RestClientTestUtil.getHttpMethods()) {
            final Header[] requestHeaders = RestClientTestUtil.randomHeaders(getRandom(), "Header");
            final int statusCode = randomOkStatusCode(getRandom());
            Request request = new Request(method, "/" + statusCode);
            RequestOptions.Builder options = request.getOptions().toBuilder();
            for (Header header : requestHeaders) {
                options.addHeader(header.getName(), header.getValue());
            }
            request.setOptions(options.build());
            Response response = performRequestSyncOrAsync(restClient, request);

            assertEquals(method, response.getRequestLine().getMethod());
            assertEquals(statusCode, response.getStatusLine().getStatusCode());
            assertEquals(pathPrefix + "/" + statusCode, response.getRequestLine().getUri());
            for (Header requestHeader : requestHeaders) {
                assertHeaderSent(response, requestHeader);
            }
            for (Header defaultHeader : defaultHeaders) {
                boolean overridden = Arrays.stream(requestHeaders).anyMatch(h -> h.getName().equalsIgnoreCase(defaultHeader.getName()));
                if (overridden == false) {
                    assertHeaderSent(response, defaultHeader);
                }
            }
        }
    }

    public void testApiKeyPerRequest() throws Exception {
        String token = randomAsciiLettersOfLengthBetween(16, 64);
        Request request = new Request("POST", "/200");
        request.setOptions(RequestOptions.DEFAULT.toBuilder().setApiKey(token).build());
        Response response = performRequestSyncOrAsync(restClient, request);
        assertHeaderSent(response, new BasicHeader("Authorization", "Bearer " + token));
    }

    public void testResponseTimeoutPerRequest() throws Exception {
        Request request = new Request("GET", "/wait");
        request.setOptions(RequestOptions.DEFAULT.toBuilder().setResponseTimeout(Timeout.ofMilliseconds(200)).build());
        try {
            performRequestSyncOrAsync(restClient, request);
            fail("request should have timed out");
        } catch (SocketTimeoutException e) {
            assertNotNull(e.getMessage());
        } finally {
            waitForCancelHandler.cancelDone();
        }
    }

    private static void assertHeaderSent(Response response, Header expected) {
        boolean found = false;
        for (Header header : response.getHeaders()) {
            if (header.getName().equalsIgnoreCase(expected.getName()) && header.getValue().equals(expected.getValue())) {
                found = true;
                break;
            }
        }
        assertTrue("header [" + expected + "] was not sent", found);
    }

    public void testBodySentWithEveryMethod() throws Exception {
        for (String method : Arrays.asList("POST", "PUT", "PATCH", "DELETE")) {
            String requestBody = "{ \"uid\": \"" + randomAsciiLettersOfLengthBetween(1, 10) + "\" }";
            int statusCode = randomOkStatusCode(getRandom());
            Request request = new Request(method, "/" + statusCode);
            request.setJsonBody(requestBody.getBytes(StandardCharsets.UTF_8));
            Response response = performRequestSyncOrAsync(restClient, request);
            assertEquals(statusCode, response.getStatusLine().getStatusCode());
            assertEquals(requestBody, EntityUtils.toString(response.getEntity()));
        }
    }

    public void testErrorStatusCodes() throws Exception {
        for (int errorStatusCode : getAllErrorStatusCodes()) {
            Request request = new Request(randomHttpMethod(getRandom()), "/" + errorStatusCode);
            request.setJsonBody("{\"message\":\"boom\"}".getBytes(StandardCharsets.UTF_8));
            try {
                performRequestSyncOrAsync(restClient, request);
                fail("request should have failed");
            } catch (ResponseException e) {
                assertEquals(errorStatusCode, e.getResponse().getStatusLine().getStatusCode());
                assertThat(e.getMessage(), containsString("status line"));
                assertThat(e.getMessage(), containsString("{\"message\":\"boom\"}"));
            }
        }
    }

    public void testIgnoreParameter() throws Exception {
        int errorStatusCode = randomErrorStatusCode(getRandom());
        Request request = new Request("GET", "/" + errorStatusCode);
        request.addParameter("ignore", randomBoolean() ? Integer.toString(errorStatusCode) : "418," + errorStatusCode);
        Response response = performRequestSyncOrAsync(restClient, request);
        assertEquals(errorStatusCode, response.getStatusLine().getStatusCode());
        // the ignore parameter is never sent to the server
        assertEquals(pathPrefix + "/" + errorStatusCode, response.getRequestLine().getUri());
    }

    public void testInvalidIgnoreParameter() throws Exception {
        Request request = new Request("GET", "/200");
        request.addParameter("ignore", "not-a-number");
        try {
            restClient.performRequest(request);
            fail("request should have failed");
        } catch (IllegalArgumentException e) {
            assertThat(e.getMessage(), equalTo("ignore value should be a number, found [not-a-number] instead"));
        }
    }

    public void testCompressedRequestAndResponse() throws Exception {
        restClient.close();
        restClient = createRestClient(true);
        String requestBody = "{\"q\":\"" + randomAsciiLettersOfLengthBetween(10, 100) + "\"}";
        Request request = new Request("POST", "/gzip");
        request.setJsonBody(requestBody.getBytes(StandardCharsets.UTF_8));
        Response response = performRequestSyncOrAsync(restClient, request);
        assertEquals(200, response.getStatusLine().getStatusCode());
        assertEquals(requestBody, EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8));
    }

    public void testConnectionRefused() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }
        try (RestClient client = RestClient.builder(new HttpHost(InetAddress.getLoopbackAddress().getHostAddress(), port)).build()) {
            try {
                performRequestSyncOrAsync(client, new Request("GET", "/health"));
                fail("request should have failed");
            } catch (ConnectException e) {
                assertNotNull(e.getMessage());
            }
        }
    }

    static Response performRequestSyncOrAsync(RestClient restClient, Request request) throws Exception {
        if (randomBoolean()) {
            return restClient.performRequest(request);
        }
        final AtomicReference<Response> responseRef = new AtomicReference<>();
        final AtomicReference<Exception> exceptionRef = new AtomicReference<>();
        final CountDownLatch latch = new CountDownLatch(1);
        restClient.performRequestAsync(request, new ResponseListener() {
            @Override
            public void onSuccess(Response response) {
                responseRef.set(response);
                latch.countDown();
            }

            @Override
            public void onFailure(Exception exception) {
                exceptionRef.set(exception);
                latch.countDown();
            }
        });
        assertTrue("request timed out", latch.await(30, TimeUnit.SECONDS));
        if (exceptionRef.get() != null) {
            throw exceptionRef.get();
        }
        return responseRef.get();
    }
}
