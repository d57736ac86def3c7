/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.apache.hc.client5.http.classic.methods.HttpDelete;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPatch;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpPut;
import org.apache.hc.client5.http.classic.methods.HttpUriRequest;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHost;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.ProtocolVersion;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.http.io.entity.InputStreamEntity;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.http.message.BasicClassicHttpResponse;
import org.apache.hc.core5.http.message.BasicHeader;
import org.apache.hc.core5.http.message.StatusLine;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;

import static org.hamcrest.CoreMatchers.containsString;
import static org.hamcrest.CoreMatchers.equalTo;
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.Assert.assertEquals;

public class RequestLoggerTests extends RestClientTestCase {

    public void testTraceRequestWithoutBody() throws URISyntaxException {
        HttpHost host = new HttpHost(randomBoolean() ? "http" : "https", "localhost", 7700);
        URI uri = randomBoolean() ? new URI("/indexes/movies/stats") : new URI("indexes/movies/stats");
        HttpUriRequest httpRequest = randomHttpRequest(uri);
        Request request = new Request(httpRequest.getMethod(), "/indexes/movies/stats");

        String expected = "curl -iX " + httpRequest.getMethod() + " '" + host.toURI() + "/indexes/movies/stats'";
        assertThat(RequestLogger.buildTraceRequest(httpRequest, request, host), equalTo(expected));
    }

    public void testTraceRequestHidesTheApiKey() throws URISyntaxException {
        HttpHost host = new HttpHost("http", "localhost", 7700);
        HttpUriRequest httpRequest = new HttpGet(new URI("/keys"));
        String apiKey = randomAsciiLettersOfLengthBetween(16, 64);
        httpRequest.addHeader("Authorization", "Bearer " + apiKey);

        String trace = RequestLogger.buildTraceRequest(httpRequest, new Request("GET", "/keys"), host);
        assertThat(trace, equalTo("curl -iX GET 'http://localhost:7700/keys' -H \"Authorization: Bearer $MEILI_API_KEY\""));
        assertThat(trace, not(containsString(apiKey)));
    }

    public void testTraceRequestWithBody() throws URISyntaxException {
        HttpHost host = new HttpHost("http", "localhost", 7700);
        HttpUriRequest httpRequest = new HttpPost(new URI("/indexes/movies/documents"));
        Request request = new Request("POST", "/indexes/movies/documents");
        String csv = "id,title\n1,Schindler's List\n";
        ContentType csvType = ContentType.create("text/csv", StandardCharsets.UTF_8);
        request.setBody(csv.getBytes(StandardCharsets.UTF_8), csvType);

        String expected = "curl -iX POST 'http://localhost:7700/indexes/movies/documents'"
            + " -H 'Content-Type: text/csv; charset=UTF-8'"
            + " --data-binary 'id,title\n1,Schindler'\\''s List\n'";
        assertThat(RequestLogger.buildTraceRequest(httpRequest, request, host), equalTo(expected));
    }

    public void testTraceResponse() throws IOException, ParseException {
        ProtocolVersion protocolVersion = new ProtocolVersion("HTTP", 1, 1);
        int statusCode = randomIntBetween(200, 599);
        String reasonPhrase = "REASON";
        StatusLine statusLine = new StatusLine(protocolVersion, statusCode, reasonPhrase);
        String expected = "# " + statusLine.toString();
        ClassicHttpResponse httpResponse = new BasicClassicHttpResponse(statusCode, reasonPhrase);
        int numHeaders = randomIntBetween(0, 3);
        for (int i = 0; i < numHeaders; i++) {
            httpResponse.setHeader("header" + i, "value");
            expected += "\n# header" + i + ": value";
        }
        expected += "\n#";
        boolean hasBody = getRandom().nextBoolean();
        String responseBody = "{\n  \"status\": \"available\"\n}";
        if (hasBody) {
            expected += "\n# {";
            expected += "\n#   \"status\": \"available\"";
            expected += "\n# }";
            HttpEntity entity;
            if (randomBoolean()) {
                entity = new StringEntity(responseBody, ContentType.APPLICATION_JSON);
            } else {
                entity = new InputStreamEntity(
                    new ByteArrayInputStream(responseBody.getBytes(StandardCharsets.UTF_8)),
                    ContentType.APPLICATION_JSON
                );
            }
            httpResponse.setEntity(entity);
        }
        String traceResponse = RequestLogger.buildTraceResponse(httpResponse);
        assertThat(traceResponse, equalTo(expected));
        if (hasBody) {
            // the body must still be readable by the caller
            String body = EntityUtils.toString(httpResponse.getEntity(), StandardCharsets.UTF_8);
            assertThat(body, equalTo(responseBody));
        }
    }

    public void testResponseWarnings() throws Exception {
        HttpHost host = new HttpHost("localhost", 7700);
        HttpUriRequest httpRequest = randomHttpRequest(new URI("/indexes/movies/documents"));
        int numWarnings = randomIntBetween(1, 5);
        StringBuilder expected = new StringBuilder("request [").append(httpRequest.getMethod())
            .append(" ")
            .append(host.toURI())
            .append("/indexes/movies/documents] returned ")
            .append(numWarnings)
            .append(" warnings: ");
        Header[] warnings = new Header[numWarnings];
        for (int i = 0; i < numWarnings; i++) {
            String warning = "this is warning number " + i;
            warnings[i] = new BasicHeader("Warning", warning);
            if (i > 0) {
                expected.append(",");
            }
            expected.append("[").append(warning).append("]");
        }
        assertEquals(expected.toString(), RequestLogger.buildWarningMessage(httpRequest, host, warnings));
    }

    private static HttpUriRequest randomHttpRequest(URI uri) {
        switch (randomIntBetween(0, 4)) {
            case 0:
                return new HttpGet(uri);
            case 1:
                return new HttpPost(uri);
            case 2:
                return new HttpPut(uri);
            case 3:
                return new HttpPatch(uri);
            case 4:
                return new HttpDelete(uri);
            default:
                throw new UnsupportedOperationException();
        }
    }
}
