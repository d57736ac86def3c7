/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.util.Timeout;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class RequestOptionsTests extends RestClientTestCase {

    public void testDefault() {
        assertTrue(RequestOptions.DEFAULT.getHeaders().isEmpty());
        assertNull(RequestOptions.DEFAULT.getResponseTimeout());
        assertEquals(RequestOptions.DEFAULT, RequestOptions.DEFAULT.toBuilder().build());
        assertEquals("RequestOptions{}", RequestOptions.DEFAULT.toString());
    }

    public void testAddHeaderReplacesTheValue() {
        RequestOptions options = RequestOptions.DEFAULT.toBuilder()
            .addHeader("X-Meili-Client", "first")
            .addHeader("x-meili-client", "second")
            .build();
        List<Header> headers = options.getHeaders();
        assertEquals(1, headers.size());
        assertEquals("second", headers.get(0).getValue());
        try {
            RequestOptions.DEFAULT.toBuilder().addHeader(null, "value");
            fail("expected failure");
        } catch (NullPointerException e) {
            assertEquals("header name cannot be null", e.getMessage());
        }
        try {
            RequestOptions.DEFAULT.toBuilder().addHeader("X-Meili-Client", null);
            fail("expected failure");
        } catch (NullPointerException e) {
            assertEquals("header value cannot be null", e.getMessage());
        }
    }

    public void testSetApiKey() {
        String token = randomAsciiLettersOfLengthBetween(8, 64);
        RequestOptions options = RequestOptions.DEFAULT.toBuilder().setApiKey(token).build();
        assertEquals(1, options.getHeaders().size());
        assertEquals("Authorization", options.getHeaders().get(0).getName());
        assertEquals("Bearer " + token, options.getHeaders().get(0).getValue());
        assertEquals("RequestOptions{Authorization=<redacted>}", options.toString());
        assertFalse(options.toString().contains(token));
    }

    public void testResponseTimeout() {
        Timeout timeout = Timeout.ofSeconds(randomIntBetween(1, 600));
        RequestOptions options = RequestOptions.DEFAULT.toBuilder().setResponseTimeout(timeout).build();
        assertEquals(timeout, options.getResponseTimeout());
        assertEquals(timeout, options.toBuilder().build().getResponseTimeout());
        assertNotEquals(RequestOptions.DEFAULT, options);
    }

    public void testEqualsAndHashCode() {
        RequestOptions options = RequestOptions.DEFAULT.toBuilder().addHeader("X-Meili-Client", "a").build();
        RequestOptions copy = options.toBuilder().build();
        assertEquals(options, copy);
        assertEquals(options.hashCode(), copy.hashCode());
        assertNotEquals(options, options.toBuilder().addHeader("X-Meili-Client", "b").build());
    }
}
