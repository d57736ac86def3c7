/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

/**
 * Listener to be provided when calling async performRequest methods provided by {@link RestClient}.
 * Those methods that do accept a listener will return immediately, execute asynchronously, and notify
 * the listener whenever the request yielded a response, or failed with an exception.
 * <p>
 * Note that it is <strong>not</strong> safe to call {@link RestClient#close()} from either of these
 * callbacks.
 */
public interface ResponseListener {

    /**
     * Method invoked if the request yielded a successful response
     */
    void onSuccess(Response response);

    /**
     * Method invoked if the request failed. There are two main categories of failures: connection failures (usually
     * {@link java.io.IOException}s, or responses that were treated as errors based on their error response code
     * ({@link ResponseException}s).
     */
    void onFailure(Exception exception);
}
