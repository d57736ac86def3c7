/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import com.fasterxml.jackson.core.JsonParser;
import org.meilisearch.client.keys.CreateKeyRequest;
import org.meilisearch.client.keys.Key;
import org.meilisearch.client.keys.KeysPage;
import org.meilisearch.client.keys.UpdateKeyRequest;

import java.io.IOException;
import java.util.List;

import static java.util.Collections.emptySet;

/**
 * A wrapper for the {@link MeilisearchClient} that provides methods for accessing the API key endpoints.
 * <p>
 * These endpoints need the master key.
 */
public final class KeysClient {

    private final MeilisearchClient meilisearchClient;

    KeysClient(MeilisearchClient meilisearchClient) {
        this.meilisearchClient = meilisearchClient;
    }

    /**
     * Lists the API keys.
     *
     * @return the keys
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public List<Key> getKeys() throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> KeysRequestConverters.getKeys(null, null),
            RequestOptions.DEFAULT,
            KeysClient::parseKeys,
            emptySet()
        );
    }

    /**
     * Asynchronously lists the API keys.
     *
     * @param listener the listener to be notified upon request completion
     * @return cancellable that may be used to cancel the request
     */
    public Cancellable getKeysAsync(ActionListener<List<Key>> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> KeysRequestConverters.getKeys(null, null),
            RequestOptions.DEFAULT,
            KeysClient::parseKeys,
            listener,
            emptySet()
        );
    }

    /**
     * Gets a single API key.
     *
     * @param key the uid or the value of the key
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public Key getKey(String key) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> KeysRequestConverters.getKey(key),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(Key.class),
            emptySet()
        );
    }

    public Cancellable getKeyAsync(String key, ActionListener<Key> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> KeysRequestConverters.getKey(key),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(Key.class),
            listener,
            emptySet()
        );
    }

    /**
     * Creates an API key.
     *
     * @return the new key, holding its generated value
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public Key createKey(CreateKeyRequest createKeyRequest) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            createKeyRequest,
            KeysRequestConverters::createKey,
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(Key.class),
            emptySet()
        );
    }

    public Cancellable createKeyAsync(CreateKeyRequest createKeyRequest, ActionListener<Key> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            createKeyRequest,
            KeysRequestConverters::createKey,
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(Key.class),
            listener,
            emptySet()
        );
    }

    /**
     * Updates the name or the description of an API key.
     *
     * @return the updated key
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public Key updateKey(UpdateKeyRequest updateKeyRequest) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            updateKeyRequest,
            KeysRequestConverters::updateKey,
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(Key.class),
            emptySet()
        );
    }

    public Cancellable updateKeyAsync(UpdateKeyRequest updateKeyRequest, ActionListener<Key> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            updateKeyRequest,
            KeysRequestConverters::updateKey,
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(Key.class),
            listener,
            emptySet()
        );
    }

    /**
     * Deletes an API key.
     *
     * @return the HTTP status code of the response, 204 when the key was deleted
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public int deleteKey(String key) throws IOException {
        return meilisearchClient.performRequest(
            Validatable.EMPTY,
            request -> KeysRequestConverters.deleteKey(key),
            RequestOptions.DEFAULT,
            KeysClient::statusCode,
            emptySet()
        );
    }

    public Cancellable deleteKeyAsync(String key, ActionListener<Integer> listener) {
        return meilisearchClient.performRequestAsync(
            Validatable.EMPTY,
            request -> KeysRequestConverters.deleteKey(key),
            RequestOptions.DEFAULT,
            KeysClient::statusCode,
            listener,
            emptySet()
        );
    }

    private static List<Key> parseKeys(JsonParser parser) throws IOException {
        return parser.readValueAs(KeysPage.class).getResults();
    }

    private static Integer statusCode(Response response) {
        return response.getStatusLine().getStatusCode();
    }
}
