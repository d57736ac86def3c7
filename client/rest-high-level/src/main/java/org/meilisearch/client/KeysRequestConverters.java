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
import org.meilisearch.client.keys.CreateKeyRequest;
import org.meilisearch.client.keys.UpdateKeyRequest;

import java.io.IOException;

final class KeysRequestConverters {

    private KeysRequestConverters() {}

    static Request getKeys(Integer offset, Integer limit) {
        Request request = new Request(HttpGet.METHOD_NAME, "/keys");
        request.addParameters(new RequestConverters.Params().withOffset(offset).withLimit(limit).asMap());
        return request;
    }

    static Request getKey(String key) {
        return new Request(HttpGet.METHOD_NAME, RequestConverters.endpoint("keys", key));
    }

    static Request createKey(CreateKeyRequest createKeyRequest) throws IOException {
        Request request = new Request(HttpPost.METHOD_NAME, "/keys");
        request.setJsonBody(RequestConverters.toJson(createKeyRequest));
        return request;
    }

    static Request updateKey(UpdateKeyRequest updateKeyRequest) throws IOException {
        Request request = new Request(HttpPatch.METHOD_NAME, RequestConverters.endpoint("keys", updateKeyRequest.getKey()));
        request.setJsonBody(RequestConverters.toJson(updateKeyRequest));
        return request;
    }

    static Request deleteKey(String key) {
        return new Request(HttpDelete.METHOD_NAME, RequestConverters.endpoint("keys", key));
    }
}
