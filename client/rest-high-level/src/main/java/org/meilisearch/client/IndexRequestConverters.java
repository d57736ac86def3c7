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
import org.meilisearch.client.indices.CreateIndexRequest;

import java.io.IOException;
import java.util.Collections;

final class IndexRequestConverters {

    private IndexRequestConverters() {}

    static Request createIndex(CreateIndexRequest createIndexRequest) throws IOException {
        Request request = new Request(HttpPost.METHOD_NAME, "/indexes");
        request.setJsonBody(RequestConverters.toJson(createIndexRequest));
        return request;
    }

    static Request getIndexes(Integer offset, Integer limit) {
        Request request = new Request(HttpGet.METHOD_NAME, "/indexes");
        RequestConverters.Params params = new RequestConverters.Params();
        params.withOffset(offset);
        params.withLimit(limit);
        request.addParameters(params.asMap());
        return request;
    }

    static Request getIndex(String uid) {
        return new Request(HttpGet.METHOD_NAME, RequestConverters.endpoint("indexes", uid));
    }

    static Request updateIndex(String uid, String primaryKey) throws IOException {
        Request request = new Request(HttpPatch.METHOD_NAME, RequestConverters.endpoint("indexes", uid));
        request.setJsonBody(RequestConverters.toJson(Collections.singletonMap("primaryKey", primaryKey)));
        return request;
    }

    static Request deleteIndex(String uid) {
        return new Request(HttpDelete.METHOD_NAME, RequestConverters.endpoint("indexes", uid));
    }

    static Request indexStats(String uid) {
        String endpoint = new RequestConverters.EndpointBuilder().addPathPartAsIs("indexes")
            .addPathPart(uid)
            .addPathPartAsIs("stats")
            .build();
        return new Request(HttpGet.METHOD_NAME, endpoint);
    }
}
