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
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.core5.http.ContentType;
import org.meilisearch.client.documents.GetDocumentsRequest;
import org.meilisearch.client.search.SearchRequest;

import java.io.IOException;
import java.util.Collection;
import java.util.List;
import java.util.Map;

final class DocumentRequestConverters {

    private DocumentRequestConverters() {}

    static Request getDocuments(String uid, GetDocumentsRequest getDocumentsRequest) {
        Request request = new Request(HttpGet.METHOD_NAME, documentsEndpoint(uid).build());
        RequestConverters.Params params = new RequestConverters.Params();
        params.withOffset(getDocumentsRequest.getOffset());
        params.withLimit(getDocumentsRequest.getLimit());
        params.withCommaSeparated("fields", getDocumentsRequest.getFields());
        request.addParameters(params.asMap());
        return request;
    }

    static Request getDocument(String uid, String documentId) {
        return new Request(HttpGet.METHOD_NAME, documentsEndpoint(uid).addPathPart(documentId).build());
    }

    /**
     * Adds ({@code POST}) or replaces ({@code PUT}) documents.
     */
    static Request writeDocuments(String method, String uid, List<Map<String, Object>> documents, String primaryKey)
        throws IOException {
        Request request = new Request(method, documentsEndpoint(uid).build());
        request.addParameters(new RequestConverters.Params().withPrimaryKey(primaryKey).asMap());
        request.setJsonBody(RequestConverters.toJson(documents));
        return request;
    }

    /**
     * Same as {@link #writeDocuments} for a body that is already encoded, such as the content of a csv file.
     */
    static Request writeRawDocuments(String method, String uid, byte[] documents, ContentType contentType, String primaryKey) {
        Request request = new Request(method, documentsEndpoint(uid).build());
        request.addParameters(new RequestConverters.Params().withPrimaryKey(primaryKey).asMap());
        request.setBody(documents, contentType);
        return request;
    }

    static Request deleteDocument(String uid, String documentId) {
        return new Request(HttpDelete.METHOD_NAME, documentsEndpoint(uid).addPathPart(documentId).build());
    }

    static Request deleteDocuments(String uid, Collection<String> documentIds) throws IOException {
        Request request = new Request(HttpPost.METHOD_NAME, documentsEndpoint(uid).addPathPartAsIs("delete-batch").build());
        request.setJsonBody(RequestConverters.toJson(documentIds));
        return request;
    }

    static Request deleteAllDocuments(String uid) {
        return new Request(HttpDelete.METHOD_NAME, documentsEndpoint(uid).build());
    }

    static Request search(String uid, SearchRequest searchRequest) throws IOException {
        String endpoint = new RequestConverters.EndpointBuilder().addPathPartAsIs("indexes")
            .addPathPart(uid)
            .addPathPartAsIs("search")
            .build();
        Request request = new Request(HttpPost.METHOD_NAME, endpoint);
        request.setJsonBody(RequestConverters.toJson(searchRequest));
        return request;
    }

    private static RequestConverters.EndpointBuilder documentsEndpoint(String uid) {
        return new RequestConverters.EndpointBuilder().addPathPartAsIs("indexes").addPathPart(uid).addPathPartAsIs("documents");
    }
}
