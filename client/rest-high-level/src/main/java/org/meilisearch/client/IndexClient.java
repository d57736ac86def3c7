/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import com.fasterxml.jackson.core.type.TypeReference;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.classic.methods.HttpPut;
import org.meilisearch.MeilisearchApiException;
import org.meilisearch.MeilisearchException;
import org.meilisearch.client.documents.DocumentBatches;
import org.meilisearch.client.documents.DocumentLoader;
import org.meilisearch.client.documents.DocumentType;
import org.meilisearch.client.documents.DocumentsPage;
import org.meilisearch.client.documents.GetDocumentsRequest;
import org.meilisearch.client.indices.IndexInfo;
import org.meilisearch.client.indices.IndexStats;
import org.meilisearch.client.search.SearchRequest;
import org.meilisearch.client.search.SearchResult;
import org.meilisearch.client.tasks.GetTasksRequest;
import org.meilisearch.client.tasks.TaskInfo;
import org.meilisearch.client.tasks.TaskResult;
import org.meilisearch.client.tasks.TaskStatus;
import org.meilisearch.client.tasks.TasksPage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static java.util.Collections.emptySet;

/**
 * A wrapper for the {@link MeilisearchClient} bound to a single index. Provides methods for the index itself, its
 * documents, search, settings and tasks.
 * <p>
 * The index information ({@link #primaryKey()}, {@link #createdAt()}, {@link #updatedAt()}) is only known once fetched,
 * for example through {@link #fetchInfo()}: an instance returned by {@link MeilisearchClient#index(String)} only knows
 * its uid.
 * <p>
 * Document writes return the {@link TaskInfo} of the enqueued task, the documents are indexed once it succeeded.
 * The batched variants send one request per batch and return the tasks in batch order.
 */
public class IndexClient {

    private static final TypeReference<Map<String, Object>> DOCUMENT_TYPE = new TypeReference<Map<String, Object>>() {};

    private final MeilisearchClient meilisearchClient;
    private final String uid;
    private final SettingsClient settingsClient;

    private volatile String primaryKey;
    private volatile Instant createdAt;
    private volatile Instant updatedAt;

    IndexClient(MeilisearchClient meilisearchClient, String uid) {
        if (uid == null || uid.isEmpty()) {
            throw new IllegalArgumentException("index uid must not be empty");
        }
        this.meilisearchClient = meilisearchClient;
        this.uid = uid;
        this.settingsClient = new SettingsClient(meilisearchClient, uid);
    }

    public String uid() {
        return uid;
    }

    /**
     * The primary key as last fetched, {@code null} if unknown
     */
    public String primaryKey() {
        return primaryKey;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    void setInfo(IndexInfo info) {
        this.primaryKey = info.getPrimaryKey();
        this.createdAt = info.getCreatedAt();
        this.updatedAt = info.getUpdatedAt();
    }

    /**
     * Provides methods for reading and changing the settings of this index.
     */
    public SettingsClient settings() {
        return settingsClient;
    }

    /**
     * Fetches the index information and stores it in this instance.
     *
     * @return this instance
     * @throws MeilisearchApiException with code {@code index_not_found} if the index does not exist
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public IndexClient fetchInfo() throws IOException {
        IndexInfo info = meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> IndexRequestConverters.getIndex(uid),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(IndexInfo.class),
            emptySet()
        );
        setInfo(info);
        return this;
    }

    public Cancellable fetchInfoAsync(ActionListener<IndexClient> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> IndexRequestConverters.getIndex(uid),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(IndexInfo.class),
            ActionListener.<IndexClient, IndexInfo>map(listener, info -> {
                setInfo(info);
                return this;
            }),
            emptySet()
        );
    }

    /**
     * Fetches the index information and returns the primary key.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public String getPrimaryKey() throws IOException {
        return fetchInfo().primaryKey();
    }

    public Cancellable getPrimaryKeyAsync(ActionListener<String> listener) {
        return fetchInfoAsync(ActionListener.map(listener, IndexClient::primaryKey));
    }

    /**
     * Changes the primary key of the index, waits for the update task to finish and refreshes the index information.
     *
     * @return this instance
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public IndexClient update(String newPrimaryKey) throws IOException {
        TaskInfo taskInfo = meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> IndexRequestConverters.updateIndex(uid, newPrimaryKey),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            emptySet()
        );
        meilisearchClient.waitForTask(taskInfo.getTaskUid());
        return fetchInfo();
    }

    public Cancellable updateAsync(String newPrimaryKey, ActionListener<IndexClient> listener) {
        ChainedCancellable chain = new ChainedCancellable();
        chain.setDependency(
            meilisearchClient.performRequestAsyncAndParseEntity(
                Validatable.EMPTY,
                request -> IndexRequestConverters.updateIndex(uid, newPrimaryKey),
                RequestOptions.DEFAULT,
                MeilisearchClient.parser(TaskInfo.class),
                ActionListener.wrap(
                    taskInfo -> chain.setDependency(
                        meilisearchClient.tasks()
                            .waitForTaskAsync(
                                taskInfo.getTaskUid(),
                                ActionListener.wrap(task -> chain.setDependency(fetchInfoAsync(listener)), listener::onFailure)
                            )
                    ),
                    listener::onFailure
                ),
                emptySet()
            )
        );
        return Cancellable.fromDependency(chain);
    }

    /**
     * Deletes the index.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public TaskInfo delete() throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> IndexRequestConverters.deleteIndex(uid),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            emptySet()
        );
    }

    public Cancellable deleteAsync(ActionListener<TaskInfo> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> IndexRequestConverters.deleteIndex(uid),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            listener,
            emptySet()
        );
    }

    /**
     * Deletes the index if it exists and waits for the deletion task to finish.
     *
     * @return {@code true} if the index was deleted, {@code false} if it did not exist
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public boolean deleteIfExists() throws IOException {
        TaskInfo taskInfo;
        try {
            taskInfo = delete();
        } catch (MeilisearchApiException e) {
            if (MeilisearchClient.INDEX_NOT_FOUND.equals(e.getCode())) {
                return false;
            }
            throw e;
        }
        return meilisearchClient.waitForTask(taskInfo.getTaskUid()).getStatus() == TaskStatus.SUCCEEDED;
    }

    public Cancellable deleteIfExistsAsync(ActionListener<Boolean> listener) {
        ChainedCancellable chain = new ChainedCancellable();
        chain.setDependency(deleteAsync(new ActionListener<TaskInfo>() {
            @Override
            public void onResponse(TaskInfo taskInfo) {
                chain.setDependency(
                    meilisearchClient.tasks()
                        .waitForTaskAsync(
                            taskInfo.getTaskUid(),
                            ActionListener.<Boolean, TaskResult>map(listener, task -> task.getStatus() == TaskStatus.SUCCEEDED)
                        )
                );
            }

            @Override
            public void onFailure(Exception e) {
                if (e instanceof MeilisearchApiException
                    && MeilisearchClient.INDEX_NOT_FOUND.equals(((MeilisearchApiException) e).getCode())) {
                    listener.onResponse(false);
                } else {
                    listener.onFailure(e);
                }
            }
        }));
        return Cancellable.fromDependency(chain);
    }

    /**
     * Gets the statistics of the index.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public IndexStats getStats() throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> IndexRequestConverters.indexStats(uid),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(IndexStats.class),
            emptySet()
        );
    }

    public Cancellable getStatsAsync(ActionListener<IndexStats> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> IndexRequestConverters.indexStats(uid),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(IndexStats.class),
            listener,
            emptySet()
        );
    }

    /**
     * Gets one page of documents.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public DocumentsPage getDocuments(GetDocumentsRequest getDocumentsRequest) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            getDocumentsRequest,
            request -> DocumentRequestConverters.getDocuments(uid, request),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(DocumentsPage.class),
            emptySet()
        );
    }

    public DocumentsPage getDocuments() throws IOException {
        return getDocuments(new GetDocumentsRequest());
    }

    public Cancellable getDocumentsAsync(GetDocumentsRequest getDocumentsRequest, ActionListener<DocumentsPage> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            getDocumentsRequest,
            request -> DocumentRequestConverters.getDocuments(uid, request),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(DocumentsPage.class),
            listener,
            emptySet()
        );
    }

    /**
     * Gets a single document.
     *
     * @throws MeilisearchApiException with code {@code document_not_found} if there is no such document
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public Map<String, Object> getDocument(String documentId) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> DocumentRequestConverters.getDocument(uid, documentId),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(DOCUMENT_TYPE),
            emptySet()
        );
    }

    public Cancellable getDocumentAsync(String documentId, ActionListener<Map<String, Object>> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> DocumentRequestConverters.getDocument(uid, documentId),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(DOCUMENT_TYPE),
            listener,
            emptySet()
        );
    }

    /**
     * Adds documents, replacing any existing document with the same primary key.
     *
     * @param primaryKey the primary key to set on the index, or {@code null} to keep the current one
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public TaskInfo addDocuments(List<Map<String, Object>> documents, String primaryKey) throws IOException {
        return writeDocuments(HttpPost.METHOD_NAME, () -> documents, primaryKey);
    }

    public Cancellable addDocumentsAsync(List<Map<String, Object>> documents, String primaryKey, ActionListener<TaskInfo> listener) {
        return writeDocumentsAsync(HttpPost.METHOD_NAME, () -> documents, primaryKey, listener);
    }

    /**
     * Adds documents, or updates the fields of existing documents with the same primary key.
     *
     * @param primaryKey the primary key to set on the index, or {@code null} to keep the current one
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public TaskInfo updateDocuments(List<Map<String, Object>> documents, String primaryKey) throws IOException {
        return writeDocuments(HttpPut.METHOD_NAME, () -> documents, primaryKey);
    }

    public Cancellable updateDocumentsAsync(List<Map<String, Object>> documents, String primaryKey, ActionListener<TaskInfo> listener) {
        return writeDocumentsAsync(HttpPut.METHOD_NAME, () -> documents, primaryKey, listener);
    }

    /**
     * Adds documents in batches of {@code batchSize} documents.
     *
     * @throws IllegalArgumentException if {@code batchSize} is not positive
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public List<TaskInfo> addDocumentsInBatches(List<Map<String, Object>> documents, int batchSize, String primaryKey)
        throws IOException {
        return writeBatches(HttpPost.METHOD_NAME, () -> DocumentBatches.batch(documents, batchSize), primaryKey);
    }

    /**
     * Asynchronous form of {@link #addDocumentsInBatches}. The batches are sent concurrently, the first failure fails
     * the listener once every batch got a response.
     */
    public Cancellable addDocumentsInBatchesAsync(
        List<Map<String, Object>> documents,
        int batchSize,
        String primaryKey,
        ActionListener<List<TaskInfo>> listener
    ) {
        return writeBatchesAsync(HttpPost.METHOD_NAME, () -> DocumentBatches.batch(documents, batchSize), primaryKey, listener);
    }

    public List<TaskInfo> updateDocumentsInBatches(List<Map<String, Object>> documents, int batchSize, String primaryKey)
        throws IOException {
        return writeBatches(HttpPut.METHOD_NAME, () -> DocumentBatches.batch(documents, batchSize), primaryKey);
    }

    public Cancellable updateDocumentsInBatchesAsync(
        List<Map<String, Object>> documents,
        int batchSize,
        String primaryKey,
        ActionListener<List<TaskInfo>> listener
    ) {
        return writeBatchesAsync(HttpPut.METHOD_NAME, () -> DocumentBatches.batch(documents, batchSize), primaryKey, listener);
    }

    /**
     * Adds documents in as few requests as possible, each request body staying within {@code maxPayloadSize} bytes.
     *
     * @param maxPayloadSize the maximum size of a request body, {@link DocumentBatches#DEFAULT_MAX_PAYLOAD_SIZE} matches the server default
     * @throws org.meilisearch.PayloadTooLargeException if a single document is larger than {@code maxPayloadSize}
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public List<TaskInfo> addDocumentsAutoBatch(List<Map<String, Object>> documents, long maxPayloadSize, String primaryKey)
        throws IOException {
        return writeBatches(HttpPost.METHOD_NAME, () -> DocumentBatches.autoBatch(documents, maxPayloadSize), primaryKey);
    }

    public Cancellable addDocumentsAutoBatchAsync(
        List<Map<String, Object>> documents,
        long maxPayloadSize,
        String primaryKey,
        ActionListener<List<TaskInfo>> listener
    ) {
        return writeBatchesAsync(HttpPost.METHOD_NAME, () -> DocumentBatches.autoBatch(documents, maxPayloadSize), primaryKey, listener);
    }

    public List<TaskInfo> updateDocumentsAutoBatch(List<Map<String, Object>> documents, long maxPayloadSize, String primaryKey)
        throws IOException {
        return writeBatches(HttpPut.METHOD_NAME, () -> DocumentBatches.autoBatch(documents, maxPayloadSize), primaryKey);
    }

    public Cancellable updateDocumentsAutoBatchAsync(
        List<Map<String, Object>> documents,
        long maxPayloadSize,
        String primaryKey,
        ActionListener<List<TaskInfo>> listener
    ) {
        return writeBatchesAsync(HttpPut.METHOD_NAME, () -> DocumentBatches.autoBatch(documents, maxPayloadSize), primaryKey, listener);
    }

    /**
     * Adds the documents held by a json, csv or ndjson file.
     *
     * @throws MeilisearchException if the file is not a json, csv or ndjson file
     * @throws org.meilisearch.InvalidDocumentException if the file does not hold a list of objects
     * @throws IOException in case the file can not be read, or there is a problem sending the request or parsing back the response
     * @see DocumentLoader
     */
    public TaskInfo addDocumentsFromFile(Path path, String primaryKey) throws IOException {
        return writeDocuments(HttpPost.METHOD_NAME, () -> DocumentLoader.loadDocumentsFromFile(path), primaryKey);
    }

    /**
     * Asynchronous form of {@link #addDocumentsFromFile}. The file is read by the calling thread.
     */
    public Cancellable addDocumentsFromFileAsync(Path path, String primaryKey, ActionListener<TaskInfo> listener) {
        return writeDocumentsAsync(HttpPost.METHOD_NAME, () -> DocumentLoader.loadDocumentsFromFile(path), primaryKey, listener);
    }

    public TaskInfo updateDocumentsFromFile(Path path, String primaryKey) throws IOException {
        return writeDocuments(HttpPut.METHOD_NAME, () -> DocumentLoader.loadDocumentsFromFile(path), primaryKey);
    }

    public Cancellable updateDocumentsFromFileAsync(Path path, String primaryKey, ActionListener<TaskInfo> listener) {
        return writeDocumentsAsync(HttpPut.METHOD_NAME, () -> DocumentLoader.loadDocumentsFromFile(path), primaryKey, listener);
    }

    public List<TaskInfo> addDocumentsFromFileInBatches(Path path, int batchSize, String primaryKey) throws IOException {
        return writeBatches(HttpPost.METHOD_NAME, () -> DocumentBatches.batch(DocumentLoader.loadDocumentsFromFile(path), batchSize), primaryKey);
    }

    public Cancellable addDocumentsFromFileInBatchesAsync(
        Path path,
        int batchSize,
        String primaryKey,
        ActionListener<List<TaskInfo>> listener
    ) {
        return writeBatchesAsync(
            HttpPost.METHOD_NAME,
            () -> DocumentBatches.batch(DocumentLoader.loadDocumentsFromFile(path), batchSize),
            primaryKey,
            listener
        );
    }

    public List<TaskInfo> updateDocumentsFromFileInBatches(Path path, int batchSize, String primaryKey) throws IOException {
        return writeBatches(HttpPut.METHOD_NAME, () -> DocumentBatches.batch(DocumentLoader.loadDocumentsFromFile(path), batchSize), primaryKey);
    }

    public Cancellable updateDocumentsFromFileInBatchesAsync(
        Path path,
        int batchSize,
        String primaryKey,
        ActionListener<List<TaskInfo>> listener
    ) {
        return writeBatchesAsync(
            HttpPut.METHOD_NAME,
            () -> DocumentBatches.batch(DocumentLoader.loadDocumentsFromFile(path), batchSize),
            primaryKey,
            listener
        );
    }

    public List<TaskInfo> addDocumentsFromFileAutoBatch(Path path, long maxPayloadSize, String primaryKey) throws IOException {
        return writeBatches(
            HttpPost.METHOD_NAME,
            () -> DocumentBatches.autoBatch(DocumentLoader.loadDocumentsFromFile(path), maxPayloadSize),
            primaryKey
        );
    }

    public Cancellable addDocumentsFromFileAutoBatchAsync(
        Path path,
        long maxPayloadSize,
        String primaryKey,
        ActionListener<List<TaskInfo>> listener
    ) {
        return writeBatchesAsync(
            HttpPost.METHOD_NAME,
            () -> DocumentBatches.autoBatch(DocumentLoader.loadDocumentsFromFile(path), maxPayloadSize),
            primaryKey,
            listener
        );
    }

    public List<TaskInfo> updateDocumentsFromFileAutoBatch(Path path, long maxPayloadSize, String primaryKey) throws IOException {
        return writeBatches(
            HttpPut.METHOD_NAME,
            () -> DocumentBatches.autoBatch(DocumentLoader.loadDocumentsFromFile(path), maxPayloadSize),
            primaryKey
        );
    }

    public Cancellable updateDocumentsFromFileAutoBatchAsync(
        Path path,
        long maxPayloadSize,
        String primaryKey,
        ActionListener<List<TaskInfo>> listener
    ) {
        return writeBatchesAsync(
            HttpPut.METHOD_NAME,
            () -> DocumentBatches.autoBatch(DocumentLoader.loadDocumentsFromFile(path), maxPayloadSize),
            primaryKey,
            listener
        );
    }

    /**
     * Adds the documents of every file of the given type found in {@code directory}.
     *
     * @param documentType the type of the files to load
     * @param combineDocuments whether to send all the documents in a single request rather than one request per file
     * @return the enqueued tasks, a single one when the documents are combined
     * @throws MeilisearchException if there is no file of the given type in {@code directory}
     * @throws IOException in case a file can not be read, or there is a problem sending the request or parsing back the response
     */
    public List<TaskInfo> addDocumentsFromDirectory(Path directory, String primaryKey, DocumentType documentType, boolean combineDocuments)
        throws IOException {
        return writeBatches(HttpPost.METHOD_NAME, () -> directoryBatches(directory, documentType, combineDocuments), primaryKey);
    }

    /**
     * Same as {@link #addDocumentsFromDirectory(Path, String, DocumentType, boolean)} for json files, combined in a single request.
     */
    public List<TaskInfo> addDocumentsFromDirectory(Path directory, String primaryKey) throws IOException {
        return addDocumentsFromDirectory(directory, primaryKey, DocumentType.JSON, true);
    }

    public Cancellable addDocumentsFromDirectoryAsync(
        Path directory,
        String primaryKey,
        DocumentType documentType,
        boolean combineDocuments,
        ActionListener<List<TaskInfo>> listener
    ) {
        return writeBatchesAsync(HttpPost.METHOD_NAME, () -> directoryBatches(directory, documentType, combineDocuments), primaryKey, listener);
    }

    public List<TaskInfo> updateDocumentsFromDirectory(
        Path directory,
        String primaryKey,
        DocumentType documentType,
        boolean combineDocuments
    ) throws IOException {
        return writeBatches(HttpPut.METHOD_NAME, () -> directoryBatches(directory, documentType, combineDocuments), primaryKey);
    }

    public Cancellable updateDocumentsFromDirectoryAsync(
        Path directory,
        String primaryKey,
        DocumentType documentType,
        boolean combineDocuments,
        ActionListener<List<TaskInfo>> listener
    ) {
        return writeBatchesAsync(HttpPut.METHOD_NAME, () -> directoryBatches(directory, documentType, combineDocuments), primaryKey, listener);
    }

    /**
     * Adds the documents of every file of the given type found in {@code directory}, in batches of {@code batchSize}.
     * Combined documents are batched together, otherwise each file is batched on its own.
     *
     * @throws MeilisearchException if there is no file of the given type in {@code directory}
     * @throws IOException in case a file can not be read, or there is a problem sending the request or parsing back the response
     */
    public List<TaskInfo> addDocumentsFromDirectoryInBatches(
        Path directory,
        int batchSize,
        String primaryKey,
        DocumentType documentType,
        boolean combineDocuments
    ) throws IOException {
        return writeBatches(
            HttpPost.METHOD_NAME,
            () -> directoryBatches(directory, documentType, combineDocuments, batchSize),
            primaryKey
        );
    }

    public Cancellable addDocumentsFromDirectoryInBatchesAsync(
        Path directory,
        int batchSize,
        String primaryKey,
        DocumentType documentType,
        boolean combineDocuments,
        ActionListener<List<TaskInfo>> listener
    ) {
        return writeBatchesAsync(
            HttpPost.METHOD_NAME,
            () -> directoryBatches(directory, documentType, combineDocuments, batchSize),
            primaryKey,
            listener
        );
    }

    public List<TaskInfo> updateDocumentsFromDirectoryInBatches(
        Path directory,
        int batchSize,
        String primaryKey,
        DocumentType documentType,
        boolean combineDocuments
    ) throws IOException {
        return writeBatches(
            HttpPut.METHOD_NAME,
            () -> directoryBatches(directory, documentType, combineDocuments, batchSize),
            primaryKey
        );
    }

    public Cancellable updateDocumentsFromDirectoryInBatchesAsync(
        Path directory,
        int batchSize,
        String primaryKey,
        DocumentType documentType,
        boolean combineDocuments,
        ActionListener<List<TaskInfo>> listener
    ) {
        return writeBatchesAsync(
            HttpPut.METHOD_NAME,
            () -> directoryBatches(directory, documentType, combineDocuments, batchSize),
            primaryKey,
            listener
        );
    }

    /**
     * Sends the content of a json, csv or ndjson file as is, with the matching content type. The file is not parsed.
     *
     * @throws MeilisearchException if the file does not exist
     * @throws IllegalArgumentException if the file is not a json, csv or ndjson file
     * @throws IOException in case the file can not be read, or there is a problem sending the request or parsing back the response
     */
    public TaskInfo addDocumentsFromRawFile(Path path, String primaryKey) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> rawFileRequest(HttpPost.METHOD_NAME, path, primaryKey),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            emptySet()
        );
    }

    public Cancellable addDocumentsFromRawFileAsync(Path path, String primaryKey, ActionListener<TaskInfo> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> rawFileRequest(HttpPost.METHOD_NAME, path, primaryKey),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            listener,
            emptySet()
        );
    }

    public TaskInfo updateDocumentsFromRawFile(Path path, String primaryKey) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> rawFileRequest(HttpPut.METHOD_NAME, path, primaryKey),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            emptySet()
        );
    }

    public Cancellable updateDocumentsFromRawFileAsync(Path path, String primaryKey, ActionListener<TaskInfo> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> rawFileRequest(HttpPut.METHOD_NAME, path, primaryKey),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            listener,
            emptySet()
        );
    }

    /**
     * Deletes a single document.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public TaskInfo deleteDocument(String documentId) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> DocumentRequestConverters.deleteDocument(uid, documentId),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            emptySet()
        );
    }

    public Cancellable deleteDocumentAsync(String documentId, ActionListener<TaskInfo> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> DocumentRequestConverters.deleteDocument(uid, documentId),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            listener,
            emptySet()
        );
    }

    /**
     * Deletes the documents with the given ids.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public TaskInfo deleteDocuments(Collection<String> documentIds) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> DocumentRequestConverters.deleteDocuments(uid, documentIds),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            emptySet()
        );
    }

    public Cancellable deleteDocumentsAsync(Collection<String> documentIds, ActionListener<TaskInfo> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> DocumentRequestConverters.deleteDocuments(uid, documentIds),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            listener,
            emptySet()
        );
    }

    /**
     * Deletes every document of the index. The index and its settings are kept.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public TaskInfo deleteAllDocuments() throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> DocumentRequestConverters.deleteAllDocuments(uid),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            emptySet()
        );
    }

    public Cancellable deleteAllDocumentsAsync(ActionListener<TaskInfo> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> DocumentRequestConverters.deleteAllDocuments(uid),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            listener,
            emptySet()
        );
    }

    /**
     * Searches the index.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public SearchResult search(SearchRequest searchRequest) throws IOException {
        return search(searchRequest, RequestOptions.DEFAULT);
    }

    /**
     * Searches with per-request options, for instance a tenant token set through
     * {@link RequestOptions.Builder#setApiKey(String)} in place of the client's key.
     */
    public SearchResult search(SearchRequest searchRequest, RequestOptions options) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            searchRequest,
            request -> DocumentRequestConverters.search(uid, request),
            options,
            MeilisearchClient.parser(SearchResult.class),
            emptySet()
        );
    }

    public SearchResult search(String query) throws IOException {
        return search(new SearchRequest(query));
    }

    public Cancellable searchAsync(SearchRequest searchRequest, ActionListener<SearchResult> listener) {
        return searchAsync(searchRequest, RequestOptions.DEFAULT, listener);
    }

    public Cancellable searchAsync(SearchRequest searchRequest, RequestOptions options, ActionListener<SearchResult> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            searchRequest,
            request -> DocumentRequestConverters.search(uid, request),
            options,
            MeilisearchClient.parser(SearchResult.class),
            listener,
            emptySet()
        );
    }

    /**
     * Lists the tasks of this index, most recent first.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public TasksPage getTasks() throws IOException {
        return meilisearchClient.getTasks(new GetTasksRequest().setIndexUids(Collections.singletonList(uid)));
    }

    public Cancellable getTasksAsync(ActionListener<TasksPage> listener) {
        return meilisearchClient.getTasksAsync(new GetTasksRequest().setIndexUids(Collections.singletonList(uid)), listener);
    }

    /**
     * @see TasksClient#waitForTask(long)
     */
    public TaskResult waitForTask(long taskUid) throws IOException {
        return meilisearchClient.waitForTask(taskUid);
    }

    /**
     * @see TasksClient#waitForTask(long, long, long)
     */
    public TaskResult waitForTask(long taskUid, long timeoutMillis, long intervalMillis) throws IOException {
        return meilisearchClient.waitForTask(taskUid, timeoutMillis, intervalMillis);
    }

    public Cancellable waitForTaskAsync(long taskUid, ActionListener<TaskResult> listener) {
        return meilisearchClient.tasks().waitForTaskAsync(taskUid, listener);
    }

    private TaskInfo writeDocuments(String method, CheckedSupplier<List<Map<String, Object>>, IOException> documents, String primaryKey)
        throws IOException {
        List<Map<String, Object>> loaded = documents.get();
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> DocumentRequestConverters.writeDocuments(method, uid, loaded, primaryKey),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            emptySet()
        );
    }

    private Cancellable writeDocumentsAsync(
        String method,
        CheckedSupplier<List<Map<String, Object>>, IOException> documents,
        String primaryKey,
        ActionListener<TaskInfo> listener
    ) {
        List<Map<String, Object>> loaded;
        try {
            loaded = documents.get();
        } catch (Exception e) {
            listener.onFailure(e);
            return Cancellable.NO_OP;
        }
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> DocumentRequestConverters.writeDocuments(method, uid, loaded, primaryKey),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            listener,
            emptySet()
        );
    }

    private List<TaskInfo> writeBatches(
        String method,
        CheckedSupplier<List<List<Map<String, Object>>>, IOException> batches,
        String primaryKey
    ) throws IOException {
        List<TaskInfo> tasks = new ArrayList<>();
        for (List<Map<String, Object>> batch : batches.get()) {
            tasks.add(writeDocuments(method, () -> batch, primaryKey));
        }
        return tasks;
    }

    private Cancellable writeBatchesAsync(
        String method,
        CheckedSupplier<List<List<Map<String, Object>>>, IOException> batches,
        String primaryKey,
        ActionListener<List<TaskInfo>> listener
    ) {
        List<List<Map<String, Object>>> loaded;
        try {
            loaded = batches.get();
        } catch (Exception e) {
            listener.onFailure(e);
            return Cancellable.NO_OP;
        }
        if (loaded.isEmpty()) {
            listener.onResponse(Collections.emptyList());
            return ChainedCancellable.completed();
        }
        GroupedActionListener<TaskInfo> grouped = new GroupedActionListener<>(listener, loaded.size());
        ChainedCancellable chain = new ChainedCancellable();
        for (int i = 0; i < loaded.size(); i++) {
            List<Map<String, Object>> batch = loaded.get(i);
            chain.setDependency(writeDocumentsAsync(method, () -> batch, primaryKey, grouped.slot(i)));
        }
        return Cancellable.fromDependency(chain);
    }

    private static List<List<Map<String, Object>>> directoryBatches(Path directory, DocumentType documentType, boolean combineDocuments)
        throws IOException {
        List<List<Map<String, Object>>> perFile = DocumentLoader.loadDocumentsFromDirectory(directory, documentType);
        if (combineDocuments) {
            return Collections.singletonList(DocumentLoader.combineDocuments(perFile));
        }
        return perFile;
    }

    private static List<List<Map<String, Object>>> directoryBatches(
        Path directory,
        DocumentType documentType,
        boolean combineDocuments,
        int batchSize
    ) throws IOException {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be greater than 0 but was [" + batchSize + "]");
        }
        List<List<Map<String, Object>>> batches = new ArrayList<>();
        for (List<Map<String, Object>> documents : directoryBatches(directory, documentType, combineDocuments)) {
            batches.addAll(DocumentBatches.batch(documents, batchSize));
        }
        return batches;
    }

    private Request rawFileRequest(String method, Path path, String primaryKey) throws IOException {
        if (Files.exists(path) == false) {
            throw new MeilisearchException("No file found at [" + path + "]");
        }
        DocumentType documentType = DocumentType.fromPath(path);
        if (documentType == null) {
            throw new IllegalArgumentException("Valid file extensions are .csv, .ndjson and .json, found [" + path + "]");
        }
        return DocumentRequestConverters.writeRawDocuments(method, uid, Files.readAllBytes(path), documentType.contentType(), primaryKey);
    }

    @Override
    public String toString() {
        return "IndexClient{uid='" + uid + "', primaryKey='" + primaryKey + "', createdAt=" + createdAt + ", updatedAt=" + updatedAt + '}';
    }
}
