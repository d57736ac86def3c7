/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.apache.hc.client5.http.ConnectTimeoutException;
import org.apache.hc.core5.http.ConnectionClosedException;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.Header;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.HttpHeaders;
import org.apache.hc.core5.http.message.BasicHeader;
import org.apache.hc.core5.util.Timeout;
import org.meilisearch.MeilisearchApiException;
import org.meilisearch.MeilisearchCommunicationException;
import org.meilisearch.client.core.ClientStats;
import org.meilisearch.client.core.Health;
import org.meilisearch.client.core.Version;
import org.meilisearch.client.indices.CreateIndexRequest;
import org.meilisearch.client.indices.IndexInfo;
import org.meilisearch.client.indices.IndexesPage;
import org.meilisearch.client.keys.CreateKeyRequest;
import org.meilisearch.client.keys.Key;
import org.meilisearch.client.keys.UpdateKeyRequest;
import org.meilisearch.client.tasks.GetTasksRequest;
import org.meilisearch.client.tasks.TaskInfo;
import org.meilisearch.client.tasks.TaskResult;
import org.meilisearch.client.tasks.TasksPage;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static java.util.Collections.emptySet;

/**
 * High level client for Meilisearch. Wraps an instance of the low level {@link RestClient} and allows to build
 * requests and read responses. The {@link RestClient} instance is internally built based on the provided
 * {@link RestClientBuilder} and it gets closed automatically when closing the {@link MeilisearchClient} instance that
 * wraps it.
 * <p>
 * In case an already existing instance of a low-level REST client needs to be provided, this class can be subclassed and the
 * {@link #MeilisearchClient(RestClient, CheckedConsumer)} constructor can be used.
 * <p>
 * This class can also be sub-classed to expose additional client methods that make use of endpoints added to Meilisearch
 * through plugins, or to add support for custom response sections.
 * <p>
 * Every operation comes in two flavours: a blocking one that returns the parsed response, and an asynchronous one, suffixed
 * with {@code Async}, that notifies an {@link ActionListener} and returns a {@link Cancellable}. Writes are processed by
 * Meilisearch in the background: they return a {@link TaskInfo} whose progress can be followed with
 * {@link #waitForTask(long)}. The operations that wait for their task to finish say so explicitly.
 * <p>
 * A {@link MeilisearchApiException} is raised when Meilisearch answers with an error, and a
 * {@link MeilisearchCommunicationException} when it can not be reached.
 */
public class MeilisearchClient implements Closeable {

    private static final Log logger = LogFactory.getLog(MeilisearchClient.class);

    /**
     * The {@code User-Agent} header value sent with every request.
     */
    public static final String USER_AGENT_HEADER_VALUE;

    /**
     * Index creation and deletion wait for their task for at most this long, in milliseconds.
     */
    public static final long DEFAULT_TASK_TIMEOUT_MILLIS = 5000;

    /**
     * Pause between two polls of a task, in milliseconds.
     */
    public static final long DEFAULT_TASK_INTERVAL_MILLIS = 50;

    static final String INDEX_NOT_FOUND = "index_not_found";

    static {
        String version = null;
        final Package pkg = MeilisearchClient.class.getPackage();
        if (pkg != null) {
            version = pkg.getImplementationVersion();
        }
        USER_AGENT_HEADER_VALUE = "meilisearch-java-async/" + (version == null ? "unknown" : version);
    }

    private final RestClient client;
    private final CheckedConsumer<RestClient, IOException> doClose;
    private final ScheduledExecutorService scheduler;
    // polls queued on the scheduler, failed by close() rather than dropped
    private final Set<ScheduledPoll> pendingPolls = new HashSet<>();
    private boolean closed;

    private final KeysClient keysClient = new KeysClient(this);
    private final TasksClient tasksClient = new TasksClient(this);

    /**
     * Creates a {@link MeilisearchClient} given the low level {@link RestClientBuilder} that allows to build the
     * {@link RestClient} to be used to perform requests.
     */
    public MeilisearchClient(RestClientBuilder restClientBuilder) {
        this(restClientBuilder.build(), RestClient::close);
    }

    /**
     * Creates a {@link MeilisearchClient} given the low level {@link RestClient} that it should use to perform requests and
     * a function that is called when the client is closed. Used by subclasses and tests that provide their own transport.
     */
    protected MeilisearchClient(RestClient restClient, CheckedConsumer<RestClient, IOException> doClose) {
        this.client = restClient;
        this.doClose = doClose;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "meilisearch-task-poller");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Returns a {@link RestClientBuilder} pointing at {@code url}. When {@code apiKey} is not {@code null} it is sent as
     * a bearer token with every request.
     *
     * @param url the url of the Meilisearch server, e.g. {@code http://localhost:7700}
     * @param apiKey the api key, or {@code null} for a server that runs without a master key
     */
    public static RestClientBuilder builder(String url, String apiKey) {
        return RestClient.builder(url)
            .setDefaultHeaders(new Header[] { new BasicHeader(HttpHeaders.USER_AGENT, USER_AGENT_HEADER_VALUE) })
            .setApiKey(apiKey);
    }

    /**
     * Same as {@link #builder(String, String)}, waiting at most {@code timeoutSeconds} for each response.
     */
    public static RestClientBuilder builder(String url, String apiKey, int timeoutSeconds) {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("timeout must be greater than 0 but was [" + timeoutSeconds + "]");
        }
        return builder(url, apiKey).setResponseTimeout(Timeout.ofSeconds(timeoutSeconds));
    }

    /**
     * Returns the low-level client that the current high-level client instance is using to perform requests
     */
    public final RestClient getLowLevelClient() {
        return client;
    }

    @Override
    public final void close() throws IOException {
        List<ScheduledPoll> abandoned;
        synchronized (pendingPolls) {
            closed = true;
            abandoned = new ArrayList<>(pendingPolls);
            pendingPolls.clear();
        }
        scheduler.shutdownNow();
        try {
            for (ScheduledPoll poll : abandoned) {
                poll.onClose.run();
            }
        } finally {
            doClose.accept(client);
        }
    }

    /**
     * Provides methods for managing API keys.
     */
    public final KeysClient keys() {
        return keysClient;
    }

    /**
     * Provides methods for listing and waiting for tasks.
     */
    public final TasksClient tasks() {
        return tasksClient;
    }

    /**
     * Runs {@code poll} on the polling thread after {@code delayMillis}. If the client is closed before that,
     * {@code onClose} runs instead, on the thread closing the client or on this one when it is already closed.
     */
    final void schedulePoll(Runnable poll, long delayMillis, Runnable onClose) {
        ScheduledPoll scheduled = new ScheduledPoll(poll, onClose);
        synchronized (pendingPolls) {
            if (closed == false) {
                pendingPolls.add(scheduled);
                scheduler.schedule(scheduled, delayMillis, TimeUnit.MILLISECONDS);
                return;
            }
        }
        onClose.run();
    }

    private final class ScheduledPoll implements Runnable {
        private final Runnable poll;
        private final Runnable onClose;

        ScheduledPoll(Runnable poll, Runnable onClose) {
            this.poll = poll;
            this.onClose = onClose;
        }

        @Override
        public void run() {
            boolean pending;
            synchronized (pendingPolls) {
                pending = pendingPolls.remove(this);
            }
            if (pending) {
                poll.run();
            }
        }
    }

    /**
     * Checks whether the server is available.
     *
     * @return the health status
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public Health health() throws IOException {
        return performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> RequestConverters.health(),
            RequestOptions.DEFAULT,
            parser(Health.class),
            emptySet()
        );
    }

    /**
     * Asynchronously checks whether the server is available.
     *
     * @param listener the listener to be notified upon request completion
     * @return cancellable that may be used to cancel the request
     */
    public Cancellable healthAsync(ActionListener<Health> listener) {
        return performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> RequestConverters.health(),
            RequestOptions.DEFAULT,
            parser(Health.class),
            listener,
            emptySet()
        );
    }

    /**
     * Returns {@code true} if the server reports itself available. Any failure, including an unreachable server, is
     * reported as {@code false}.
     */
    public boolean isHealthy() {
        try {
            return health().isAvailable();
        } catch (Exception e) {
            logger.debug("health check failed", e);
            return false;
        }
    }

    /**
     * Asynchronous form of {@link #isHealthy()}. The listener is never notified of a failure.
     */
    public Cancellable isHealthyAsync(ActionListener<Boolean> listener) {
        return healthAsync(ActionListener.wrap(health -> listener.onResponse(health.isAvailable()), e -> {
            logger.debug("health check failed", e);
            listener.onResponse(false);
        }));
    }

    /**
     * Gets the version of the Meilisearch server.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public Version getVersion() throws IOException {
        return performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> RequestConverters.version(),
            RequestOptions.DEFAULT,
            parser(Version.class),
            emptySet()
        );
    }

    public Cancellable getVersionAsync(ActionListener<Version> listener) {
        return performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> RequestConverters.version(),
            RequestOptions.DEFAULT,
            parser(Version.class),
            listener,
            emptySet()
        );
    }

    /**
     * Gets the database size and the statistics of every index.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public ClientStats getAllStats() throws IOException {
        return performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> RequestConverters.stats(),
            RequestOptions.DEFAULT,
            parser(ClientStats.class),
            emptySet()
        );
    }

    public Cancellable getAllStatsAsync(ActionListener<ClientStats> listener) {
        return performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> RequestConverters.stats(),
            RequestOptions.DEFAULT,
            parser(ClientStats.class),
            listener,
            emptySet()
        );
    }

    /**
     * Triggers the creation of a dump. The dump is written by a task, whose progress can be followed with
     * {@link #getTask(long)}.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public TaskInfo createDump() throws IOException {
        return performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> RequestConverters.createDump(),
            RequestOptions.DEFAULT,
            parser(TaskInfo.class),
            emptySet()
        );
    }

    public Cancellable createDumpAsync(ActionListener<TaskInfo> listener) {
        return performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> RequestConverters.createDump(),
            RequestOptions.DEFAULT,
            parser(TaskInfo.class),
            listener,
            emptySet()
        );
    }

    /**
     * Creates an index, waits for the creation task to finish and returns the index with its information fetched.
     *
     * @param uid the uid of the index
     * @param primaryKey the primary key of the documents, or {@code null} to let Meilisearch infer it
     * @throws IOException in case there is a problem sending the request or parsing back the response
     * @throws org.meilisearch.MeilisearchTimeoutException if the creation task did not finish in time
     */
    public IndexClient createIndex(String uid, String primaryKey) throws IOException {
        TaskInfo taskInfo = performRequestAndParseEntity(
            new CreateIndexRequest(uid, primaryKey),
            IndexRequestConverters::createIndex,
            RequestOptions.DEFAULT,
            parser(TaskInfo.class),
            emptySet()
        );
        tasksClient.waitForTask(taskInfo.getTaskUid());
        return getIndex(uid);
    }

    public IndexClient createIndex(String uid) throws IOException {
        return createIndex(uid, null);
    }

    /**
     * Asynchronous form of {@link #createIndex(String, String)}. Cancelling the returned {@link Cancellable} stops waiting
     * for the creation task, the index may still be created.
     */
    public Cancellable createIndexAsync(String uid, String primaryKey, ActionListener<IndexClient> listener) {
        ChainedCancellable chain = new ChainedCancellable();
        chain.setDependency(
            performRequestAsyncAndParseEntity(
                new CreateIndexRequest(uid, primaryKey),
                IndexRequestConverters::createIndex,
                RequestOptions.DEFAULT,
                parser(TaskInfo.class),
                ActionListener.wrap(
                    taskInfo -> chain.setDependency(
                        tasksClient.waitForTaskAsync(
                            taskInfo.getTaskUid(),
                            ActionListener.wrap(task -> chain.setDependency(getIndexAsync(uid, listener)), listener::onFailure)
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
     * Gets the indexes, with their information.
     *
     * @param offset the number of indexes to skip, or {@code null} for the server default
     * @param limit the maximum number of indexes to return, or {@code null} for the server default
     * @return the indexes, or {@code null} if there is none
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public List<IndexClient> getIndexes(Integer offset, Integer limit) throws IOException {
        return toIndexClients(getRawIndexes(offset, limit));
    }

    public List<IndexClient> getIndexes() throws IOException {
        return getIndexes(null, null);
    }

    public Cancellable getIndexesAsync(Integer offset, Integer limit, ActionListener<List<IndexClient>> listener) {
        return getRawIndexesAsync(offset, limit, ActionListener.map(listener, this::toIndexClients));
    }

    /**
     * Gets the information of the indexes, rather than {@link IndexClient} instances.
     *
     * @return the index information, or {@code null} if there is no index
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public List<IndexInfo> getRawIndexes(Integer offset, Integer limit) throws IOException {
        return performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> IndexRequestConverters.getIndexes(offset, limit),
            RequestOptions.DEFAULT,
            MeilisearchClient::parseIndexes,
            emptySet()
        );
    }

    public List<IndexInfo> getRawIndexes() throws IOException {
        return getRawIndexes(null, null);
    }

    public Cancellable getRawIndexesAsync(Integer offset, Integer limit, ActionListener<List<IndexInfo>> listener) {
        return performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> IndexRequestConverters.getIndexes(offset, limit),
            RequestOptions.DEFAULT,
            MeilisearchClient::parseIndexes,
            listener,
            emptySet()
        );
    }

    /**
     * Gets an index with its information fetched.
     *
     * @throws MeilisearchApiException with code {@code index_not_found} if there is no such index
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public IndexClient getIndex(String uid) throws IOException {
        return index(uid).fetchInfo();
    }

    public Cancellable getIndexAsync(String uid, ActionListener<IndexClient> listener) {
        return index(uid).fetchInfoAsync(listener);
    }

    /**
     * Gets the information of an index.
     *
     * @return the index information, or {@code null} if there is no such index
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public IndexInfo getRawIndex(String uid) throws IOException {
        return performRequestAndParseOptionalEntity(
            Validatable.EMPTY,
            request -> IndexRequestConverters.getIndex(uid),
            RequestOptions.DEFAULT,
            parser(IndexInfo.class)
        ).orElse(null);
    }

    public Cancellable getRawIndexAsync(String uid, ActionListener<IndexInfo> listener) {
        return performRequestAsyncAndParseOptionalEntity(
            Validatable.EMPTY,
            request -> IndexRequestConverters.getIndex(uid),
            RequestOptions.DEFAULT,
            parser(IndexInfo.class),
            ActionListener.<IndexInfo, Optional<IndexInfo>>map(listener, info -> info.orElse(null))
        );
    }

    /**
     * Returns a local reference to an index. No request is sent, so the index information is not populated.
     */
    public IndexClient index(String uid) {
        return new IndexClient(this, uid);
    }

    /**
     * Gets an index, creating it if it does not exist.
     *
     * @param primaryKey the primary key used if the index is created
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public IndexClient getOrCreateIndex(String uid, String primaryKey) throws IOException {
        try {
            return getIndex(uid);
        } catch (MeilisearchApiException e) {
            if (INDEX_NOT_FOUND.equals(e.getCode()) == false) {
                throw e;
            }
            logger.debug("index [" + uid + "] not found, creating it");
            return createIndex(uid, primaryKey);
        }
    }

    public Cancellable getOrCreateIndexAsync(String uid, String primaryKey, ActionListener<IndexClient> listener) {
        ChainedCancellable chain = new ChainedCancellable();
        chain.setDependency(getIndexAsync(uid, new ActionListener<IndexClient>() {
            @Override
            public void onResponse(IndexClient indexClient) {
                listener.onResponse(indexClient);
            }

            @Override
            public void onFailure(Exception e) {
                if (e instanceof MeilisearchApiException && INDEX_NOT_FOUND.equals(((MeilisearchApiException) e).getCode())) {
                    logger.debug("index [" + uid + "] not found, creating it");
                    chain.setDependency(createIndexAsync(uid, primaryKey, listener));
                } else {
                    listener.onFailure(e);
                }
            }
        }));
        return Cancellable.fromDependency(chain);
    }

    /**
     * Deletes an index if it exists and waits for the deletion task to finish.
     *
     * @return {@code true} if the index was deleted, {@code false} if it did not exist
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public boolean deleteIndexIfExists(String uid) throws IOException {
        return index(uid).deleteIfExists();
    }

    public Cancellable deleteIndexIfExistsAsync(String uid, ActionListener<Boolean> listener) {
        return index(uid).deleteIfExistsAsync(listener);
    }

    /**
     * Generates a tenant token: a JWT that can be used instead of an API key to search, with the given search rules.
     * The token is signed with {@code key}, or with the default search key of the instance when {@code key} is
     * {@code null}.
     *
     * @param searchRules the search rules, keyed by index uid, with {@code *} standing for every index
     * @param expiresAt when the token expires, or {@code null} for a token that expires with its key
     * @param key the key to sign the token with, which must only allow the {@code search} action
     * @throws org.meilisearch.InvalidKeyException if {@code key} allows more than searching
     * @throws org.meilisearch.KeyNotFoundException if no key is given and there is no default search key
     * @throws org.meilisearch.InvalidRestrictionException if the rules give access to indexes the key can not search
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public String generateTenantToken(Map<String, ?> searchRules, Instant expiresAt, Key key) throws IOException {
        Key signingKey = key != null ? key : TenantTokenGenerator.findDefaultSearchKey(getKeys());
        return TenantTokenGenerator.generate(searchRules, expiresAt, signingKey, key != null);
    }

    public Cancellable generateTenantTokenAsync(Map<String, ?> searchRules, Instant expiresAt, Key key, ActionListener<String> listener) {
        if (key != null) {
            try {
                listener.onResponse(TenantTokenGenerator.generate(searchRules, expiresAt, key, true));
            } catch (Exception e) {
                listener.onFailure(e);
            }
            return ChainedCancellable.completed();
        }
        return getKeysAsync(
            ActionListener.map(
                listener,
                keys -> TenantTokenGenerator.generate(searchRules, expiresAt, TenantTokenGenerator.findDefaultSearchKey(keys), false)
            )
        );
    }

    /**
     * @see KeysClient#getKeys()
     */
    public List<Key> getKeys() throws IOException {
        return keysClient.getKeys();
    }

    public Cancellable getKeysAsync(ActionListener<List<Key>> listener) {
        return keysClient.getKeysAsync(listener);
    }

    /**
     * @see KeysClient#getKey(String)
     */
    public Key getKey(String key) throws IOException {
        return keysClient.getKey(key);
    }

    public Cancellable getKeyAsync(String key, ActionListener<Key> listener) {
        return keysClient.getKeyAsync(key, listener);
    }

    /**
     * @see KeysClient#createKey(CreateKeyRequest)
     */
    public Key createKey(CreateKeyRequest createKeyRequest) throws IOException {
        return keysClient.createKey(createKeyRequest);
    }

    public Cancellable createKeyAsync(CreateKeyRequest createKeyRequest, ActionListener<Key> listener) {
        return keysClient.createKeyAsync(createKeyRequest, listener);
    }

    /**
     * @see KeysClient#updateKey(UpdateKeyRequest)
     */
    public Key updateKey(UpdateKeyRequest updateKeyRequest) throws IOException {
        return keysClient.updateKey(updateKeyRequest);
    }

    public Cancellable updateKeyAsync(UpdateKeyRequest updateKeyRequest, ActionListener<Key> listener) {
        return keysClient.updateKeyAsync(updateKeyRequest, listener);
    }

    /**
     * @see KeysClient#deleteKey(String)
     */
    public int deleteKey(String key) throws IOException {
        return keysClient.deleteKey(key);
    }

    public Cancellable deleteKeyAsync(String key, ActionListener<Integer> listener) {
        return keysClient.deleteKeyAsync(key, listener);
    }

    /**
     * @see TasksClient#getTasks(GetTasksRequest)
     */
    public TasksPage getTasks(GetTasksRequest getTasksRequest) throws IOException {
        return tasksClient.getTasks(getTasksRequest);
    }

    public Cancellable getTasksAsync(GetTasksRequest getTasksRequest, ActionListener<TasksPage> listener) {
        return tasksClient.getTasksAsync(getTasksRequest, listener);
    }

    /**
     * @see TasksClient#getTask(long)
     */
    public TaskResult getTask(long taskUid) throws IOException {
        return tasksClient.getTask(taskUid);
    }

    public Cancellable getTaskAsync(long taskUid, ActionListener<TaskResult> listener) {
        return tasksClient.getTaskAsync(taskUid, listener);
    }

    /**
     * @see TasksClient#waitForTask(long, long, long)
     */
    public TaskResult waitForTask(long taskUid, long timeoutMillis, long intervalMillis) throws IOException {
        return tasksClient.waitForTask(taskUid, timeoutMillis, intervalMillis);
    }

    /**
     * @see TasksClient#waitForTask(long)
     */
    public TaskResult waitForTask(long taskUid) throws IOException {
        return tasksClient.waitForTask(taskUid);
    }

    public Cancellable waitForTaskAsync(long taskUid, long timeoutMillis, long intervalMillis, ActionListener<TaskResult> listener) {
        return tasksClient.waitForTaskAsync(taskUid, timeoutMillis, intervalMillis, listener);
    }

    private List<IndexClient> toIndexClients(List<IndexInfo> infos) {
        if (infos == null) {
            return null;
        }
        List<IndexClient> indexes = new ArrayList<>(infos.size());
        for (IndexInfo info : infos) {
            IndexClient indexClient = index(info.getUid());
            indexClient.setInfo(info);
            indexes.add(indexClient);
        }
        return indexes;
    }

    private static List<IndexInfo> parseIndexes(JsonParser parser) throws IOException {
        IndexesPage page = parser.readValueAs(IndexesPage.class);
        if (page == null || page.getResults() == null || page.getResults().isEmpty()) {
            return null;
        }
        return page.getResults();
    }

    static <T> CheckedFunction<JsonParser, T, IOException> parser(Class<T> type) {
        return parser -> parser.readValueAs(type);
    }

    static <T> CheckedFunction<JsonParser, T, IOException> parser(TypeReference<T> type) {
        return parser -> parser.readValueAs(type);
    }

    /**
     * Defines a helper method for performing a request and then parsing the returned entity using the provided entityParser.
     */
    protected final <Req extends Validatable, Resp> Resp performRequestAndParseEntity(
        Req request,
        CheckedFunction<Req, Request, IOException> requestConverter,
        RequestOptions options,
        CheckedFunction<JsonParser, Resp, IOException> entityParser,
        Set<Integer> ignores
    ) throws IOException {
        return performRequest(request, requestConverter, options, response -> parseEntity(response.getEntity(), entityParser), ignores);
    }

    /**
     * Defines a helper method for performing a request.
     */
    protected final <Req extends Validatable, Resp> Resp performRequest(
        Req request,
        CheckedFunction<Req, Request, IOException> requestConverter,
        RequestOptions options,
        CheckedFunction<Response, Resp, IOException> responseConverter,
        Set<Integer> ignores
    ) throws IOException {
        Optional<ValidationException> validationException = request.validate();
        if (validationException != null && validationException.isPresent()) {
            throw validationException.get();
        }
        return internalPerformRequest(request, requestConverter, options, responseConverter, ignores);
    }

    /**
     * Provides common functionality for performing a request.
     */
    private <Req, Resp> Resp internalPerformRequest(
        Req request,
        CheckedFunction<Req, Request, IOException> requestConverter,
        RequestOptions options,
        CheckedFunction<Response, Resp, IOException> responseConverter,
        Set<Integer> ignores
    ) throws IOException {
        Request req = requestConverter.apply(request);
        req.setOptions(options);
        Response response;
        try {
            response = client.performRequest(req);
        } catch (ResponseException e) {
            if (ignores.contains(e.getResponse().getStatusLine().getStatusCode())) {
                try {
                    return responseConverter.apply(e.getResponse());
                } catch (Exception innerException) {
                    // the exception is ignored as we now try to parse the response as an error.
                    throw parseResponseException(e);
                }
            }
            throw parseResponseException(e);
        } catch (IOException e) {
            if (isCommunicationFailure(e)) {
                throw (MeilisearchCommunicationException) translateTransportException(e);
            }
            throw e;
        }

        try {
            return responseConverter.apply(response);
        } catch (Exception e) {
            throw new IOException("Unable to parse response body for " + response, e);
        }
    }

    /**
     * Defines a helper method for requests that can 404 and in which case will return an empty Optional
     * otherwise tries to parse the response body
     */
    protected final <Req extends Validatable, Resp> Optional<Resp> performRequestAndParseOptionalEntity(
        Req request,
        CheckedFunction<Req, Request, IOException> requestConverter,
        RequestOptions options,
        CheckedFunction<JsonParser, Resp, IOException> entityParser
    ) throws IOException {
        Optional<ValidationException> validationException = request.validate();
        if (validationException != null && validationException.isPresent()) {
            throw validationException.get();
        }
        Request req = requestConverter.apply(request);
        req.setOptions(options);
        Response response;
        try {
            response = client.performRequest(req);
        } catch (ResponseException e) {
            if (e.getResponse().getStatusLine().getStatusCode() == 404) {
                return Optional.empty();
            }
            throw parseResponseException(e);
        } catch (IOException e) {
            if (isCommunicationFailure(e)) {
                throw (MeilisearchCommunicationException) translateTransportException(e);
            }
            throw e;
        }

        try {
            return Optional.ofNullable(parseEntity(response.getEntity(), entityParser));
        } catch (Exception e) {
            throw new IOException("Unable to parse response body for " + response, e);
        }
    }

    /**
     * Defines a helper method for asynchronously performing a request.
     * @return Cancellable instance that may be used to cancel the request
     */
    protected final <Req extends Validatable, Resp> Cancellable performRequestAsyncAndParseEntity(
        Req request,
        CheckedFunction<Req, Request, IOException> requestConverter,
        RequestOptions options,
        CheckedFunction<JsonParser, Resp, IOException> entityParser,
        ActionListener<Resp> listener,
        Set<Integer> ignores
    ) {
        return performRequestAsync(
            request,
            requestConverter,
            options,
            response -> parseEntity(response.getEntity(), entityParser),
            listener,
            ignores
        );
    }

    /**
     * Defines a helper method for asynchronously performing a request.
     * @return Cancellable instance that may be used to cancel the request
     */
    protected final <Req extends Validatable, Resp> Cancellable performRequestAsync(
        Req request,
        CheckedFunction<Req, Request, IOException> requestConverter,
        RequestOptions options,
        CheckedFunction<Response, Resp, IOException> responseConverter,
        ActionListener<Resp> listener,
        Set<Integer> ignores
    ) {
        Optional<ValidationException> validationException = request.validate();
        if (validationException != null && validationException.isPresent()) {
            listener.onFailure(validationException.get());
            return Cancellable.NO_OP;
        }
        return internalPerformRequestAsync(request, requestConverter, options, responseConverter, listener, ignores);
    }

    /**
     * Provides common functionality for asynchronously performing a request.
     * @return Cancellable instance that may be used to cancel the request
     */
    private <Req, Resp> Cancellable internalPerformRequestAsync(
        Req request,
        CheckedFunction<Req, Request, IOException> requestConverter,
        RequestOptions options,
        CheckedFunction<Response, Resp, IOException> responseConverter,
        ActionListener<Resp> listener,
        Set<Integer> ignores
    ) {
        if (listener == null) {
            throw new IllegalArgumentException("The listener is required and cannot be null");
        }

        Request req;
        try {
            req = requestConverter.apply(request);
        } catch (Exception e) {
            listener.onFailure(e);
            return Cancellable.NO_OP;
        }
        req.setOptions(options);

        ResponseListener responseListener = wrapResponseListener(responseConverter, listener, ignores);
        return client.performRequestAsync(req, responseListener);
    }

    final <Resp> ResponseListener wrapResponseListener(
        CheckedFunction<Response, Resp, IOException> responseConverter,
        ActionListener<Resp> actionListener,
        Set<Integer> ignores
    ) {
        return new ResponseListener() {
            @Override
            public void onSuccess(Response response) {
                Resp converted;
                try {
                    converted = responseConverter.apply(response);
                } catch (Exception e) {
                    IOException ioe = new IOException("Unable to parse response body for " + response, e);
                    onFailure(ioe);
                    return;
                }
                actionListener.onResponse(converted);
            }

            @Override
            public void onFailure(Exception exception) {
                if (exception instanceof ResponseException) {
                    ResponseException responseException = (ResponseException) exception;
                    Response response = responseException.getResponse();
                    if (ignores.contains(response.getStatusLine().getStatusCode())) {
                        Resp converted;
                        try {
                            converted = responseConverter.apply(response);
                        } catch (Exception innerException) {
                            // the exception is ignored as we now try to parse the response as an error.
                            actionListener.onFailure(parseResponseException(responseException));
                            return;
                        }
                        actionListener.onResponse(converted);
                    } else {
                        actionListener.onFailure(parseResponseException(responseException));
                    }
                } else {
                    actionListener.onFailure(translateTransportException(exception));
                }
            }
        };
    }

    /**
     * Asynchronous request which returns empty {@link Optional}s in the case of 404s or parses entity into an Optional
     * @return Cancellable instance that may be used to cancel the request
     */
    protected final <Req extends Validatable, Resp> Cancellable performRequestAsyncAndParseOptionalEntity(
        Req request,
        CheckedFunction<Req, Request, IOException> requestConverter,
        RequestOptions options,
        CheckedFunction<JsonParser, Resp, IOException> entityParser,
        ActionListener<Optional<Resp>> listener
    ) {
        Optional<ValidationException> validationException = request.validate();
        if (validationException != null && validationException.isPresent()) {
            listener.onFailure(validationException.get());
            return Cancellable.NO_OP;
        }
        Request req;
        try {
            req = requestConverter.apply(request);
        } catch (Exception e) {
            listener.onFailure(e);
            return Cancellable.NO_OP;
        }
        req.setOptions(options);
        ResponseListener responseListener = wrapResponseListener404sOptional(
            response -> parseEntity(response.getEntity(), entityParser),
            listener
        );
        return client.performRequestAsync(req, responseListener);
    }

    final <Resp> ResponseListener wrapResponseListener404sOptional(
        CheckedFunction<Response, Resp, IOException> responseConverter,
        ActionListener<Optional<Resp>> actionListener
    ) {
        return new ResponseListener() {
            @Override
            public void onSuccess(Response response) {
                Optional<Resp> converted;
                try {
                    converted = Optional.ofNullable(responseConverter.apply(response));
                } catch (Exception e) {
                    IOException ioe = new IOException("Unable to parse response body for " + response, e);
                    onFailure(ioe);
                    return;
                }
                actionListener.onResponse(converted);
            }

            @Override
            public void onFailure(Exception exception) {
                if (exception instanceof ResponseException) {
                    ResponseException responseException = (ResponseException) exception;
                    Response response = responseException.getResponse();
                    if (response.getStatusLine().getStatusCode() == 404) {
                        actionListener.onResponse(Optional.empty());
                    } else {
                        actionListener.onFailure(parseResponseException(responseException));
                    }
                } else {
                    actionListener.onFailure(translateTransportException(exception));
                }
            }
        };
    }

    /**
     * Converts a {@link ResponseException} obtained from the low level REST client into a {@link MeilisearchApiException}.
     * If a response body was returned, tries to parse it as an error returned from Meilisearch.
     * If no response body was returned or anything goes wrong while parsing the error, returns a new {@link MeilisearchApiException}
     * that wraps the original {@link ResponseException}, with the response line as message. The potential exception obtained while
     * parsing is added to the returned exception as a suppressed exception. This method is guaranteed to not throw any exception
     * eventually thrown while parsing.
     */
    protected final MeilisearchApiException parseResponseException(ResponseException responseException) {
        Response response = responseException.getResponse();
        String body = responseException.getResponseBody();
        int status = responseException.getStatusCode();
        String fallbackMessage = String.format(
            Locale.ROOT,
            "%s %s returned [%s]",
            response.getRequestLine().getMethod(),
            response.getRequestLine().getUri(),
            response.getStatusLine()
        );

        if (body == null || body.isEmpty()) {
            return new MeilisearchApiException(fallbackMessage, status, null, null, null, responseException);
        }
        try {
            Map<String, Object> error = DefaultObjectMapper.objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {});
            if (error == null || error.get("message") == null) {
                return new MeilisearchApiException(fallbackMessage, status, null, null, null, responseException);
            }
            return new MeilisearchApiException(
                String.valueOf(error.get("message")),
                status,
                stringOrNull(error.get("code")),
                stringOrNull(error.get("type")),
                stringOrNull(error.get("link")),
                responseException
            );
        } catch (Exception e) {
            MeilisearchApiException apiException = new MeilisearchApiException(fallbackMessage, status, null, null, null, responseException);
            apiException.addSuppressed(e);
            return apiException;
        }
    }

    /**
     * Whether the exception means that the server could not be reached: the connection was refused, timed out while
     * connecting or was closed before a response came back.
     */
    static boolean isCommunicationFailure(Exception exception) {
        return exception instanceof ConnectException
            || exception instanceof ConnectTimeoutException
            || exception instanceof ConnectionClosedException
            || exception instanceof UnknownHostException;
    }

    static Exception translateTransportException(Exception exception) {
        if (isCommunicationFailure(exception)) {
            return new MeilisearchCommunicationException("unable to communicate with Meilisearch: " + exception.getMessage(), exception);
        }
        return exception;
    }

    protected final <Resp> Resp parseEntity(final HttpEntity entity, final CheckedFunction<JsonParser, Resp, IOException> entityParser)
        throws IOException {
        if (entity == null) {
            throw new IllegalStateException("Response body expected but not returned");
        }
        if (entity.getContentType() == null) {
            throw new IllegalStateException("Meilisearch didn't return the [Content-Type] header, unable to parse response body");
        }
        ContentType contentType = ContentType.parse(entity.getContentType());
        if (contentType == null || ContentType.APPLICATION_JSON.getMimeType().equalsIgnoreCase(contentType.getMimeType()) == false) {
            throw new IllegalStateException("Unsupported Content-Type: " + entity.getContentType());
        }
        try (InputStream content = entity.getContent(); JsonParser parser = DefaultObjectMapper.objectMapper.createParser(content)) {
            return entityParser.apply(parser);
        }
    }

    private static String stringOrNull(Object value) {
        return value == null ? null : value.toString();
    }
}
