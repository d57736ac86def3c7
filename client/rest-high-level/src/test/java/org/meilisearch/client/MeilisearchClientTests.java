/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.junit.After;
import org.junit.Before;
import org.meilisearch.KeyNotFoundException;
import org.meilisearch.MeilisearchApiException;
import org.meilisearch.MeilisearchCommunicationException;
import org.meilisearch.client.core.ClientStats;
import org.meilisearch.client.core.Version;
import org.meilisearch.client.indices.IndexInfo;
import org.meilisearch.client.keys.CreateKeyRequest;
import org.meilisearch.client.keys.Key;
import org.meilisearch.client.keys.UpdateKeyRequest;
import org.meilisearch.client.tasks.GetTasksRequest;
import org.meilisearch.client.tasks.TaskInfo;
import org.meilisearch.client.tasks.TaskStatus;
import org.meilisearch.client.tasks.TasksPage;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

/**
 * Checks the instance-wide operations of {@link MeilisearchClient} against a fake Meilisearch server.
 */
public class MeilisearchClientTests extends MeilisearchTestCase {

    private static final String KEYS =
        "{\"results\":[{\"uid\":\"6062abda-a5aa-4414-ac91-ecd7944c0f8d\",\"key\":\"d0552b41536279a0ad88bd595327b96f01176a60c2243e906c52ac02375f9bc4\","
            + "\"name\":\"Default Admin API Key\",\"description\":\"Use it for anything that is not a search operation.\","
            + "\"actions\":[\"*\"],\"indexes\":[\"*\"],\"expiresAt\":null,"
            + "\"createdAt\":\"2021-11-12T10:00:00Z\",\"updatedAt\":\"2021-11-12T10:00:00Z\"},"
            + "{\"uid\":\"74c9c733-3368-4738-bbe5-1d18a5fecb37\",\"key\":\"a8f5a6a1c4d55d5b1f5e7c6f0a9b4e3d2c1b0a9f8e7d6c5b4a3f2e1d0c9b8a7f\","
            + "\"name\":\"Default Search API Key\",\"description\":\"Default Search API Key (Use it to search from the frontend)\","
            + "\"actions\":[\"search\"],\"indexes\":[\"*\"],\"expiresAt\":null,"
            + "\"createdAt\":\"2021-11-12T10:00:00Z\",\"updatedAt\":\"2021-11-12T10:00:00Z\"}],"
            + "\"offset\":0,\"limit\":20,\"total\":2}";

    private FakeMeilisearch server;
    private MeilisearchClient client;

    @Before
    public void startServer() throws IOException {
        server = new FakeMeilisearch();
        client = new MeilisearchClient(MeilisearchClient.builder(server.url(), "masterKey"));
    }

    @After
    public void stopServer() throws IOException {
        client.close();
        server.close();
    }

    public void testDefaultHeaders() throws IOException {
        server.respond("GET", "/health", 200, "{\"status\":\"available\"}");
        client.health();
        FakeMeilisearch.RecordedRequest request = server.lastRequest();
        assertEquals("Bearer masterKey", request.authorization);
        assertThat(request.userAgent, startsWith("meilisearch-java-async/"));
    }

    public void testNoAuthorizationHeaderWithoutApiKey() throws IOException {
        server.respond("GET", "/health", 200, "{\"status\":\"available\"}");
        try (MeilisearchClient anonymous = new MeilisearchClient(MeilisearchClient.builder(server.url(), null))) {
            assertTrue(anonymous.isHealthy());
        }
        assertNull(server.lastRequest().authorization);
    }

    public void testBuilderRejectsNonPositiveTimeout() {
        expectThrows(IllegalArgumentException.class, () -> MeilisearchClient.builder(server.url(), "masterKey", randomIntBetween(-10, 0)));
    }

    public void testHealth() throws IOException {
        server.respond("GET", "/health", 200, "{\"status\":\"available\"}");
        assertEquals("available", client.health().getStatus());
        assertTrue(client.isHealthy());
    }

    public void testIsHealthyIsFalseOnError() {
        server.respondError("GET", "/health", 503, "internal", "unavailable");
        assertFalse(client.isHealthy());
    }

    public void testIsHealthyIsFalseWhenUnreachable() throws Exception {
        FakeMeilisearch stopped = new FakeMeilisearch();
        String url = stopped.url();
        stopped.close();
        try (MeilisearchClient unreachable = new MeilisearchClient(MeilisearchClient.builder(url, "masterKey"))) {
            assertFalse(unreachable.isHealthy());
            LatchedListener<Boolean> listener = new LatchedListener<>();
            unreachable.isHealthyAsync(listener);
            assertFalse(listener.get());
        }
    }

    public void testCommunicationFailure() throws Exception {
        FakeMeilisearch stopped = new FakeMeilisearch();
        String url = stopped.url();
        stopped.close();
        try (MeilisearchClient unreachable = new MeilisearchClient(MeilisearchClient.builder(url, "masterKey"))) {
            MeilisearchCommunicationException e = expectThrows(MeilisearchCommunicationException.class, unreachable::getVersion);
            assertThat(e.getMessage(), startsWith("unable to communicate with Meilisearch"));

            LatchedListener<Version> listener = new LatchedListener<>();
            unreachable.getVersionAsync(listener);
            assertThat(listener.failure(), instanceOf(MeilisearchCommunicationException.class));
        }
    }

    public void testHealthAsync() throws Exception {
        server.respond("GET", "/health", 200, "{\"status\":\"available\"}");
        LatchedListener<Boolean> listener = new LatchedListener<>();
        client.isHealthyAsync(listener);
        assertTrue(listener.get());
    }

    public void testGetVersion() throws IOException {
        server.respond(
            "GET",
            "/version",
            200,
            "{\"commitSha\":\"b46889b5f0f2f8b91438a08a358ba8f05fc09fc1\",\"commitDate\":\"2019-11-15T09:51:54.278247+00:00\",\"pkgVersion\":\"0.29.1\"}"
        );
        Version version = client.getVersion();
        assertEquals("b46889b5f0f2f8b91438a08a358ba8f05fc09fc1", version.getCommitSha());
        assertEquals("2019-11-15T09:51:54.278247+00:00", version.getCommitDate());
        assertEquals("0.29.1", version.getPkgVersion());
    }

    public void testGetAllStats() throws IOException {
        server.respond(
            "GET",
            "/stats",
            200,
            "{\"databaseSize\":447819776,\"lastUpdate\":\"2019-11-15T11:15:22.092896Z\",\"indexes\":{\"movies\":"
                + "{\"numberOfDocuments\":19654,\"isIndexing\":false,\"fieldDistribution\":{\"poster\":19654,\"title\":19654}}}}"
        );
        ClientStats stats = client.getAllStats();
        assertEquals(447819776L, stats.getDatabaseSize());
        assertEquals(Instant.parse("2019-11-15T11:15:22.092896Z"), stats.getLastUpdate());
        assertEquals(19654L, stats.getIndexes().get("movies").getNumberOfDocuments());
        assertFalse(stats.getIndexes().get("movies").isIndexing());
        assertEquals(Long.valueOf(19654L), stats.getIndexes().get("movies").getFieldDistribution().get("title"));
    }

    public void testCreateDump() throws IOException {
        server.respondTask("POST", "/dumps", 12, null, "dumpCreation");
        TaskInfo taskInfo = client.createDump();
        assertEquals(12L, taskInfo.getTaskUid());
        assertNull(taskInfo.getIndexUid());
        assertEquals(TaskStatus.ENQUEUED, taskInfo.getStatus());
        assertEquals("dumpCreation", taskInfo.getType());
    }

    public void testCreateIndex() throws IOException {
        server.respondTask("POST", "/indexes", 1, "movies", "indexCreation");
        server.respond(
            "GET",
            "/tasks/1",
            200,
            FakeMeilisearch.task(1, "movies", "processing", "indexCreation"),
            FakeMeilisearch.task(1, "movies", "succeeded", "indexCreation")
        );
        server.respond("GET", "/indexes/movies", 200, FakeMeilisearch.index("movies", "id"));

        IndexClient index = client.createIndex("movies", "id");
        assertEquals("movies", index.uid());
        assertEquals("id", index.primaryKey());
        assertEquals(Instant.parse("2022-10-24T09:12:44.436219Z"), index.createdAt());
        assertEquals("{\"uid\":\"movies\",\"primaryKey\":\"id\"}", server.requests("POST", "/indexes").get(0).body);
        assertEquals(2, server.requests("GET", "/tasks/1").size());
    }

    public void testCreateIndexWithoutPrimaryKey() throws IOException {
        server.respondTask("POST", "/indexes", 1, "movies", "indexCreation");
        server.respond("GET", "/tasks/1", 200, FakeMeilisearch.task(1, "movies", "succeeded", "indexCreation"));
        server.respond("GET", "/indexes/movies", 200, FakeMeilisearch.index("movies", null));

        IndexClient index = client.createIndex("movies");
        assertNull(index.primaryKey());
        assertEquals("{\"uid\":\"movies\"}", server.requests("POST", "/indexes").get(0).body);
    }

    public void testCreateIndexAsync() throws Exception {
        server.respondTask("POST", "/indexes", 1, "movies", "indexCreation");
        server.respond(
            "GET",
            "/tasks/1",
            200,
            FakeMeilisearch.task(1, "movies", "enqueued", "indexCreation"),
            FakeMeilisearch.task(1, "movies", "succeeded", "indexCreation")
        );
        server.respond("GET", "/indexes/movies", 200, FakeMeilisearch.index("movies", "id"));

        LatchedListener<IndexClient> listener = new LatchedListener<>();
        client.createIndexAsync("movies", "id", listener);
        IndexClient index = listener.get();
        assertEquals("id", index.primaryKey());
    }

    public void testCreateIndexRejectsEmptyUid() {
        expectThrows(ValidationException.class, () -> client.createIndex(""));
        assertTrue(server.requests().isEmpty());
    }

    public void testGetIndexes() throws IOException {
        server.respond(
            "GET",
            "/indexes",
            200,
            "{\"results\":[" + FakeMeilisearch.index("books", "isbn") + "," + FakeMeilisearch.index("movies", "id") + "],"
                + "\"offset\":0,\"limit\":20,\"total\":2}"
        );
        List<IndexClient> indexes = client.getIndexes();
        assertEquals(2, indexes.size());
        assertEquals("books", indexes.get(0).uid());
        assertEquals("isbn", indexes.get(0).primaryKey());
        assertEquals("movies", indexes.get(1).uid());

        List<IndexInfo> raw = client.getRawIndexes(5, 10);
        assertEquals(2, raw.size());
        assertThat(server.lastRequest().query, containsString("offset=5"));
        assertThat(server.lastRequest().query, containsString("limit=10"));
    }

    public void testGetIndexesIsNullWhenThereIsNone() throws IOException {
        server.respond("GET", "/indexes", 200, "{\"results\":[],\"offset\":0,\"limit\":20,\"total\":0}");
        assertNull(client.getIndexes());
        assertNull(client.getRawIndexes());
    }

    public void testGetIndex() throws IOException {
        server.respond("GET", "/indexes/movies", 200, FakeMeilisearch.index("movies", "id"));
        IndexClient index = client.getIndex("movies");
        assertEquals("id", index.primaryKey());
        assertEquals(Instant.parse("2022-10-24T09:12:45.1Z"), index.updatedAt());
    }

    public void testGetRawIndexIsNullWhenMissing() throws Exception {
        server.respondError("GET", "/indexes/movies", 404, "index_not_found", "Index `movies` not found.");
        assertNull(client.getRawIndex("movies"));

        LatchedListener<IndexInfo> listener = new LatchedListener<>();
        client.getRawIndexAsync("movies", listener);
        assertNull(listener.get());
    }

    public void testIndexSendsNoRequest() {
        IndexClient index = client.index("movies");
        assertEquals("movies", index.uid());
        assertNull(index.primaryKey());
        assertTrue(server.requests().isEmpty());
    }

    public void testGetOrCreateIndexReturnsExistingIndex() throws IOException {
        server.respond("GET", "/indexes/movies", 200, FakeMeilisearch.index("movies", "id"));
        IndexClient index = client.getOrCreateIndex("movies", "other");
        assertEquals("id", index.primaryKey());
        assertTrue(server.requests("POST", "/indexes").isEmpty());
    }

    public void testGetOrCreateIndexCreatesMissingIndex() throws Exception {
        server.respondError("GET", "/indexes/movies", 404, "index_not_found", "Index `movies` not found.");
        server.thenRespond("GET", "/indexes/movies", 200, FakeMeilisearch.index("movies", "id"));
        server.respondTask("POST", "/indexes", 3, "movies", "indexCreation");
        server.respond("GET", "/tasks/3", 200, FakeMeilisearch.task(3, "movies", "succeeded", "indexCreation"));

        boolean async = randomBoolean();
        IndexClient index;
        if (async) {
            LatchedListener<IndexClient> listener = new LatchedListener<>();
            client.getOrCreateIndexAsync("movies", "id", listener);
            index = listener.get();
        } else {
            index = client.getOrCreateIndex("movies", "id");
        }
        assertEquals("id", index.primaryKey());
        assertEquals(1, server.requests("POST", "/indexes").size());
    }

    public void testGetOrCreateIndexPropagatesOtherErrors() {
        server.respondError("GET", "/indexes/movies", 401, "invalid_api_key", "The provided API key is invalid.");
        MeilisearchApiException e = expectThrows(MeilisearchApiException.class, () -> client.getOrCreateIndex("movies", null));
        assertEquals("invalid_api_key", e.getCode());
        assertTrue(server.requests("POST", "/indexes").isEmpty());
    }

    public void testDeleteIndexIfExists() throws IOException {
        server.respondTask("DELETE", "/indexes/movies", 4, "movies", "indexDeletion");
        server.respond("GET", "/tasks/4", 200, FakeMeilisearch.task(4, "movies", "succeeded", "indexDeletion"));
        assertTrue(client.deleteIndexIfExists("movies"));
    }

    public void testDeleteIndexIfExistsWhenMissing() throws Exception {
        server.respondError("DELETE", "/indexes/movies", 404, "index_not_found", "Index `movies` not found.");
        assertFalse(client.deleteIndexIfExists("movies"));

        LatchedListener<Boolean> listener = new LatchedListener<>();
        client.deleteIndexIfExistsAsync("movies", listener);
        assertFalse(listener.get());
    }

    public void testDeleteIndexIfExistsWhenTaskFails() throws IOException {
        server.respondTask("DELETE", "/indexes/movies", 4, "movies", "indexDeletion");
        server.respond("GET", "/tasks/4", 200, FakeMeilisearch.task(4, "movies", "failed", "indexDeletion"));
        assertFalse(client.deleteIndexIfExists("movies"));
    }

    public void testApiError() {
        server.respondError("GET", "/indexes/movies", 404, "index_not_found", "Index `movies` not found.");
        MeilisearchApiException e = expectThrows(MeilisearchApiException.class, () -> client.getIndex("movies"));
        assertEquals(404, e.getStatus());
        assertEquals("index_not_found", e.getCode());
        assertEquals("invalid_request", e.getType());
        assertEquals("https://docs.meilisearch.com/errors#index_not_found", e.getLink());
        assertEquals("Index `movies` not found.", e.getMessage());
        assertThat(e.getCause(), instanceOf(ResponseException.class));
    }

    public void testApiErrorWithUnparsableBody() {
        server.respond("GET", "/version", 500, "not json");
        MeilisearchApiException e = expectThrows(MeilisearchApiException.class, () -> client.getVersion());
        assertEquals(500, e.getStatus());
        assertNull(e.getCode());
        assertThat(e.getMessage(), startsWith("GET /version returned ["));
        assertEquals(1, e.getSuppressed().length);
    }

    public void testApiErrorAsync() throws Exception {
        server.respondError("GET", "/indexes/movies", 404, "index_not_found", "Index `movies` not found.");
        LatchedListener<IndexClient> listener = new LatchedListener<>();
        client.getIndexAsync("movies", listener);
        Exception e = listener.failure();
        assertThat(e, instanceOf(MeilisearchApiException.class));
        assertEquals("index_not_found", ((MeilisearchApiException) e).getCode());
    }

    public void testGetKeys() throws IOException {
        server.respond("GET", "/keys", 200, KEYS);
        List<Key> keys = client.getKeys();
        assertEquals(2, keys.size());
        assertEquals("Default Search API Key", keys.get(1).getName());
        assertEquals(Collections.singletonList("search"), keys.get(1).getActions());
        assertNull(keys.get(1).getExpiresAt());
        assertThat(keys.get(1).toString(), containsString("74c9c733-3368-4738-bbe5-1d18a5fecb37"));
        assertFalse(keys.get(1).toString().contains(keys.get(1).getKey()));
    }

    public void testCreateKey() throws IOException {
        server.respond(
            "POST",
            "/keys",
            201,
            "{\"uid\":\"01b4bc42-eb33-4041-b481-254d00cce834\",\"key\":\"d9e776b8412f1db6974c9a5556b961c3559440b6588216f4ea5d9ed49f7c8f3c\","
                + "\"name\":null,\"description\":\"Add documents: Products API key\",\"actions\":[\"documents.add\"],"
                + "\"indexes\":[\"products\"],\"expiresAt\":\"2042-04-02T00:42:42Z\","
                + "\"createdAt\":\"2022-10-24T09:12:44.436219Z\",\"updatedAt\":\"2022-10-24T09:12:44.436219Z\"}"
        );
        Key key = client.createKey(
            new CreateKeyRequest(Collections.singletonList("documents.add"), Collections.singletonList("products"), null).setDescription(
                "Add documents: Products API key"
            )
        );
        assertEquals(Instant.parse("2042-04-02T00:42:42Z"), key.getExpiresAt());
        String body = server.lastRequest().body;
        assertThat(body, containsString("\"expiresAt\":null"));
        assertThat(body, containsString("\"actions\":[\"documents.add\"]"));
        assertFalse(body.contains("\"uid\""));
    }

    public void testCreateKeyValidation() {
        expectThrows(
            ValidationException.class,
            () -> client.createKey(new CreateKeyRequest(Collections.emptyList(), Collections.singletonList("*"), null))
        );
        assertTrue(server.requests().isEmpty());
    }

    public void testUpdateKey() throws IOException {
        String uid = "01b4bc42-eb33-4041-b481-254d00cce834";
        server.respond(
            "PATCH",
            "/keys/" + uid,
            200,
            "{\"uid\":\"" + uid + "\",\"key\":\"secret\",\"name\":\"Products\",\"actions\":[\"search\"],\"indexes\":[\"products\"]}"
        );
        Key key = client.updateKey(new UpdateKeyRequest(uid).setName("Products"));
        assertEquals("Products", key.getName());
        assertEquals("{\"name\":\"Products\"}", server.lastRequest().body);
    }

    public void testDeleteKey() throws IOException {
        server.respond("DELETE", "/keys/01b4bc42", 204);
        assertEquals(204, client.deleteKey("01b4bc42"));
    }

    public void testGenerateTenantTokenWithDefaultSearchKey() throws Exception {
        server.respond("GET", "/keys", 200, KEYS);
        Map<String, Object> rules = Collections.singletonMap("movies", Collections.singletonMap("filter", "genres = comedy"));
        String token = client.generateTenantToken(rules, null, null);
        String[] parts = token.split("\\.");
        assertEquals(3, parts.length);
        String claims = new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
        assertThat(claims, containsString("\"apiKeyUid\":\"74c9c733-3368-4738-bbe5-1d18a5fecb37\""));
        assertThat(claims, containsString("\"searchRules\":{\"movies\":{\"filter\":\"genres = comedy\"}}"));

        LatchedListener<String> listener = new LatchedListener<>();
        client.generateTenantTokenAsync(rules, null, null, listener);
        assertThat(listener.get(), equalTo(token));
    }

    public void testGenerateTenantTokenAsyncWithKeySendsNothing() throws Exception {
        Key key = new Key();
        key.setUid("74c9c733-3368-4738-bbe5-1d18a5fecb37");
        key.setKey("d0552b41536279a0ad88bd595327b96f01176a60c2243e906c52ac02375f9bc4");
        key.setActions(Collections.singletonList("search"));
        key.setIndexes(Collections.singletonList("*"));
        LatchedListener<String> listener = new LatchedListener<>();
        Cancellable cancellable = client.generateTenantTokenAsync(Collections.singletonMap("*", null), null, key, listener);
        assertEquals(3, listener.get().split("\\.").length);
        assertFalse(cancellable.isCancelled());
        cancellable.cancel();
        assertTrue(server.requests().isEmpty());
    }

    public void testGenerateTenantTokenWithoutDefaultSearchKey() {
        server.respond("GET", "/keys", 200, "{\"results\":[],\"offset\":0,\"limit\":20,\"total\":0}");
        expectThrows(KeyNotFoundException.class, () -> client.generateTenantToken(Collections.singletonMap("*", null), null, null));
    }

    public void testGetTasks() throws IOException {
        server.respond(
            "GET",
            "/tasks",
            200,
            "{\"results\":[" + FakeMeilisearch.task(7, "movies", "succeeded", "documentAdditionOrUpdate") + "],\"limit\":5,\"from\":7,\"next\":6}"
        );
        TasksPage page = client.getTasks(
            new GetTasksRequest().setIndexUids(Arrays.asList("movies", "books"))
                .setStatuses(Arrays.asList(TaskStatus.SUCCEEDED, TaskStatus.FAILED))
                .setLimit(5)
        );
        assertEquals(1, page.getResults().size());
        assertEquals(7L, page.getResults().get(0).getUid());
        assertEquals(Long.valueOf(6), page.getNext());
        String query = server.lastRequest().query;
        assertThat(query, containsString("indexUids=movies,books"));
        assertThat(query, containsString("statuses=succeeded,failed"));
        assertThat(query, containsString("limit=5"));
    }

    public void testGetTask() throws IOException {
        server.respond("GET", "/tasks/7", 200, FakeMeilisearch.task(7, "movies", "succeeded", "documentAdditionOrUpdate"));
        assertEquals(TaskStatus.SUCCEEDED, client.getTask(7).getStatus());
        assertNotNull(client.getTask(7).getFinishedAt());
    }

    public void testCloseClosesTheTransportOnce() throws IOException {
        try (RestClient restClient = MeilisearchClient.builder(server.url(), "masterKey").build()) {
            List<RestClient> closed = new ArrayList<>();
            MeilisearchClient closing = new MeilisearchClient(restClient, closed::add);
            closing.close();
            assertEquals(1, closed.size());
            assertSame(restClient, closed.get(0));
            assertSame(restClient, closing.getLowLevelClient());
        }
    }
}
