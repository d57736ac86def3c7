/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.documents;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.meilisearch.PayloadTooLargeException;
import org.meilisearch.client.DefaultObjectMapper;
import org.meilisearch.client.MeilisearchTestCase;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class DocumentBatchesTests extends MeilisearchTestCase {

    public void testBatch() {
        List<Integer> values = Arrays.asList(1, 2, 3, 4, 5);
        assertEquals(Arrays.asList(Arrays.asList(1, 2), Arrays.asList(3, 4), Collections.singletonList(5)), DocumentBatches.batch(values, 2));
        assertEquals(Collections.singletonList(values), DocumentBatches.batch(values, 5));
        assertEquals(Collections.singletonList(values), DocumentBatches.batch(values, 100));
        assertTrue(DocumentBatches.batch(Collections.emptyList(), 3).isEmpty());
    }

    public void testBatchKeepsEveryDocumentInOrder() {
        int count = randomIntBetween(0, 100);
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            values.add(i);
        }
        int batchSize = randomIntBetween(1, 20);
        List<List<Integer>> batches = DocumentBatches.batch(values, batchSize);
        assertEquals((count + batchSize - 1) / batchSize, batches.size());
        List<Integer> flattened = new ArrayList<>();
        for (List<Integer> batch : batches) {
            assertTrue(batch.size() <= batchSize);
            flattened.addAll(batch);
        }
        assertEquals(values, flattened);
    }

    public void testBatchRejectsNonPositiveSize() {
        expectThrows(IllegalArgumentException.class, () -> DocumentBatches.batch(Arrays.asList(1, 2), randomIntBetween(-10, 0)));
    }

    public void testAutoBatchStaysUnderPayloadSize() throws JsonProcessingException {
        List<Map<String, Object>> documents = new ArrayList<>();
        int count = randomIntBetween(1, 50);
        for (int i = 0; i < count; i++) {
            documents.add(Collections.singletonMap("title", randomAsciiLettersOfLengthBetween(1, 40)));
        }
        long maxPayloadSize = randomIntBetween(60, 400);
        List<List<Map<String, Object>>> batches = DocumentBatches.autoBatch(documents, maxPayloadSize);
        List<Map<String, Object>> flattened = new ArrayList<>();
        for (List<Map<String, Object>> batch : batches) {
            assertTrue(batch.isEmpty() == false);
            assertTrue(DefaultObjectMapper.writeValueAsBytes(batch).length <= maxPayloadSize);
            flattened.addAll(batch);
        }
        assertEquals(documents, flattened);
    }

    public void testAutoBatchFillsBatchesToTheLimit() throws JsonProcessingException {
        // {"id":1} is 8 bytes, so [d,d,d] is 2 + 3 * 8 + 2 = 28 bytes
        List<Map<String, Object>> documents = Collections.nCopies(7, Collections.singletonMap("id", 1));
        List<List<Map<String, Object>>> batches = DocumentBatches.autoBatch(documents, 28);
        assertEquals(3, batches.size());
        assertEquals(3, batches.get(0).size());
        assertEquals(3, batches.get(1).size());
        assertEquals(1, batches.get(2).size());
        assertEquals(2, DocumentBatches.autoBatch(documents, 27).get(0).size());
    }

    public void testAutoBatchCountsUtf8Bytes() throws JsonProcessingException {
        // {"t":"é"} is 10 bytes once encoded, although it is 9 characters long
        List<Map<String, Object>> documents = Arrays.asList(Collections.singletonMap("t", "é"), Collections.singletonMap("t", "é"));
        assertEquals(2, DocumentBatches.autoBatch(documents, 22).size());
        assertEquals(1, DocumentBatches.autoBatch(documents, 23).size());
    }

    public void testAutoBatchRejectsLargeDocument() {
        List<Map<String, Object>> documents = Collections.singletonList(Collections.singletonMap("id", 1));
        expectThrows(PayloadTooLargeException.class, () -> DocumentBatches.autoBatch(documents, 9));
        expectThrows(IllegalArgumentException.class, () -> DocumentBatches.autoBatch(documents, 0));
    }

    public void testAutoBatchNothing() throws JsonProcessingException {
        assertTrue(DocumentBatches.autoBatch(Collections.emptyList(), 10).isEmpty());
    }
}
