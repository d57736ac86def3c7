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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Splits documents into the batches sent by the batched add and update operations.
 */
public final class DocumentBatches {

    /**
     * The largest payload Meilisearch accepts with its default configuration, 100MB.
     */
    public static final long DEFAULT_MAX_PAYLOAD_SIZE = 104857600L;

    private DocumentBatches() {}

    /**
     * Splits {@code documents} into consecutive chunks of {@code batchSize} elements. The last chunk may be smaller.
     *
     * @throws IllegalArgumentException if {@code batchSize} is not positive
     */
    public static <T> List<List<T>> batch(List<T> documents, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be greater than 0 but was [" + batchSize + "]");
        }
        List<List<T>> batches = new ArrayList<>();
        for (int i = 0; i < documents.size(); i += batchSize) {
            batches.add(new ArrayList<>(documents.subList(i, Math.min(documents.size(), i + batchSize))));
        }
        return batches;
    }

    /**
     * Packs {@code documents}, in order, into as few batches as possible so that the json array of each batch stays
     * within {@code maxPayloadSize} bytes. A batch of n documents weighs two bytes for the brackets, the encoded size
     * of every document and n - 1 separating commas.
     *
     * @throws PayloadTooLargeException if a single document is larger than {@code maxPayloadSize}
     */
    public static List<List<Map<String, Object>>> autoBatch(List<Map<String, Object>> documents, long maxPayloadSize)
        throws JsonProcessingException {
        if (maxPayloadSize <= 0) {
            throw new IllegalArgumentException("maxPayloadSize must be greater than 0 but was [" + maxPayloadSize + "]");
        }
        List<List<Map<String, Object>>> batches = new ArrayList<>();
        List<Map<String, Object>> current = new ArrayList<>();
        long currentSize = 2;
        for (Map<String, Object> document : documents) {
            long documentSize = DefaultObjectMapper.writeValueAsBytes(document).length;
            if (2 + documentSize > maxPayloadSize) {
                throw new PayloadTooLargeException(
                    "Payload size [" + (2 + documentSize) + "] of a single document is larger than the max payload size [" + maxPayloadSize + "]"
                );
            }
            long candidateSize = current.isEmpty() ? 2 + documentSize : currentSize + 1 + documentSize;
            if (candidateSize > maxPayloadSize) {
                batches.add(current);
                current = new ArrayList<>();
                candidateSize = 2 + documentSize;
            }
            current.add(document);
            currentSize = candidateSize;
        }
        if (current.isEmpty() == false) {
            batches.add(current);
        }
        return batches;
    }
}
