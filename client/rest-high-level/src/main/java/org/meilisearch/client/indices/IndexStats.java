/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.indices;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public class IndexStats {

    private long numberOfDocuments;
    @JsonProperty("isIndexing")
    private boolean indexing;
    private Map<String, Long> fieldDistribution;

    public long getNumberOfDocuments() {
        return numberOfDocuments;
    }

    public void setNumberOfDocuments(long numberOfDocuments) {
        this.numberOfDocuments = numberOfDocuments;
    }

    /**
     * Whether the index is processing a task right now
     */
    @JsonProperty("isIndexing")
    public boolean isIndexing() {
        return indexing;
    }

    @JsonProperty("isIndexing")
    public void setIndexing(boolean indexing) {
        this.indexing = indexing;
    }

    /**
     * Number of documents holding each field
     */
    public Map<String, Long> getFieldDistribution() {
        return fieldDistribution;
    }

    public void setFieldDistribution(Map<String, Long> fieldDistribution) {
        this.fieldDistribution = fieldDistribution;
    }

    @Override
    public String toString() {
        return "IndexStats{numberOfDocuments=" + numberOfDocuments + ", isIndexing=" + indexing
            + ", fieldDistribution=" + fieldDistribution + '}';
    }
}
