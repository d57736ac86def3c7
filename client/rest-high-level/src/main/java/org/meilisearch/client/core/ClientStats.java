/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.core;

import org.meilisearch.client.indices.IndexStats;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics of the whole Meilisearch instance, as returned by the stats endpoint.
 */
public class ClientStats {

    private long databaseSize;
    private Instant lastUpdate;
    private Map<String, IndexStats> indexes;

    /**
     * Size of the database, in bytes
     */
    public long getDatabaseSize() {
        return databaseSize;
    }

    public void setDatabaseSize(long databaseSize) {
        this.databaseSize = databaseSize;
    }

    /**
     * When the last update happened on any index, or {@code null} if nothing was ever written
     */
    public Instant getLastUpdate() {
        return lastUpdate;
    }

    public void setLastUpdate(Instant lastUpdate) {
        this.lastUpdate = lastUpdate;
    }

    /**
     * Statistics per index, keyed by index uid
     */
    public Map<String, IndexStats> getIndexes() {
        return indexes;
    }

    public void setIndexes(Map<String, IndexStats> indexes) {
        this.indexes = indexes;
    }

    @Override
    public String toString() {
        return "ClientStats{databaseSize=" + databaseSize + ", lastUpdate=" + lastUpdate + ", indexes=" + indexes + '}';
    }
}
