/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.indices;

import java.time.Instant;
import java.util.Objects;

/**
 * The raw information Meilisearch holds about an index.
 */
public class IndexInfo {

    private String uid;
    private String primaryKey;
    private Instant createdAt;
    private Instant updatedAt;

    public String getUid() {
        return uid;
    }

    public void setUid(String uid) {
        this.uid = uid;
    }

    public String getPrimaryKey() {
        return primaryKey;
    }

    public void setPrimaryKey(String primaryKey) {
        this.primaryKey = primaryKey;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IndexInfo that = (IndexInfo) o;
        return Objects.equals(uid, that.uid)
            && Objects.equals(primaryKey, that.primaryKey)
            && Objects.equals(createdAt, that.createdAt)
            && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uid, primaryKey, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        return "IndexInfo{uid='" + uid + "', primaryKey='" + primaryKey + "', createdAt=" + createdAt + ", updatedAt=" + updatedAt + '}';
    }
}
