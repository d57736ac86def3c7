/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.keys;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * An API key and the permissions it grants.
 */
public class Key {

    private String uid;
    private String key;
    private String name;
    private String description;
    private List<String> actions;
    private List<String> indexes;
    private Instant expiresAt;
    private Instant createdAt;
    private Instant updatedAt;

    public String getUid() {
        return uid;
    }

    public void setUid(String uid) {
        this.uid = uid;
    }

    /**
     * The secret value sent as bearer token
     */
    public String getKey() {
        return key;
    }

    public void setKey(String key) {
        this.key = key;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public List<String> getActions() {
        return actions;
    }

    public void setActions(List<String> actions) {
        this.actions = actions;
    }

    /**
     * The index uids the key gives access to. {@code *} stands for every index.
     */
    public List<String> getIndexes() {
        return indexes;
    }

    public void setIndexes(List<String> indexes) {
        this.indexes = indexes;
    }

    /**
     * When the key expires, or {@code null} if it never does
     */
    public Instant getExpiresAt() {
        return expiresAt;
    }

    public void setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
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
        Key other = (Key) o;
        return Objects.equals(uid, other.uid)
            && Objects.equals(key, other.key)
            && Objects.equals(name, other.name)
            && Objects.equals(description, other.description)
            && Objects.equals(actions, other.actions)
            && Objects.equals(indexes, other.indexes)
            && Objects.equals(expiresAt, other.expiresAt)
            && Objects.equals(createdAt, other.createdAt)
            && Objects.equals(updatedAt, other.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(uid, key, name, description, actions, indexes, expiresAt, createdAt, updatedAt);
    }

    @Override
    public String toString() {
        // no key value, it is a secret
        return "Key{uid='" + uid + "', name='" + name + "', description='" + description + "', actions=" + actions
            + ", indexes=" + indexes + ", expiresAt=" + expiresAt + '}';
    }
}
