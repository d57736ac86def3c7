/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.keys;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.meilisearch.client.Validatable;
import org.meilisearch.client.ValidationException;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Describes an API key to create. {@code expiresAt} is always sent: {@code null} creates a key that never expires.
 */
public class CreateKeyRequest implements Validatable {

    private String uid;
    private String name;
    private String description;
    private List<String> actions;
    private List<String> indexes;
    private Instant expiresAt;

    public CreateKeyRequest() {}

    public CreateKeyRequest(List<String> actions, List<String> indexes, Instant expiresAt) {
        this.actions = actions;
        this.indexes = indexes;
        this.expiresAt = expiresAt;
    }

    public String getUid() {
        return uid;
    }

    /**
     * Sets the uid of the key, a uuid v4. Meilisearch generates one when it is not set.
     */
    public CreateKeyRequest setUid(String uid) {
        this.uid = uid;
        return this;
    }

    public String getName() {
        return name;
    }

    public CreateKeyRequest setName(String name) {
        this.name = name;
        return this;
    }

    public String getDescription() {
        return description;
    }

    public CreateKeyRequest setDescription(String description) {
        this.description = description;
        return this;
    }

    public List<String> getActions() {
        return actions;
    }

    public CreateKeyRequest setActions(List<String> actions) {
        this.actions = actions;
        return this;
    }

    public List<String> getIndexes() {
        return indexes;
    }

    public CreateKeyRequest setIndexes(List<String> indexes) {
        this.indexes = indexes;
        return this;
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public Instant getExpiresAt() {
        return expiresAt;
    }

    public CreateKeyRequest setExpiresAt(Instant expiresAt) {
        this.expiresAt = expiresAt;
        return this;
    }

    @Override
    public Optional<ValidationException> validate() {
        ValidationException validationException = new ValidationException();
        if (actions == null || actions.isEmpty()) {
            validationException.addValidationError("key actions are missing");
        }
        if (indexes == null || indexes.isEmpty()) {
            validationException.addValidationError("key indexes are missing");
        }
        return validationException.validationErrors().isEmpty() ? Optional.empty() : Optional.of(validationException);
    }
}
