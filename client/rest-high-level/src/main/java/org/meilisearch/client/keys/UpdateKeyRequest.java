/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.keys;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.meilisearch.client.Validatable;
import org.meilisearch.client.ValidationException;

import java.util.Optional;

/**
 * Changes the name or the description of an existing key. Only the fields that are set are sent.
 */
public class UpdateKeyRequest implements Validatable {

    private final String key;
    private String name;
    private String description;

    /**
     * @param key the uid or the value of the key to update
     */
    public UpdateKeyRequest(String key) {
        this.key = key;
    }

    @JsonIgnore
    public String getKey() {
        return key;
    }

    public String getName() {
        return name;
    }

    public UpdateKeyRequest setName(String name) {
        this.name = name;
        return this;
    }

    public String getDescription() {
        return description;
    }

    public UpdateKeyRequest setDescription(String description) {
        this.description = description;
        return this;
    }

    @Override
    public Optional<ValidationException> validate() {
        if (key == null || key.isEmpty()) {
            return Optional.of(ValidationException.withError("key is missing"));
        }
        return Optional.empty();
    }
}
