/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.indices;

import org.meilisearch.client.Validatable;
import org.meilisearch.client.ValidationException;

import java.util.Optional;

/**
 * Body of an index creation. The primary key is optional, Meilisearch infers it from the first documents otherwise.
 */
public class CreateIndexRequest implements Validatable {

    private final String uid;
    private final String primaryKey;

    public CreateIndexRequest(String uid) {
        this(uid, null);
    }

    public CreateIndexRequest(String uid, String primaryKey) {
        this.uid = uid;
        this.primaryKey = primaryKey;
    }

    public String getUid() {
        return uid;
    }

    public String getPrimaryKey() {
        return primaryKey;
    }

    @Override
    public Optional<ValidationException> validate() {
        if (uid == null || uid.isEmpty()) {
            return Optional.of(ValidationException.withError("index uid is missing"));
        }
        return Optional.empty();
    }
}
