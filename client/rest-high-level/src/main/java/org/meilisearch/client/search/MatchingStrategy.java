/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.search;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the query terms must match when not every term can be found in a document.
 */
public enum MatchingStrategy {
    /** Only documents containing all the query terms are returned. */
    ALL("all"),
    /** Query terms are dropped from the end until enough documents match. */
    LAST("last");

    private final String value;

    MatchingStrategy(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
