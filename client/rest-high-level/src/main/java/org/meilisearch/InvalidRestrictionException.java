/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch;

/**
 * Raised when the search rules of a tenant token give access to an index that the signing key can not search.
 */
public class InvalidRestrictionException extends MeilisearchException {

    public InvalidRestrictionException(String message) {
        super(message);
    }
}
