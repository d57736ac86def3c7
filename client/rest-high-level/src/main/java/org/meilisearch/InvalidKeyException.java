/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch;

/**
 * Raised when a key that can do more than search is used to sign a tenant token.
 */
public class InvalidKeyException extends MeilisearchException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
