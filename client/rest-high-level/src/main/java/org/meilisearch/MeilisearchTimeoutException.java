/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch;

/**
 * Raised when waiting for a task took longer than the allowed timeout.
 */
public class MeilisearchTimeoutException extends MeilisearchException {

    public MeilisearchTimeoutException(String message) {
        super(message);
    }
}
