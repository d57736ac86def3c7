/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch;

/**
 * Base class for all exceptions raised by the Meilisearch client.
 */
public class MeilisearchException extends RuntimeException {

    public MeilisearchException(String message) {
        super(message);
    }

    public MeilisearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
