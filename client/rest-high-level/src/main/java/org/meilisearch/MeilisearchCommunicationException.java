/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch;

/**
 * Raised when the Meilisearch server could not be reached: the connection was refused, closed before a response
 * was received or timed out while connecting.
 */
public class MeilisearchCommunicationException extends MeilisearchException {

    public MeilisearchCommunicationException(String message, Throwable cause) {
        super(message, cause);
    }
}
