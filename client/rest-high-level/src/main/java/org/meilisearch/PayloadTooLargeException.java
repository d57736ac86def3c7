/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch;

/**
 * Raised when a single document is larger than the maximum payload size of an auto-batched request.
 */
public class PayloadTooLargeException extends MeilisearchException {

    public PayloadTooLargeException(String message) {
        super(message);
    }
}
