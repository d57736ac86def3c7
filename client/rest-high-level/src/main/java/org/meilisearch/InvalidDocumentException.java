/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch;

public class InvalidDocumentException extends MeilisearchException {

    public InvalidDocumentException(String message) {
        super(message);
    }
}
