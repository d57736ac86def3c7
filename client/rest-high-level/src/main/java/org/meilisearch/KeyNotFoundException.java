/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch;

public class KeyNotFoundException extends MeilisearchException {

    public KeyNotFoundException(String message) {
        super(message);
    }
}
