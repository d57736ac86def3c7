/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch;

import java.util.Locale;

/**
 * Exception carrying the error that the Meilisearch API returned, together with the HTTP status of the response.
 * <p>
 * Meilisearch answers errors with a body like
 * <pre>{"message": "Index `movies` not found.", "code": "index_not_found", "type": "invalid_request", "link": "..."}</pre>
 * Any of the fields may be missing when the error did not come from Meilisearch itself, for example from a proxy.
 */
public class MeilisearchApiException extends MeilisearchException {

    private final int status;
    private final String code;
    private final String type;
    private final String link;

    public MeilisearchApiException(String message, int status, String code, String type, String link, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.code = code;
        this.type = type;
        this.link = link;
    }

    /**
     * The HTTP status code of the response
     */
    public int getStatus() {
        return status;
    }

    /**
     * The Meilisearch error code, e.g. {@code index_not_found}, or {@code null} if the body did not carry one
     */
    public String getCode() {
        return code;
    }

    public String getType() {
        return type;
    }

    public String getLink() {
        return link;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "MeilisearchApiException[status=%d, code=%s, type=%s, link=%s, message=%s]",
            status, code, type, link, getMessage());
    }
}
