/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.documents;

import org.apache.hc.core5.http.ContentType;

import java.nio.file.Path;
import java.util.Locale;

/**
 * The document file formats that Meilisearch accepts, keyed by file extension.
 */
public enum DocumentType {
    JSON("json", ContentType.APPLICATION_JSON),
    CSV("csv", ContentType.create("text/csv")),
    NDJSON("ndjson", ContentType.create("application/x-ndjson"));

    private final String extension;
    private final ContentType contentType;

    DocumentType(String extension, ContentType contentType) {
        this.extension = extension;
        this.contentType = contentType;
    }

    /**
     * The file extension, without the leading dot
     */
    public String extension() {
        return extension;
    }

    /**
     * The content type of a raw upload of this format
     */
    public ContentType contentType() {
        return contentType;
    }

    /**
     * Returns the type matching the extension of {@code path}, or {@code null} if the extension is not supported.
     */
    public static DocumentType fromPath(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return null;
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return null;
        }
        String extension = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        for (DocumentType type : values()) {
            if (type.extension.equals(extension)) {
                return type;
            }
        }
        return null;
    }
}
