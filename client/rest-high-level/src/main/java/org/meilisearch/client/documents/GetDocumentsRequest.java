/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.documents;

import org.meilisearch.client.Validatable;
import org.meilisearch.client.ValidationException;

import java.util.List;
import java.util.Optional;

/**
 * Pagination and field selection for listing the documents of an index. Unset values fall back to the server defaults.
 */
public class GetDocumentsRequest implements Validatable {

    private Integer offset;
    private Integer limit;
    private List<String> fields;

    public Integer getOffset() {
        return offset;
    }

    public GetDocumentsRequest setOffset(Integer offset) {
        this.offset = offset;
        return this;
    }

    public Integer getLimit() {
        return limit;
    }

    public GetDocumentsRequest setLimit(Integer limit) {
        this.limit = limit;
        return this;
    }

    /**
     * The attributes to return for every document, sent comma-separated
     */
    public List<String> getFields() {
        return fields;
    }

    public GetDocumentsRequest setFields(List<String> fields) {
        this.fields = fields;
        return this;
    }

    @Override
    public Optional<ValidationException> validate() {
        ValidationException validationException = new ValidationException();
        if (offset != null && offset < 0) {
            validationException.addValidationError("offset must be positive but was [" + offset + "]");
        }
        if (limit != null && limit < 0) {
            validationException.addValidationError("limit must be positive but was [" + limit + "]");
        }
        return validationException.validationErrors().isEmpty() ? Optional.empty() : Optional.of(validationException);
    }
}
