/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.tasks;

import org.meilisearch.client.Validatable;
import org.meilisearch.client.ValidationException;

import java.util.List;
import java.util.Optional;

/**
 * Filters and pagination for listing tasks. Filters holding several values match any of them.
 */
public class GetTasksRequest implements Validatable {

    private List<String> indexUids;
    private List<TaskStatus> statuses;
    private List<String> types;
    private Integer limit;
    private Long from;

    public List<String> getIndexUids() {
        return indexUids;
    }

    public GetTasksRequest setIndexUids(List<String> indexUids) {
        this.indexUids = indexUids;
        return this;
    }

    public List<TaskStatus> getStatuses() {
        return statuses;
    }

    public GetTasksRequest setStatuses(List<TaskStatus> statuses) {
        this.statuses = statuses;
        return this;
    }

    public List<String> getTypes() {
        return types;
    }

    public GetTasksRequest setTypes(List<String> types) {
        this.types = types;
        return this;
    }

    public Integer getLimit() {
        return limit;
    }

    public GetTasksRequest setLimit(Integer limit) {
        this.limit = limit;
        return this;
    }

    public Long getFrom() {
        return from;
    }

    public GetTasksRequest setFrom(Long from) {
        this.from = from;
        return this;
    }

    @Override
    public Optional<ValidationException> validate() {
        if (limit != null && limit < 0) {
            return Optional.of(ValidationException.withError("limit must be positive but was [" + limit + "]"));
        }
        return Optional.empty();
    }
}
