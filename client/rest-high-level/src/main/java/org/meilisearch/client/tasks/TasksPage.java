/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.tasks;

import java.util.List;

/**
 * One page of tasks, most recent first. {@code next} is the uid to pass as {@code from} to get the following page,
 * or {@code null} on the last page.
 */
public class TasksPage {

    private List<TaskResult> results;
    private int limit;
    private Long from;
    private Long next;

    public List<TaskResult> getResults() {
        return results;
    }

    public void setResults(List<TaskResult> results) {
        this.results = results;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public Long getFrom() {
        return from;
    }

    public void setFrom(Long from) {
        this.from = from;
    }

    public Long getNext() {
        return next;
    }

    public void setNext(Long next) {
        this.next = next;
    }
}
