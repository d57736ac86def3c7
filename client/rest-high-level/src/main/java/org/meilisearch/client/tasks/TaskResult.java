/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.tasks;

import java.time.Instant;
import java.util.Map;

/**
 * The full state of a task, as returned by the tasks endpoints.
 */
public class TaskResult {

    private long uid;
    private String indexUid;
    private TaskStatus status;
    private String type;
    private Map<String, Object> details;
    private TaskError error;
    private Long canceledBy;
    private String duration;
    private Instant enqueuedAt;
    private Instant startedAt;
    private Instant finishedAt;

    public long getUid() {
        return uid;
    }

    public void setUid(long uid) {
        this.uid = uid;
    }

    public String getIndexUid() {
        return indexUid;
    }

    public void setIndexUid(String indexUid) {
        this.indexUid = indexUid;
    }

    public TaskStatus getStatus() {
        return status;
    }

    public void setStatus(TaskStatus status) {
        this.status = status;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    /**
     * Type specific details, such as the number of received and indexed documents
     */
    public Map<String, Object> getDetails() {
        return details;
    }

    public void setDetails(Map<String, Object> details) {
        this.details = details;
    }

    /**
     * Why the task failed, or {@code null} unless its status is {@link TaskStatus#FAILED}
     */
    public TaskError getError() {
        return error;
    }

    public void setError(TaskError error) {
        this.error = error;
    }

    public Long getCanceledBy() {
        return canceledBy;
    }

    public void setCanceledBy(Long canceledBy) {
        this.canceledBy = canceledBy;
    }

    /**
     * ISO-8601 duration of the processing, e.g. {@code PT0.0031S}
     */
    public String getDuration() {
        return duration;
    }

    public void setDuration(String duration) {
        this.duration = duration;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public void setEnqueuedAt(Instant enqueuedAt) {
        this.enqueuedAt = enqueuedAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public void setStartedAt(Instant startedAt) {
        this.startedAt = startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public void setFinishedAt(Instant finishedAt) {
        this.finishedAt = finishedAt;
    }

    @Override
    public String toString() {
        return "TaskResult{uid=" + uid + ", indexUid='" + indexUid + "', status=" + status + ", type='" + type + "', error=" + error + '}';
    }
}
