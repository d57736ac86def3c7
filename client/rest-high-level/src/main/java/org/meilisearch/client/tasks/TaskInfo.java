/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.tasks;

import java.time.Instant;

/**
 * The summary Meilisearch returns when it enqueues a task.
 */
public class TaskInfo {

    private long taskUid;
    private String indexUid;
    private TaskStatus status;
    private String type;
    private Instant enqueuedAt;

    public long getTaskUid() {
        return taskUid;
    }

    public void setTaskUid(long taskUid) {
        this.taskUid = taskUid;
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

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public void setEnqueuedAt(Instant enqueuedAt) {
        this.enqueuedAt = enqueuedAt;
    }

    @Override
    public String toString() {
        return "TaskInfo{taskUid=" + taskUid + ", indexUid='" + indexUid + "', status=" + status + ", type='" + type
            + "', enqueuedAt=" + enqueuedAt + '}';
    }
}
