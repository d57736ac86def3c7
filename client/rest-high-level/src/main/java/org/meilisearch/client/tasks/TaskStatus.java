/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.tasks;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle of a task. A task is finished once it is {@link #SUCCEEDED}, {@link #FAILED} or {@link #CANCELED}.
 */
public enum TaskStatus {
    ENQUEUED,
    PROCESSING,
    SUCCEEDED,
    FAILED,
    CANCELED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isFinished() {
        return this != ENQUEUED && this != PROCESSING;
    }

    @JsonCreator
    public static TaskStatus fromString(String value) {
        for (TaskStatus status : values()) {
            if (status.value().equals(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("unknown task status [" + value + "]");
    }
}
