/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.meilisearch.client.tasks.GetTasksRequest;
import org.meilisearch.client.tasks.TaskStatus;

import java.util.stream.Collectors;

final class TasksRequestConverters {

    private TasksRequestConverters() {}

    static Request getTasks(GetTasksRequest getTasksRequest) {
        Request request = new Request(HttpGet.METHOD_NAME, "/tasks");
        RequestConverters.Params params = new RequestConverters.Params();
        params.withCommaSeparated("indexUids", getTasksRequest.getIndexUids());
        if (getTasksRequest.getStatuses() != null) {
            params.withCommaSeparated("statuses", getTasksRequest.getStatuses().stream().map(TaskStatus::value).collect(Collectors.toList()));
        }
        params.withCommaSeparated("types", getTasksRequest.getTypes());
        params.withLimit(getTasksRequest.getLimit());
        params.putParam("from", getTasksRequest.getFrom());
        request.addParameters(params.asMap());
        return request;
    }

    static Request getTask(long taskUid) {
        return new Request(HttpGet.METHOD_NAME, RequestConverters.endpoint("tasks", Long.toString(taskUid)));
    }
}
