/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.meilisearch.client.tasks.TaskInfo;
import org.meilisearch.client.tasks.TaskResult;
import org.meilisearch.client.tasks.TaskStatus;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Runs an action that enqueues tasks on an index, waits for them to finish and logs the ones that failed:
 * <pre>
 * List&lt;TaskInfo&gt; tasks = TaskStatusCheck.checkStatus(index, () -&gt; index.addDocumentsInBatches(documents, 1000, "id"));
 * </pre>
 * A failed task is not an error for the action: it is logged at warn level and the result is returned as is.
 */
public final class TaskStatusCheck {

    private static final Log logger = LogFactory.getLog(TaskStatusCheck.class);

    private TaskStatusCheck() {}

    /**
     * Runs {@code action} and waits for the task, or every task, it returns.
     *
     * @param index the index the tasks were enqueued on
     * @param action returns a {@link TaskInfo} or a collection of them. Any other result is returned without waiting
     * @return the result of {@code action}
     * @throws org.meilisearch.MeilisearchTimeoutException if a task did not finish in time
     * @throws IOException in case there is a problem sending a request or parsing back a response
     */
    public static <T> T checkStatus(IndexClient index, CheckedSupplier<T, IOException> action) throws IOException {
        T result = action.get();
        for (TaskInfo taskInfo : tasksOf(result)) {
            TaskResult task = index.waitForTask(taskInfo.getTaskUid());
            if (task.getStatus() == TaskStatus.FAILED) {
                logger.warn(
                    "status='failed' uid=" + task.getUid() + " index='" + index.uid() + "' type='" + task.getType() + "' error=" + task.getError()
                );
            }
        }
        return result;
    }

    private static List<TaskInfo> tasksOf(Object result) {
        if (result instanceof TaskInfo) {
            return Collections.singletonList((TaskInfo) result);
        }
        if (result instanceof Collection) {
            List<TaskInfo> tasks = new ArrayList<>();
            for (Object element : (Collection<?>) result) {
                if (element instanceof TaskInfo) {
                    tasks.add((TaskInfo) element);
                }
            }
            return tasks;
        }
        return Collections.emptyList();
    }
}
