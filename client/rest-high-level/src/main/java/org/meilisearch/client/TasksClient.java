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
import org.meilisearch.MeilisearchException;
import org.meilisearch.MeilisearchTimeoutException;
import org.meilisearch.client.tasks.GetTasksRequest;
import org.meilisearch.client.tasks.TaskResult;
import org.meilisearch.client.tasks.TasksPage;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

import static java.util.Collections.emptySet;

/**
 * A wrapper for the {@link MeilisearchClient} that provides methods for accessing the tasks endpoints, and for waiting
 * until a task is finished.
 */
public final class TasksClient {

    private static final Log logger = LogFactory.getLog(TasksClient.class);

    private final MeilisearchClient meilisearchClient;

    TasksClient(MeilisearchClient meilisearchClient) {
        this.meilisearchClient = meilisearchClient;
    }

    /**
     * Lists tasks, most recent first.
     *
     * @param getTasksRequest the filters and pagination
     * @return one page of tasks
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public TasksPage getTasks(GetTasksRequest getTasksRequest) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            getTasksRequest,
            TasksRequestConverters::getTasks,
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TasksPage.class),
            emptySet()
        );
    }

    /**
     * Asynchronously lists tasks, most recent first.
     *
     * @param getTasksRequest the filters and pagination
     * @param listener the listener to be notified upon request completion
     * @return cancellable that may be used to cancel the request
     */
    public Cancellable getTasksAsync(GetTasksRequest getTasksRequest, ActionListener<TasksPage> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            getTasksRequest,
            TasksRequestConverters::getTasks,
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TasksPage.class),
            listener,
            emptySet()
        );
    }

    /**
     * Gets a single task.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public TaskResult getTask(long taskUid) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> TasksRequestConverters.getTask(taskUid),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskResult.class),
            emptySet()
        );
    }

    public Cancellable getTaskAsync(long taskUid, ActionListener<TaskResult> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> TasksRequestConverters.getTask(taskUid),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskResult.class),
            listener,
            emptySet()
        );
    }

    /**
     * Waits for a task to finish, with the default timeout and poll interval.
     *
     * @see #waitForTask(long, long, long)
     */
    public TaskResult waitForTask(long taskUid) throws IOException {
        return waitForTask(taskUid, MeilisearchClient.DEFAULT_TASK_TIMEOUT_MILLIS, MeilisearchClient.DEFAULT_TASK_INTERVAL_MILLIS);
    }

    /**
     * Polls a task until it is neither enqueued nor processing. A failed or canceled task is returned like a succeeded one,
     * its status tells them apart.
     *
     * @param taskUid the uid of the task
     * @param timeoutMillis how long to wait for, in milliseconds
     * @param intervalMillis the pause between two polls, in milliseconds
     * @return the finished task
     * @throws MeilisearchTimeoutException if the task is still not finished once {@code timeoutMillis} elapsed
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public TaskResult waitForTask(long taskUid, long timeoutMillis, long intervalMillis) throws IOException {
        checkWaitArguments(timeoutMillis, intervalMillis);
        final long startNanos = System.nanoTime();
        while (true) {
            TaskResult task = getTask(taskUid);
            if (task.getStatus() != null && task.getStatus().isFinished()) {
                return task;
            }
            if (elapsedMillis(startNanos) >= timeoutMillis) {
                throw timeoutException(taskUid, timeoutMillis);
            }
            try {
                Thread.sleep(intervalMillis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new MeilisearchException("interrupted while waiting for task [" + taskUid + "]", e);
            }
        }
    }

    public Cancellable waitForTaskAsync(long taskUid, ActionListener<TaskResult> listener) {
        return waitForTaskAsync(
            taskUid,
            MeilisearchClient.DEFAULT_TASK_TIMEOUT_MILLIS,
            MeilisearchClient.DEFAULT_TASK_INTERVAL_MILLIS,
            listener
        );
    }

    /**
     * Asynchronous form of {@link #waitForTask(long, long, long)}. The polls after the first one are scheduled on the
     * client's scheduler. Cancelling the returned {@link Cancellable} stops polling and fails the listener with a
     * {@link java.util.concurrent.CancellationException}, the task itself keeps running on the server.
     */
    public Cancellable waitForTaskAsync(long taskUid, long timeoutMillis, long intervalMillis, ActionListener<TaskResult> listener) {
        try {
            checkWaitArguments(timeoutMillis, intervalMillis);
        } catch (IllegalArgumentException e) {
            listener.onFailure(e);
            return Cancellable.NO_OP;
        }
        ChainedCancellable chain = new ChainedCancellable();
        poll(taskUid, 0, System.nanoTime(), timeoutMillis, intervalMillis, chain, listener);
        return Cancellable.fromDependency(chain);
    }

    private void poll(
        long taskUid,
        long attempt,
        long startNanos,
        long timeoutMillis,
        long intervalMillis,
        ChainedCancellable chain,
        ActionListener<TaskResult> listener
    ) {
        if (chain.isCancelled()) {
            listener.onFailure(Cancellable.newCancellationException());
            return;
        }
        chain.setStep(attempt, getTaskAsync(taskUid, new ActionListener<TaskResult>() {
            @Override
            public void onResponse(TaskResult task) {
                if (task.getStatus() != null && task.getStatus().isFinished()) {
                    listener.onResponse(task);
                } else if (elapsedMillis(startNanos) >= timeoutMillis) {
                    listener.onFailure(timeoutException(taskUid, timeoutMillis));
                } else {
                    meilisearchClient.schedulePoll(
                        () -> poll(taskUid, attempt + 1, startNanos, timeoutMillis, intervalMillis, chain, listener),
                        intervalMillis,
                        () -> listener.onFailure(new MeilisearchException("client is closed, stopped waiting for task [" + taskUid + "]"))
                    );
                }
            }

            @Override
            public void onFailure(Exception e) {
                listener.onFailure(e);
            }
        }));
    }

    private static void checkWaitArguments(long timeoutMillis, long intervalMillis) {
        if (timeoutMillis < 0) {
            throw new IllegalArgumentException("timeout must be positive but was [" + timeoutMillis + "]");
        }
        if (intervalMillis < 0) {
            throw new IllegalArgumentException("interval must be positive but was [" + intervalMillis + "]");
        }
    }

    private static long elapsedMillis(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static MeilisearchTimeoutException timeoutException(long taskUid, long timeoutMillis) {
        logger.debug("gave up waiting for task [" + taskUid + "] after [" + timeoutMillis + "ms]");
        return new MeilisearchTimeoutException(
            String.format(Locale.ROOT, "timeout of [%dms] exceeded while waiting for task [%d] to finish", timeoutMillis, taskUid)
        );
    }
}
