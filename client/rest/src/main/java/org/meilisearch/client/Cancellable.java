/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.apache.hc.core5.concurrent.CancellableDependency;

import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Represents an operation that can be cancelled.
 * Returned when executing async requests through {@link RestClient#performRequestAsync(Request, ResponseListener)} so that the
 * request can be cancelled if needed. Cancelling a request does not abort the corresponding task on the Meilisearch server:
 * a write that was already enqueued keeps running there.
 * <p>
 * The dependency is usually the HTTP request being executed, but callers that chain several requests together can
 * supply their own {@link CancellableDependency} and swap the step it points to as the chain progresses.
 */
public class Cancellable implements org.apache.hc.core5.concurrent.Cancellable {

    static final Cancellable NO_OP = new Cancellable(null) {
        @Override
        public boolean cancel() {
            throw new UnsupportedOperationException();
        }

        @Override
        void runIfNotCancelled(Runnable runnable) {
            throw new UnsupportedOperationException();
        }
    };

    private final CancellableDependency dependency;

    private Cancellable(CancellableDependency dependency) {
        this.dependency = dependency;
    }

    /**
     * Returns a new {@link Cancellable} bound to the given dependency.
     *
     * @throws NullPointerException if {@code dependency} is null
     */
    public static Cancellable fromDependency(CancellableDependency dependency) {
        return new Cancellable(Objects.requireNonNull(dependency, "dependency cannot be null"));
    }

    /**
     * Cancels the on-going request that is associated with the current instance of {@link Cancellable}.
     *
     * @return true if the request was cancelled by this call
     */
    @Override
    public synchronized boolean cancel() {
        return this.dependency.cancel();
    }

    /**
     * Returns whether {@link #cancel()} was called on this instance.
     */
    public boolean isCancelled() {
        return this.dependency.isCancelled();
    }

    /**
     * Executes some arbitrary code iff the on-going request has not been cancelled, otherwise throws {@link CancellationException}.
     * This is needed so that the request is not sent once it was cancelled, as the http client would otherwise happily
     * execute it.
     */
    synchronized void runIfNotCancelled(Runnable runnable) {
        if (this.dependency.isCancelled()) {
            throw newCancellationException();
        }
        runnable.run();
    }

    public static CancellationException newCancellationException() {
        return new CancellationException("request was cancelled");
    }
}
