/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.apache.hc.core5.concurrent.CancellableDependency;

import java.util.ArrayList;
import java.util.List;

/**
 * Cancellation handle for operations made of several requests, like creating an index and then waiting for its
 * task. Cancelling the chain cancels every registered step as well as any step registered afterwards.
 * <p>
 * Steps registered through {@link #setDependency} are all kept: they may run side by side, as the batches of a
 * document upload do, and a step may complete and start the next one before its own registration happens. Polling
 * a task can take thousands of requests, so it registers through {@link #setStep} and only the latest poll is kept.
 * Cancelling a step that already completed does nothing.
 */
final class ChainedCancellable implements CancellableDependency {

    private final List<org.apache.hc.core5.concurrent.Cancellable> steps = new ArrayList<>();
    private org.apache.hc.core5.concurrent.Cancellable current;
    private long currentSequence = -1;
    private boolean cancelled;

    @Override
    public synchronized void setDependency(org.apache.hc.core5.concurrent.Cancellable step) {
        if (step == Cancellable.NO_OP) {
            return;
        }
        if (cancelled) {
            step.cancel();
        } else {
            steps.add(step);
        }
    }

    /**
     * Registers step number {@code sequence} of a chain that sends one request at a time, replacing the previous
     * step. A step registered after a later one is ignored: the later one only started once it had completed.
     */
    synchronized void setStep(long sequence, org.apache.hc.core5.concurrent.Cancellable step) {
        if (step == Cancellable.NO_OP) {
            return;
        }
        if (cancelled) {
            step.cancel();
        } else if (sequence > currentSequence) {
            currentSequence = sequence;
            current = step;
        }
    }

    @Override
    public synchronized boolean isCancelled() {
        return cancelled;
    }

    @Override
    public synchronized boolean cancel() {
        if (cancelled) {
            return false;
        }
        cancelled = true;
        for (org.apache.hc.core5.concurrent.Cancellable step : steps) {
            step.cancel();
        }
        steps.clear();
        if (current != null) {
            current.cancel();
            current = null;
        }
        return true;
    }

    /**
     * A handle for an operation that completed without sending anything. Cancelling it does nothing.
     */
    static Cancellable completed() {
        return Cancellable.fromDependency(new ChainedCancellable());
    }

    // visible for tests
    synchronized int registeredSteps() {
        return steps.size() + (current == null ? 0 : 1);
    }
}
