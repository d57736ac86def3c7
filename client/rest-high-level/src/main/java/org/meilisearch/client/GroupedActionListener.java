/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * An action listener that delegates its results to another listener once
 * it has received N results (either successes or failures). Results are handed
 * over in slot order, no matter the order in which they arrived. This allows
 * synchronous tasks to be forked off in a loop with the same listener and respond
 * to a higher level listener once all tasks responded.
 * <p>
 * The first failure wins: it is passed to the delegate once all slots responded,
 * and any further failure is added to it as a suppressed exception.
 */
public final class GroupedActionListener<T> {

    private final AtomicReferenceArray<T> results;
    private final AtomicInteger countDown;
    private final ActionListener<List<T>> delegate;
    private final AtomicReference<Exception> failure = new AtomicReference<>();

    /**
     * Creates a new listener
     * @param delegate the delegate listener
     * @param groupSize the group size
     */
    public GroupedActionListener(ActionListener<List<T>> delegate, int groupSize) {
        if (groupSize <= 0) {
            throw new IllegalArgumentException("groupSize must be greater than 0 but was " + groupSize);
        }
        this.results = new AtomicReferenceArray<>(groupSize);
        this.countDown = new AtomicInteger(groupSize);
        this.delegate = delegate;
    }

    /**
     * Returns the listener for the result at position {@code slot}.
     */
    public ActionListener<T> slot(int slot) {
        if (slot < 0 || slot >= results.length()) {
            throw new IllegalArgumentException("slot [" + slot + "] is out of range [0, " + results.length() + ")");
        }
        return new ActionListener<T>() {
            @Override
            public void onResponse(T element) {
                results.set(slot, element);
                countDown();
            }

            @Override
            public void onFailure(Exception e) {
                if (failure.compareAndSet(null, e) == false) {
                    failure.accumulateAndGet(e, (previous, current) -> {
                        if (previous != current) {
                            previous.addSuppressed(current);
                        }
                        return previous;
                    });
                }
                countDown();
            }
        };
    }

    private void countDown() {
        if (countDown.decrementAndGet() == 0) {
            if (failure.get() != null) {
                delegate.onFailure(failure.get());
            } else {
                List<T> collect = new ArrayList<>(results.length());
                for (int i = 0; i < results.length(); i++) {
                    collect.add(results.get(i));
                }
                delegate.onResponse(Collections.unmodifiableList(collect));
            }
        }
    }
}
