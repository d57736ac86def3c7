/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.indices;

import java.util.List;

/**
 * One page of the index list.
 */
public class IndexesPage {

    private List<IndexInfo> results;
    private int offset;
    private int limit;
    private int total;

    public List<IndexInfo> getResults() {
        return results;
    }

    public void setResults(List<IndexInfo> results) {
        this.results = results;
    }

    public int getOffset() {
        return offset;
    }

    public void setOffset(int offset) {
        this.offset = offset;
    }

    public int getLimit() {
        return limit;
    }

    public void setLimit(int limit) {
        this.limit = limit;
    }

    public int getTotal() {
        return total;
    }

    public void setTotal(int total) {
        this.total = total;
    }
}
