/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.settings;

import java.util.Objects;

public class Pagination {

    private Integer maxTotalHits;

    public Pagination() {}

    public Pagination(Integer maxTotalHits) {
        this.maxTotalHits = maxTotalHits;
    }

    /**
     * Maximum number of hits a search can page through
     */
    public Integer getMaxTotalHits() {
        return maxTotalHits;
    }

    public void setMaxTotalHits(Integer maxTotalHits) {
        this.maxTotalHits = maxTotalHits;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(maxTotalHits, ((Pagination) o).maxTotalHits);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(maxTotalHits);
    }
}
