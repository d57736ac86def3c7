/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.settings;

import java.util.Objects;

public class Faceting {

    private Integer maxValuesPerFacet;

    public Faceting() {}

    public Faceting(Integer maxValuesPerFacet) {
        this.maxValuesPerFacet = maxValuesPerFacet;
    }

    /**
     * Maximum number of values returned for each facet in a search
     */
    public Integer getMaxValuesPerFacet() {
        return maxValuesPerFacet;
    }

    public void setMaxValuesPerFacet(Integer maxValuesPerFacet) {
        this.maxValuesPerFacet = maxValuesPerFacet;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(maxValuesPerFacet, ((Faceting) o).maxValuesPerFacet);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(maxValuesPerFacet);
    }
}
