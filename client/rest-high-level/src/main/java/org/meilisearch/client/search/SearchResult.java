/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.search;

import java.util.List;
import java.util.Map;

public class SearchResult {

    private List<Map<String, Object>> hits;
    private int offset;
    private int limit;
    private long estimatedTotalHits;
    private long processingTimeMs;
    private String query;
    private Map<String, Map<String, Long>> facetDistribution;

    public List<Map<String, Object>> getHits() {
        return hits;
    }

    public void setHits(List<Map<String, Object>> hits) {
        this.hits = hits;
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

    public long getEstimatedTotalHits() {
        return estimatedTotalHits;
    }

    public void setEstimatedTotalHits(long estimatedTotalHits) {
        this.estimatedTotalHits = estimatedTotalHits;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public void setProcessingTimeMs(long processingTimeMs) {
        this.processingTimeMs = processingTimeMs;
    }

    public String getQuery() {
        return query;
    }

    public void setQuery(String query) {
        this.query = query;
    }

    /**
     * Number of matching documents per value of each requested facet, or {@code null} when no facet was requested
     */
    public Map<String, Map<String, Long>> getFacetDistribution() {
        return facetDistribution;
    }

    public void setFacetDistribution(Map<String, Map<String, Long>> facetDistribution) {
        this.facetDistribution = facetDistribution;
    }
}
