/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.search;

import org.meilisearch.client.Validatable;
import org.meilisearch.client.ValidationException;

import java.util.List;
import java.util.Optional;

/**
 * A search query against a single index. Fields left {@code null} are not sent, so that Meilisearch applies its own
 * defaults for them.
 */
public class SearchRequest implements Validatable {

    public static final int DEFAULT_OFFSET = 0;
    public static final int DEFAULT_LIMIT = 20;
    public static final int DEFAULT_CROP_LENGTH = 200;

    private String q;
    private Object filter;
    private Integer offset = DEFAULT_OFFSET;
    private Integer limit = DEFAULT_LIMIT;
    private List<String> facets;
    private List<String> attributesToRetrieve;
    private List<String> attributesToCrop;
    private Integer cropLength = DEFAULT_CROP_LENGTH;
    private List<String> attributesToHighlight;
    private List<String> sort;
    private Boolean showMatchesPosition = false;
    private String highlightPreTag;
    private String highlightPostTag;
    private String cropMarker;
    private MatchingStrategy matchingStrategy;

    public SearchRequest() {}

    public SearchRequest(String q) {
        this.q = q;
    }

    public String getQ() {
        return q;
    }

    public SearchRequest setQ(String q) {
        this.q = q;
        return this;
    }

    /**
     * The filter expression: either a string like {@code "genre = horror AND year > 2000"} or a list whose
     * elements are strings or lists of strings, where the outer list is ANDed and inner lists are ORed.
     */
    public Object getFilter() {
        return filter;
    }

    public SearchRequest setFilter(String filter) {
        this.filter = filter;
        return this;
    }

    public SearchRequest setFilter(List<?> filter) {
        this.filter = filter;
        return this;
    }

    public Integer getOffset() {
        return offset;
    }

    public SearchRequest setOffset(Integer offset) {
        this.offset = offset;
        return this;
    }

    public Integer getLimit() {
        return limit;
    }

    public SearchRequest setLimit(Integer limit) {
        this.limit = limit;
        return this;
    }

    public List<String> getFacets() {
        return facets;
    }

    public SearchRequest setFacets(List<String> facets) {
        this.facets = facets;
        return this;
    }

    public List<String> getAttributesToRetrieve() {
        return attributesToRetrieve;
    }

    public SearchRequest setAttributesToRetrieve(List<String> attributesToRetrieve) {
        this.attributesToRetrieve = attributesToRetrieve;
        return this;
    }

    public List<String> getAttributesToCrop() {
        return attributesToCrop;
    }

    public SearchRequest setAttributesToCrop(List<String> attributesToCrop) {
        this.attributesToCrop = attributesToCrop;
        return this;
    }

    public Integer getCropLength() {
        return cropLength;
    }

    public SearchRequest setCropLength(Integer cropLength) {
        this.cropLength = cropLength;
        return this;
    }

    public List<String> getAttributesToHighlight() {
        return attributesToHighlight;
    }

    public SearchRequest setAttributesToHighlight(List<String> attributesToHighlight) {
        this.attributesToHighlight = attributesToHighlight;
        return this;
    }

    /**
     * Sort criteria such as {@code "price:asc"}, applied in order
     */
    public List<String> getSort() {
        return sort;
    }

    public SearchRequest setSort(List<String> sort) {
        this.sort = sort;
        return this;
    }

    public Boolean getShowMatchesPosition() {
        return showMatchesPosition;
    }

    public SearchRequest setShowMatchesPosition(Boolean showMatchesPosition) {
        this.showMatchesPosition = showMatchesPosition;
        return this;
    }

    public String getHighlightPreTag() {
        return highlightPreTag;
    }

    public SearchRequest setHighlightPreTag(String highlightPreTag) {
        this.highlightPreTag = highlightPreTag;
        return this;
    }

    public String getHighlightPostTag() {
        return highlightPostTag;
    }

    public SearchRequest setHighlightPostTag(String highlightPostTag) {
        this.highlightPostTag = highlightPostTag;
        return this;
    }

    public String getCropMarker() {
        return cropMarker;
    }

    public SearchRequest setCropMarker(String cropMarker) {
        this.cropMarker = cropMarker;
        return this;
    }

    public MatchingStrategy getMatchingStrategy() {
        return matchingStrategy;
    }

    public SearchRequest setMatchingStrategy(MatchingStrategy matchingStrategy) {
        this.matchingStrategy = matchingStrategy;
        return this;
    }

    @Override
    public Optional<ValidationException> validate() {
        ValidationException validationException = new ValidationException();
        if (offset != null && offset < 0) {
            validationException.addValidationError("offset must be positive but was [" + offset + "]");
        }
        if (limit != null && limit < 0) {
            validationException.addValidationError("limit must be positive but was [" + limit + "]");
        }
        if (cropLength != null && cropLength < 0) {
            validationException.addValidationError("cropLength must be positive but was [" + cropLength + "]");
        }
        return validationException.validationErrors().isEmpty() ? Optional.empty() : Optional.of(validationException);
    }
}
