/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.settings;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The settings of an index. When used to update settings, only the fields that are set are sent and changed.
 */
public class Settings {

    private List<String> rankingRules;
    private String distinctAttribute;
    private List<String> searchableAttributes;
    private List<String> displayedAttributes;
    private List<String> stopWords;
    private Map<String, List<String>> synonyms;
    private List<String> filterableAttributes;
    private List<String> sortableAttributes;
    private TypoTolerance typoTolerance;
    private Faceting faceting;
    private Pagination pagination;

    public List<String> getRankingRules() {
        return rankingRules;
    }

    public void setRankingRules(List<String> rankingRules) {
        this.rankingRules = rankingRules;
    }

    public String getDistinctAttribute() {
        return distinctAttribute;
    }

    public void setDistinctAttribute(String distinctAttribute) {
        this.distinctAttribute = distinctAttribute;
    }

    public List<String> getSearchableAttributes() {
        return searchableAttributes;
    }

    public void setSearchableAttributes(List<String> searchableAttributes) {
        this.searchableAttributes = searchableAttributes;
    }

    public List<String> getDisplayedAttributes() {
        return displayedAttributes;
    }

    public void setDisplayedAttributes(List<String> displayedAttributes) {
        this.displayedAttributes = displayedAttributes;
    }

    public List<String> getStopWords() {
        return stopWords;
    }

    public void setStopWords(List<String> stopWords) {
        this.stopWords = stopWords;
    }

    public Map<String, List<String>> getSynonyms() {
        return synonyms;
    }

    public void setSynonyms(Map<String, List<String>> synonyms) {
        this.synonyms = synonyms;
    }

    public List<String> getFilterableAttributes() {
        return filterableAttributes;
    }

    public void setFilterableAttributes(List<String> filterableAttributes) {
        this.filterableAttributes = filterableAttributes;
    }

    public List<String> getSortableAttributes() {
        return sortableAttributes;
    }

    public void setSortableAttributes(List<String> sortableAttributes) {
        this.sortableAttributes = sortableAttributes;
    }

    public TypoTolerance getTypoTolerance() {
        return typoTolerance;
    }

    public void setTypoTolerance(TypoTolerance typoTolerance) {
        this.typoTolerance = typoTolerance;
    }

    public Faceting getFaceting() {
        return faceting;
    }

    public void setFaceting(Faceting faceting) {
        this.faceting = faceting;
    }

    public Pagination getPagination() {
        return pagination;
    }

    public void setPagination(Pagination pagination) {
        this.pagination = pagination;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Settings settings = (Settings) o;
        return Objects.equals(rankingRules, settings.rankingRules)
            && Objects.equals(distinctAttribute, settings.distinctAttribute)
            && Objects.equals(searchableAttributes, settings.searchableAttributes)
            && Objects.equals(displayedAttributes, settings.displayedAttributes)
            && Objects.equals(stopWords, settings.stopWords)
            && Objects.equals(synonyms, settings.synonyms)
            && Objects.equals(filterableAttributes, settings.filterableAttributes)
            && Objects.equals(sortableAttributes, settings.sortableAttributes)
            && Objects.equals(typoTolerance, settings.typoTolerance)
            && Objects.equals(faceting, settings.faceting)
            && Objects.equals(pagination, settings.pagination);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            rankingRules,
            distinctAttribute,
            searchableAttributes,
            displayedAttributes,
            stopWords,
            synonyms,
            filterableAttributes,
            sortableAttributes,
            typoTolerance,
            faceting,
            pagination
        );
    }
}
