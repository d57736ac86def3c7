/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.settings;

import com.fasterxml.jackson.core.type.TypeReference;
import org.apache.hc.client5.http.classic.methods.HttpPatch;
import org.apache.hc.client5.http.classic.methods.HttpPut;

import java.util.List;
import java.util.Map;

/**
 * A single index setting that can be read, updated and reset on its own, under
 * {@code /indexes/{uid}/settings/{path}}. List and scalar settings are replaced as a whole with {@code PUT}, object
 * settings are merged with {@code PATCH}.
 *
 * @param <T> the type of the setting value
 */
public final class Setting<T> {

    public static final Setting<List<String>> RANKING_RULES = new Setting<>("ranking-rules", HttpPut.METHOD_NAME,
        new TypeReference<List<String>>() {});
    public static final Setting<String> DISTINCT_ATTRIBUTE = new Setting<>("distinct-attribute", HttpPut.METHOD_NAME,
        new TypeReference<String>() {});
    public static final Setting<List<String>> SEARCHABLE_ATTRIBUTES = new Setting<>("searchable-attributes", HttpPut.METHOD_NAME,
        new TypeReference<List<String>>() {});
    public static final Setting<List<String>> DISPLAYED_ATTRIBUTES = new Setting<>("displayed-attributes", HttpPut.METHOD_NAME,
        new TypeReference<List<String>>() {});
    public static final Setting<List<String>> STOP_WORDS = new Setting<>("stop-words", HttpPut.METHOD_NAME,
        new TypeReference<List<String>>() {});
    public static final Setting<Map<String, List<String>>> SYNONYMS = new Setting<>("synonyms", HttpPut.METHOD_NAME,
        new TypeReference<Map<String, List<String>>>() {});
    public static final Setting<List<String>> FILTERABLE_ATTRIBUTES = new Setting<>("filterable-attributes", HttpPut.METHOD_NAME,
        new TypeReference<List<String>>() {});
    public static final Setting<List<String>> SORTABLE_ATTRIBUTES = new Setting<>("sortable-attributes", HttpPut.METHOD_NAME,
        new TypeReference<List<String>>() {});
    public static final Setting<TypoTolerance> TYPO_TOLERANCE = new Setting<>("typo-tolerance", HttpPatch.METHOD_NAME,
        new TypeReference<TypoTolerance>() {});
    public static final Setting<Faceting> FACETING = new Setting<>("faceting", HttpPatch.METHOD_NAME,
        new TypeReference<Faceting>() {});
    public static final Setting<Pagination> PAGINATION = new Setting<>("pagination", HttpPatch.METHOD_NAME,
        new TypeReference<Pagination>() {});

    private final String path;
    private final String updateMethod;
    private final TypeReference<T> valueType;

    private Setting(String path, String updateMethod, TypeReference<T> valueType) {
        this.path = path;
        this.updateMethod = updateMethod;
        this.valueType = valueType;
    }

    /**
     * The last path part of the setting endpoint
     */
    public String path() {
        return path;
    }

    public String updateMethod() {
        return updateMethod;
    }

    public TypeReference<T> valueType() {
        return valueType;
    }

    @Override
    public String toString() {
        return path;
    }
}
