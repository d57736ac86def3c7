/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.meilisearch.client.settings.Setting;
import org.meilisearch.client.settings.Settings;
import org.meilisearch.client.tasks.TaskInfo;

import java.io.IOException;

import static java.util.Collections.emptySet;

/**
 * A wrapper for the {@link MeilisearchClient} that provides methods for accessing the settings of one index, either all
 * at once through {@link Settings} or one at a time through a {@link Setting}.
 * <p>
 * Updates and resets are processed in the background and return the {@link TaskInfo} of the enqueued task.
 */
public final class SettingsClient {

    private final MeilisearchClient meilisearchClient;
    private final String uid;

    SettingsClient(MeilisearchClient meilisearchClient, String uid) {
        this.meilisearchClient = meilisearchClient;
        this.uid = uid;
    }

    /**
     * Gets all the settings of the index.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public Settings getSettings() throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> SettingsRequestConverters.getSettings(uid),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(Settings.class),
            emptySet()
        );
    }

    public Cancellable getSettingsAsync(ActionListener<Settings> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> SettingsRequestConverters.getSettings(uid),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(Settings.class),
            listener,
            emptySet()
        );
    }

    /**
     * Updates the settings of the index. Only the non {@code null} fields of {@code settings} are sent, the other
     * settings are left unchanged.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public TaskInfo updateSettings(Settings settings) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> SettingsRequestConverters.updateSettings(uid, settings),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            emptySet()
        );
    }

    public Cancellable updateSettingsAsync(Settings settings, ActionListener<TaskInfo> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> SettingsRequestConverters.updateSettings(uid, settings),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            listener,
            emptySet()
        );
    }

    /**
     * Resets every setting of the index to its default value.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public TaskInfo resetSettings() throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> SettingsRequestConverters.resetSettings(uid),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            emptySet()
        );
    }

    public Cancellable resetSettingsAsync(ActionListener<TaskInfo> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> SettingsRequestConverters.resetSettings(uid),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            listener,
            emptySet()
        );
    }

    /**
     * Gets a single setting, for example {@code get(Setting.RANKING_RULES)}.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public <T> T get(Setting<T> setting) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> SettingsRequestConverters.getSetting(uid, setting),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(setting.valueType()),
            emptySet()
        );
    }

    public <T> Cancellable getAsync(Setting<T> setting, ActionListener<T> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> SettingsRequestConverters.getSetting(uid, setting),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(setting.valueType()),
            listener,
            emptySet()
        );
    }

    /**
     * Updates a single setting. List settings are replaced, object settings like {@link Setting#TYPO_TOLERANCE} are
     * merged with the current value.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public <T> TaskInfo update(Setting<T> setting, T value) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> SettingsRequestConverters.updateSetting(uid, setting, value),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            emptySet()
        );
    }

    public <T> Cancellable updateAsync(Setting<T> setting, T value, ActionListener<TaskInfo> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> SettingsRequestConverters.updateSetting(uid, setting, value),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            listener,
            emptySet()
        );
    }

    /**
     * Resets a single setting to its default value.
     *
     * @throws IOException in case there is a problem sending the request or parsing back the response
     */
    public TaskInfo reset(Setting<?> setting) throws IOException {
        return meilisearchClient.performRequestAndParseEntity(
            Validatable.EMPTY,
            request -> SettingsRequestConverters.resetSetting(uid, setting),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            emptySet()
        );
    }

    public Cancellable resetAsync(Setting<?> setting, ActionListener<TaskInfo> listener) {
        return meilisearchClient.performRequestAsyncAndParseEntity(
            Validatable.EMPTY,
            request -> SettingsRequestConverters.resetSetting(uid, setting),
            RequestOptions.DEFAULT,
            MeilisearchClient.parser(TaskInfo.class),
            listener,
            emptySet()
        );
    }
}
