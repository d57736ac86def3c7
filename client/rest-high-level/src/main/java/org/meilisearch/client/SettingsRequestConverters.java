/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import org.apache.hc.client5.http.classic.methods.HttpDelete;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.classic.methods.HttpPatch;
import org.meilisearch.client.settings.Setting;
import org.meilisearch.client.settings.Settings;

import java.io.IOException;

final class SettingsRequestConverters {

    private SettingsRequestConverters() {}

    static Request getSettings(String uid) {
        return new Request(HttpGet.METHOD_NAME, settingsEndpoint(uid).build());
    }

    static Request updateSettings(String uid, Settings settings) throws IOException {
        Request request = new Request(HttpPatch.METHOD_NAME, settingsEndpoint(uid).build());
        request.setJsonBody(RequestConverters.toJson(settings));
        return request;
    }

    static Request resetSettings(String uid) {
        return new Request(HttpDelete.METHOD_NAME, settingsEndpoint(uid).build());
    }

    static Request getSetting(String uid, Setting<?> setting) {
        return new Request(HttpGet.METHOD_NAME, settingsEndpoint(uid).addPathPartAsIs(setting.path()).build());
    }

    static <T> Request updateSetting(String uid, Setting<T> setting, T value) throws IOException {
        Request request = new Request(setting.updateMethod(), settingsEndpoint(uid).addPathPartAsIs(setting.path()).build());
        request.setJsonBody(RequestConverters.toJson(value));
        return request;
    }

    static Request resetSetting(String uid, Setting<?> setting) {
        return new Request(HttpDelete.METHOD_NAME, settingsEndpoint(uid).addPathPartAsIs(setting.path()).build());
    }

    private static RequestConverters.EndpointBuilder settingsEndpoint(String uid) {
        return new RequestConverters.EndpointBuilder().addPathPartAsIs("indexes").addPathPart(uid).addPathPartAsIs("settings");
    }
}
