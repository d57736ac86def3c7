/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.meilisearch.InvalidKeyException;
import org.meilisearch.InvalidRestrictionException;
import org.meilisearch.KeyNotFoundException;
import org.meilisearch.client.keys.Key;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.util.Base64;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds tenant tokens: JWTs signed with HS256 using the value of a search API key.
 * <p>
 * The claims hold the {@code searchRules}, the {@code apiKeyUid} of the signing key and, when the token expires,
 * {@code exp} in seconds since the epoch. Every index named in the search rules must be searchable with the key, a
 * {@code *} rule applies to whatever the key allows.
 */
final class TenantTokenGenerator {

    static final String DEFAULT_SEARCH_KEY_DESCRIPTION = "Default Search API Key";
    static final String ALL_INDEXES = "*";

    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final Map<String, String> HEADER;

    static {
        Map<String, String> header = new LinkedHashMap<>();
        header.put("alg", "HS256");
        header.put("typ", "JWT");
        HEADER = Collections.unmodifiableMap(header);
    }

    private TenantTokenGenerator() {}

    /**
     * Returns the first key whose description names it the default search key.
     *
     * @throws KeyNotFoundException if there is no such key
     */
    static Key findDefaultSearchKey(List<Key> keys) {
        if (keys != null) {
            for (Key key : keys) {
                if (key.getDescription() != null && key.getDescription().contains(DEFAULT_SEARCH_KEY_DESCRIPTION)) {
                    return key;
                }
            }
        }
        throw new KeyNotFoundException("No API search key found");
    }

    /**
     * Generates the token.
     *
     * @param checkActions whether the key must be checked to only allow searching, which is the case of keys picked by the caller
     */
    static String generate(Map<String, ?> searchRules, Instant expiresAt, Key key, boolean checkActions) throws JsonProcessingException {
        if (searchRules == null) {
            throw new IllegalArgumentException("searchRules must not be null");
        }
        if (key == null || key.getKey() == null) {
            throw new KeyNotFoundException("No API search key found");
        }
        if (checkActions && Collections.singletonList("search").equals(key.getActions()) == false) {
            throw new InvalidKeyException("Only search keys can be used for tokens, key [" + key.getUid() + "] allows " + key.getActions());
        }
        List<String> keyIndexes = key.getIndexes() == null ? Collections.emptyList() : key.getIndexes();
        if (keyIndexes.contains(ALL_INDEXES) == false) {
            for (String index : searchRules.keySet()) {
                if (ALL_INDEXES.equals(index) == false && keyIndexes.contains(index) == false) {
                    throw new InvalidRestrictionException(
                        "Invalid index [" + index + "]. The token cannot be less restrictive than the API key " + keyIndexes
                    );
                }
            }
        }
        if (expiresAt != null && expiresAt.isAfter(Instant.now()) == false) {
            throw new IllegalArgumentException("expiresAt must be in the future but was [" + expiresAt + "]");
        }

        Map<String, Object> claims = new LinkedHashMap<>();
        claims.put("searchRules", searchRules);
        if (key.getUid() != null) {
            claims.put("apiKeyUid", key.getUid());
        }
        if (expiresAt != null) {
            claims.put("exp", expiresAt.getEpochSecond());
        }

        String data = base64Url(DefaultObjectMapper.writeValueAsBytes(HEADER)) + "." + base64Url(DefaultObjectMapper.writeValueAsBytes(claims));
        return data + "." + base64Url(hmacSha256(data, key.getKey()));
    }

    private static byte[] hmacSha256(String data, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("unable to sign tenant token with " + HMAC_ALGORITHM, e);
        }
    }

    private static String base64Url(byte[] bytes) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }
}
