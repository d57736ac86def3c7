/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.settings;

import java.util.List;
import java.util.Objects;

public class TypoTolerance {

    private Boolean enabled;
    private MinWordSizeForTypos minWordSizeForTypos;
    private List<String> disableOnWords;
    private List<String> disableOnAttributes;

    public Boolean getEnabled() {
        return enabled;
    }

    public void setEnabled(Boolean enabled) {
        this.enabled = enabled;
    }

    public MinWordSizeForTypos getMinWordSizeForTypos() {
        return minWordSizeForTypos;
    }

    public void setMinWordSizeForTypos(MinWordSizeForTypos minWordSizeForTypos) {
        this.minWordSizeForTypos = minWordSizeForTypos;
    }

    public List<String> getDisableOnWords() {
        return disableOnWords;
    }

    public void setDisableOnWords(List<String> disableOnWords) {
        this.disableOnWords = disableOnWords;
    }

    public List<String> getDisableOnAttributes() {
        return disableOnAttributes;
    }

    public void setDisableOnAttributes(List<String> disableOnAttributes) {
        this.disableOnAttributes = disableOnAttributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TypoTolerance that = (TypoTolerance) o;
        return Objects.equals(enabled, that.enabled)
            && Objects.equals(minWordSizeForTypos, that.minWordSizeForTypos)
            && Objects.equals(disableOnWords, that.disableOnWords)
            && Objects.equals(disableOnAttributes, that.disableOnAttributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabled, minWordSizeForTypos, disableOnWords, disableOnAttributes);
    }

    /**
     * The minimum word length for accepting one or two typos.
     */
    public static class MinWordSizeForTypos {

        private Integer oneTypo;
        private Integer twoTypos;

        public Integer getOneTypo() {
            return oneTypo;
        }

        public void setOneTypo(Integer oneTypo) {
            this.oneTypo = oneTypo;
        }

        public Integer getTwoTypos() {
            return twoTypos;
        }

        public void setTwoTypos(Integer twoTypos) {
            this.twoTypos = twoTypos;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            MinWordSizeForTypos that = (MinWordSizeForTypos) o;
            return Objects.equals(oneTypo, that.oneTypo) && Objects.equals(twoTypos, that.twoTypos);
        }

        @Override
        public int hashCode() {
            return Objects.hash(oneTypo, twoTypos);
        }
    }
}
