/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The Meilisearch Java client contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 */

package org.meilisearch.client.core;

import java.util.Objects;

public class Version {

    private String commitSha;
    private String commitDate;
    private String pkgVersion;

    public String getCommitSha() {
        return commitSha;
    }

    public void setCommitSha(String commitSha) {
        this.commitSha = commitSha;
    }

    /**
     * The commit date as reported by the server. Development builds report {@code unknown}, so this is kept as a string.
     */
    public String getCommitDate() {
        return commitDate;
    }

    public void setCommitDate(String commitDate) {
        this.commitDate = commitDate;
    }

    public String getPkgVersion() {
        return pkgVersion;
    }

    public void setPkgVersion(String pkgVersion) {
        this.pkgVersion = pkgVersion;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Version version = (Version) o;
        return Objects.equals(commitSha, version.commitSha)
            && Objects.equals(commitDate, version.commitDate)
            && Objects.equals(pkgVersion, version.pkgVersion);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commitSha, commitDate, pkgVersion);
    }

    @Override
    public String toString() {
        return "Version{commitSha='" + commitSha + "', commitDate='" + commitDate + "', pkgVersion='" + pkgVersion + "'}";
    }
}
