/*
 * Copyright 2025 The Notebook Validator Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.mlops.validator.api.model;

import java.util.Objects;

public class NotebookSource {

    public static final String DEFAULT_GIT_REF = "main";

    private final String gitUrl;
    private final String gitRef;
    private final String credentialsSecret;
    private final String path;

    public NotebookSource(String gitUrl, String gitRef, String credentialsSecret, String path) {
        this.gitUrl = gitUrl;
        this.gitRef = gitRef == null || gitRef.isEmpty() ? DEFAULT_GIT_REF : gitRef;
        this.credentialsSecret = credentialsSecret;
        this.path = path;
    }

    public String getGitUrl() {
        return gitUrl;
    }

    public String getGitRef() {
        return gitRef;
    }

    /**
     * Name of the secret holding git credentials, or null for anonymous access.
     */
    public String getCredentialsSecret() {
        return credentialsSecret;
    }

    /**
     * Notebook location relative to the repository root.
     */
    public String getPath() {
        return path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        NotebookSource that = (NotebookSource) o;
        return Objects.equals(gitUrl, that.gitUrl) &&
                Objects.equals(gitRef, that.gitRef) &&
                Objects.equals(credentialsSecret, that.credentialsSecret) &&
                Objects.equals(path, that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(gitUrl, gitRef, credentialsSecret, path);
    }

    @Override
    public String toString() {
        return "NotebookSource{" +
                "gitUrl='" + gitUrl + '\'' +
                ", gitRef='" + gitRef + '\'' +
                ", path='" + path + '\'' +
                '}';
    }
}
