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

import com.google.common.base.Preconditions;

/**
 * Namespace qualified name of a validation job. This is the work queue key, so the reconciler never handles two
 * events for the same key at the same time.
 */
public final class JobKey {

    private final String namespace;
    private final String name;

    private JobKey(String namespace, String name) {
        this.namespace = Preconditions.checkNotNull(namespace, "namespace is null");
        this.name = Preconditions.checkNotNull(name, "name is null");
    }

    public static JobKey of(String namespace, String name) {
        return new JobKey(namespace, name);
    }

    public String getNamespace() {
        return namespace;
    }

    public String getName() {
        return name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        JobKey jobKey = (JobKey) o;
        return namespace.equals(jobKey.namespace) && name.equals(jobKey.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + '/' + name;
    }
}
