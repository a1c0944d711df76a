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

/**
 * Environment binding of the validation container. Secret and config map references are opaque names, resolved
 * by the cluster when the pod starts.
 */
public class EnvVariable {

    private final String name;
    private final String value;
    private final String secretName;
    private final String configMapName;
    private final String key;

    private EnvVariable(String name, String value, String secretName, String configMapName, String key) {
        this.name = name;
        this.value = value;
        this.secretName = secretName;
        this.configMapName = configMapName;
        this.key = key;
    }

    public static EnvVariable literal(String name, String value) {
        return new EnvVariable(name, value, null, null, null);
    }

    public static EnvVariable fromSecret(String name, String secretName, String key) {
        return new EnvVariable(name, null, secretName, null, key);
    }

    public static EnvVariable fromConfigMap(String name, String configMapName, String key) {
        return new EnvVariable(name, null, null, configMapName, key);
    }

    public String getName() {
        return name;
    }

    public String getValue() {
        return value;
    }

    public String getSecretName() {
        return secretName;
    }

    public String getConfigMapName() {
        return configMapName;
    }

    public String getKey() {
        return key;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EnvVariable that = (EnvVariable) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(value, that.value) &&
                Objects.equals(secretName, that.secretName) &&
                Objects.equals(configMapName, that.configMapName) &&
                Objects.equals(key, that.key);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, value, secretName, configMapName, key);
    }

    @Override
    public String toString() {
        return "EnvVariable{" +
                "name='" + name + '\'' +
                (secretName != null ? ", secretName='" + secretName + '\'' : "") +
                (configMapName != null ? ", configMapName='" + configMapName + '\'' : "") +
                '}';
    }
}
