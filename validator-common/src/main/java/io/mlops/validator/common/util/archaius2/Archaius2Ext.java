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

package io.mlops.validator.common.util.archaius2;

import java.util.Collections;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.netflix.archaius.ConfigProxyFactory;
import com.netflix.archaius.DefaultPropertyFactory;
import com.netflix.archaius.api.Config;
import com.netflix.archaius.config.MapConfig;

/**
 * Builds Archaius configuration proxies outside of the injector, for tests and for components created by hand.
 */
public final class Archaius2Ext {

    private static final Config EMPTY_CONFIG = new MapConfig(Collections.emptyMap());

    private Archaius2Ext() {
    }

    /**
     * Returns a configuration proxy with the interface defaults. The key/value pairs override them, and must use
     * the full property names, including the prefix of the configuration interface.
     */
    public static <C> C newConfiguration(Class<C> configType, String... keyValuePairs) {
        Preconditions.checkArgument(keyValuePairs.length % 2 == 0, "Expected key/value pairs, got %s values", keyValuePairs.length);
        if (keyValuePairs.length == 0) {
            return newConfiguration(configType, EMPTY_CONFIG);
        }
        ImmutableMap.Builder<String, String> properties = ImmutableMap.builder();
        for (int i = 0; i < keyValuePairs.length; i += 2) {
            properties.put(keyValuePairs[i], keyValuePairs[i + 1]);
        }
        return newConfiguration(configType, properties.build());
    }

    public static <C> C newConfiguration(Class<C> configType, Map<String, String> properties) {
        return newConfiguration(configType, new MapConfig(properties));
    }

    public static <C> C newConfiguration(Class<C> configType, Config config) {
        return new ConfigProxyFactory(config, config.getDecoder(), DefaultPropertyFactory.from(config)).newProxy(configType);
    }
}
