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

package io.mlops.validator.api.build;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

/**
 * Snapshot of the optional cluster subsystems, as found by the last API discovery.
 */
public class ClusterCapabilities {

    private static final Map<String, String> SERVING_PLATFORM_ALIASES = ImmutableMap.of(
            "ray-serve", "ray",
            "openshift-ai", "kserve"
    );

    private static final ClusterCapabilities NONE = new ClusterCapabilities(Collections.emptySet(), Collections.emptySet());

    private final Set<BuildCapability> buildCapabilities;
    private final Set<String> servingPlatforms;

    public ClusterCapabilities(Set<BuildCapability> buildCapabilities, Set<String> servingPlatforms) {
        this.buildCapabilities = buildCapabilities == null || buildCapabilities.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(buildCapabilities));
        this.servingPlatforms = servingPlatforms == null ? Collections.emptySet() : ImmutableSet.copyOf(servingPlatforms);
    }

    public static ClusterCapabilities none() {
        return NONE;
    }

    public static ClusterCapabilities of(BuildCapability... buildCapabilities) {
        return new ClusterCapabilities(ImmutableSet.copyOf(buildCapabilities), Collections.emptySet());
    }

    public boolean isBuildCapabilityAvailable(BuildCapability capability) {
        return buildCapabilities.contains(capability);
    }

    public Set<BuildCapability> getBuildCapabilities() {
        return buildCapabilities;
    }

    /**
     * Names of the model serving platforms found in the cluster (for example 'kserve').
     */
    public Set<String> getServingPlatforms() {
        return servingPlatforms;
    }

    /**
     * True if the named platform is installed. Platform names that run on top of another platform ('openshift-ai',
     * 'ray-serve') are matched against the underlying one.
     */
    public boolean isServingPlatformAvailable(String platform) {
        if (platform == null) {
            return false;
        }
        String name = platform.toLowerCase(Locale.ROOT);
        return servingPlatforms.contains(SERVING_PLATFORM_ALIASES.getOrDefault(name, name));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ClusterCapabilities that = (ClusterCapabilities) o;
        return Objects.equals(buildCapabilities, that.buildCapabilities) &&
                Objects.equals(servingPlatforms, that.servingPlatforms);
    }

    @Override
    public int hashCode() {
        return Objects.hash(buildCapabilities, servingPlatforms);
    }

    @Override
    public String toString() {
        return "ClusterCapabilities{" +
                "buildCapabilities=" + buildCapabilities +
                ", servingPlatforms=" + servingPlatforms +
                '}';
    }
}
