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

package io.mlops.validator.server.build;

import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Predicate;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.mlops.validator.api.build.BuildCapability;
import io.mlops.validator.api.build.BuildStrategy;
import io.mlops.validator.api.build.ClusterCapabilities;
import io.mlops.validator.server.build.s2i.S2iBuildStrategy;
import io.mlops.validator.server.build.tekton.TektonBuildStrategy;
import io.mlops.validator.server.kubernetes.ClusterApiFacade;

/**
 * Static registration entry of a build strategy: its name, the check that tells if the cluster can run it, and its
 * constructor. The registry selects strategies with the registration check.
 */
public class StrategyRegistration {

    /**
     * Registration order is the 'auto' selection preference.
     */
    public static final List<StrategyRegistration> DEFAULT_REGISTRATIONS = ImmutableList.of(
            new StrategyRegistration(S2iBuildStrategy.NAME, BuildCapability.OPENSHIFT_BUILDS, S2iBuildStrategy::new),
            new StrategyRegistration(TektonBuildStrategy.NAME, BuildCapability.TEKTON_PIPELINES, TektonBuildStrategy::new)
    );

    private final String name;
    private final String requirement;
    private final Predicate<ClusterCapabilities> detection;
    private final BiFunction<ClusterApiFacade, BuildStrategyConfiguration, BuildStrategy> constructor;

    public StrategyRegistration(String name,
                                BuildCapability requiredCapability,
                                BiFunction<ClusterApiFacade, BuildStrategyConfiguration, BuildStrategy> constructor) {
        this(name, requiredCapability.getDiscoveryResource(), c -> c.isBuildCapabilityAvailable(requiredCapability), constructor);
    }

    public StrategyRegistration(String name,
                                String requirement,
                                Predicate<ClusterCapabilities> detection,
                                BiFunction<ClusterApiFacade, BuildStrategyConfiguration, BuildStrategy> constructor) {
        this.name = name;
        this.requirement = requirement;
        this.detection = detection;
        this.constructor = constructor;
    }

    public String getName() {
        return name;
    }

    /**
     * What the cluster must offer, for error messages.
     */
    public String getRequirement() {
        return requirement;
    }

    /**
     * Must not change the cluster state.
     */
    public boolean detect(ClusterCapabilities capabilities) {
        return detection.test(capabilities);
    }

    public BuildStrategy newStrategy(ClusterApiFacade clusterApi, BuildStrategyConfiguration configuration) {
        BuildStrategy strategy = constructor.apply(clusterApi, configuration);
        Preconditions.checkState(name.equals(strategy.getName()), "Strategy registered as %s reports name %s", name, strategy.getName());
        return strategy;
    }

    @Override
    public String toString() {
        return "StrategyRegistration{" +
                "name='" + name + '\'' +
                ", requirement='" + requirement + '\'' +
                '}';
    }
}
