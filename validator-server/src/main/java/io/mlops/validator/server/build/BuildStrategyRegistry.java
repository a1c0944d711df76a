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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import io.mlops.validator.api.build.BuildStrategy;
import io.mlops.validator.api.build.ClusterCapabilities;
import io.mlops.validator.api.model.BuildConfig;
import io.mlops.validator.api.service.ValidatorException;
import io.mlops.validator.server.kubernetes.ClusterApiFacade;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Closed set of build strategies, in registration order. The order decides which strategy wins an 'auto' selection.
 */
public class BuildStrategyRegistry {

    private static final Logger logger = LoggerFactory.getLogger(BuildStrategyRegistry.class);

    private final List<Entry> entries;

    /**
     * Registry whose strategies detect cluster support themselves.
     */
    public BuildStrategyRegistry(List<BuildStrategy> strategies) {
        this(selfDetecting(strategies));
    }

    private BuildStrategyRegistry(Collection<Entry> entries) {
        Preconditions.checkArgument(!entries.isEmpty(), "At least one build strategy must be registered");
        long distinct = entries.stream().map(e -> e.strategy.getName()).distinct().count();
        Preconditions.checkArgument(distinct == entries.size(), "Duplicate build strategy names: %s", getNames(entries));
        this.entries = ImmutableList.copyOf(entries);
    }

    public static BuildStrategyRegistry fromRegistrations(List<StrategyRegistration> registrations,
                                                          ClusterApiFacade clusterApi,
                                                          BuildStrategyConfiguration configuration) {
        List<Entry> entries = new ArrayList<>();
        for (StrategyRegistration registration : registrations) {
            entries.add(new Entry(registration.newStrategy(clusterApi, configuration), registration.getRequirement(), registration::detect));
        }
        logger.info("Registered build strategies: {}", registrations);
        return new BuildStrategyRegistry(entries);
    }

    public List<String> getStrategyNames() {
        return getNames(entries);
    }

    public Optional<BuildStrategy> findStrategy(String name) {
        return findEntry(name).map(e -> e.strategy);
    }

    /**
     * Returns the strategy with the given name, which must be registered.
     *
     * @throws ValidatorException with {@link ValidatorException.ErrorCategory#ConfigurationError} if not found
     */
    public BuildStrategy getStrategy(String name) {
        return findStrategy(name).orElseThrow(() -> ValidatorException.strategyNotFound(name, getStrategyNames()));
    }

    /**
     * Selects the strategy for a build configuration. A pinned strategy must be registered and detected in the
     * cluster. For 'auto' the first strategy detected in registration order is chosen. The selected strategy
     * validates the configuration before it is returned.
     */
    public BuildStrategy resolve(BuildConfig config, ClusterCapabilities capabilities) {
        BuildStrategy selected;
        if (config.isAutoStrategy()) {
            selected = autoSelect(capabilities);
        } else {
            Entry entry = findEntry(config.getStrategy())
                    .orElseThrow(() -> ValidatorException.strategyNotFound(config.getStrategy(), getStrategyNames()));
            if (!entry.detection.test(capabilities)) {
                throw ValidatorException.strategyUnavailable(entry.strategy.getName(), entry.requirement);
            }
            selected = entry.strategy;
        }
        selected.validate(config);
        return selected;
    }

    private BuildStrategy autoSelect(ClusterCapabilities capabilities) {
        List<String> checks = new ArrayList<>();
        for (Entry entry : entries) {
            if (entry.detection.test(capabilities)) {
                logger.debug("Auto selected build strategy {}", entry.strategy.getName());
                return entry.strategy;
            }
            checks.add(entry.strategy.getName() + ": " + entry.requirement);
        }
        throw ValidatorException.noStrategyAvailable(checks);
    }

    private static List<Entry> selfDetecting(List<BuildStrategy> strategies) {
        List<Entry> entries = new ArrayList<>();
        for (BuildStrategy strategy : strategies) {
            entries.add(new Entry(strategy, strategy.getCapabilityDescription(), strategy::detect));
        }
        return entries;
    }

    private Optional<Entry> findEntry(String name) {
        return entries.stream().filter(e -> e.strategy.getName().equalsIgnoreCase(name)).findFirst();
    }

    private static List<String> getNames(Collection<Entry> entries) {
        return entries.stream().map(e -> e.strategy.getName()).collect(Collectors.toList());
    }

    private static class Entry {

        private final BuildStrategy strategy;
        private final String requirement;
        private final Predicate<ClusterCapabilities> detection;

        private Entry(BuildStrategy strategy, String requirement, Predicate<ClusterCapabilities> detection) {
            this.strategy = strategy;
            this.requirement = requirement;
            this.detection = detection;
        }
    }
}
