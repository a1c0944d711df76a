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

package io.mlops.validator.server;

import javax.inject.Singleton;

import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.netflix.archaius.ConfigProxyFactory;
import com.netflix.spectator.api.DefaultRegistry;
import com.netflix.spectator.api.Registry;
import io.fabric8.kubernetes.client.NamespacedKubernetesClient;
import io.mlops.validator.common.runtime.ValidatorRuntime;
import io.mlops.validator.common.runtime.ValidatorRuntimes;
import io.mlops.validator.server.build.BuildStrategyConfiguration;
import io.mlops.validator.server.build.BuildStrategyRegistry;
import io.mlops.validator.server.build.StrategyRegistration;
import io.mlops.validator.server.controller.DefaultJobWorkQueue;
import io.mlops.validator.server.controller.JobWorkQueue;
import io.mlops.validator.server.controller.ValidationJobController;
import io.mlops.validator.server.controller.ValidatorControllerConfiguration;
import io.mlops.validator.server.kubernetes.ClusterApiFacade;
import io.mlops.validator.server.kubernetes.Fabric8ClusterApiFacade;
import io.mlops.validator.server.kubernetes.Fabric8IOClients;
import io.mlops.validator.server.metrics.SpectatorValidatorMetrics;
import io.mlops.validator.server.metrics.ValidatorMetrics;
import io.mlops.validator.server.reconciler.ValidationJobReconciler;

public class ValidatorModule extends AbstractModule {

    @Override
    protected void configure() {
        bind(Registry.class).toInstance(new DefaultRegistry());
        bind(ClusterApiFacade.class).to(Fabric8ClusterApiFacade.class);
        bind(ValidatorMetrics.class).to(SpectatorValidatorMetrics.class);
        bind(ValidationJobController.class).asEagerSingleton();
    }

    @Provides
    @Singleton
    public ValidatorControllerConfiguration getValidatorControllerConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(ValidatorControllerConfiguration.class);
    }

    @Provides
    @Singleton
    public BuildStrategyConfiguration getBuildStrategyConfiguration(ConfigProxyFactory factory) {
        return factory.newProxy(BuildStrategyConfiguration.class);
    }

    @Provides
    @Singleton
    public ValidatorRuntime getValidatorRuntime(Registry registry) {
        return ValidatorRuntimes.internal(registry);
    }

    @Provides
    @Singleton
    public NamespacedKubernetesClient getFabric8IOClient() {
        return Fabric8IOClients.mustHaveKubeConnectivity(Fabric8IOClients.createFabric8IOClient());
    }

    @Provides
    @Singleton
    public BuildStrategyRegistry getBuildStrategyRegistry(ClusterApiFacade clusterApi, BuildStrategyConfiguration configuration) {
        return BuildStrategyRegistry.fromRegistrations(StrategyRegistration.DEFAULT_REGISTRATIONS, clusterApi, configuration);
    }

    @Provides
    @Singleton
    public JobWorkQueue getJobWorkQueue(ValidationJobReconciler reconciler,
                                        ValidatorControllerConfiguration configuration,
                                        ValidatorRuntime runtime) {
        return new DefaultJobWorkQueue(reconciler::reconcile, configuration, runtime);
    }
}
