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

package io.mlops.validator.server.kubernetes;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.ConfigBuilder;
import io.fabric8.kubernetes.client.DefaultKubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.NamespacedKubernetesClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Fabric8IOClients {

    private static final Logger logger = LoggerFactory.getLogger(Fabric8IOClients.class);

    static final String USER_AGENT = "notebook-validator-controller";

    private Fabric8IOClients() {
    }

    /**
     * Client configured from the in-cluster service account, or from KUBECONFIG when running outside of the cluster.
     */
    public static NamespacedKubernetesClient createFabric8IOClient() {
        Config config = new ConfigBuilder(Config.autoConfigure(null))
                .withUserAgent(USER_AGENT)
                .build();
        return new DefaultKubernetesClient(config);
    }

    /**
     * The controller cannot do anything without the API server, so a failed discovery call stops the startup.
     */
    public static NamespacedKubernetesClient mustHaveKubeConnectivity(NamespacedKubernetesClient fabric8IOClient) {
        try {
            int groups = fabric8IOClient.getApiGroups().getGroups().size();
            logger.info("Connected to the API server at {} ({} API groups)", fabric8IOClient.getMasterUrl(), groups);
        } catch (KubernetesClientException e) {
            throw new IllegalStateException("Cannot reach the API server at " + fabric8IOClient.getMasterUrl(), e);
        }
        return fabric8IOClient;
    }
}
