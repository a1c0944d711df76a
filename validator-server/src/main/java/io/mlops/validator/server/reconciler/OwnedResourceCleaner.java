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

package io.mlops.validator.server.reconciler;

import java.util.List;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.fabric8.kubernetes.api.model.Pod;
import io.mlops.validator.api.model.JobKey;
import io.mlops.validator.server.build.BuildResources;
import io.mlops.validator.server.kubernetes.ClusterApiFacade;
import io.mlops.validator.server.kubernetes.ResourceKind;
import io.mlops.validator.server.kubernetes.ResourceLabels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes every build and pod resource carrying the labels of a job.
 */
@Singleton
public class OwnedResourceCleaner {

    private static final Logger logger = LoggerFactory.getLogger(OwnedResourceCleaner.class);

    private final ClusterApiFacade clusterApi;

    @Inject
    public OwnedResourceCleaner(ClusterApiFacade clusterApi) {
        this.clusterApi = clusterApi;
    }

    /**
     * Deletes the resources of the job with the given uid.
     */
    public int cleanup(String namespace, String jobId) {
        return deleteMatching(namespace, ResourceLabels.jobSelector(jobId));
    }

    /**
     * Deletes the resources labeled with the job name. Used when the job object is already gone.
     */
    public int cleanupByOwner(JobKey key) {
        return deleteMatching(key.getNamespace(), ResourceLabels.ownerSelector(key.getName()));
    }

    private int deleteMatching(String namespace, Map<String, String> labels) {
        int count = BuildResources.deleteAll(clusterApi, ResourceKind.BUILD_KINDS, namespace, labels);
        List<Pod> pods = clusterApi.listPods(namespace, labels);
        for (Pod pod : pods) {
            clusterApi.deletePod(namespace, pod.getMetadata().getName());
            count++;
        }
        if (count > 0) {
            logger.info("Deleted {} resources in namespace {} matching {}", count, namespace, labels);
        }
        return count;
    }
}
