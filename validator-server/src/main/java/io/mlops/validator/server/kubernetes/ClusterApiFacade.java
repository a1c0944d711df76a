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

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.Pod;
import io.mlops.validator.api.model.JobKey;
import io.mlops.validator.api.model.ValidationJob;
import reactor.core.publisher.Flux;

/**
 * Cluster object store access used by the controller. All methods are blocking, and report failures as
 * {@link KubeApiException}. Delete operations treat a missing object as success.
 */
public interface ClusterApiFacade {

    Optional<ValidationJob> findValidationJob(JobKey key);

    List<ValidationJob> listValidationJobs();

    /**
     * Writes the job status through the status subresource. The spec part of the argument is ignored.
     */
    ValidationJob updateValidationJobStatus(ValidationJob job);

    /**
     * Adds the finalizer to the job, if not present yet, and returns the updated job.
     */
    ValidationJob addFinalizer(JobKey key, String finalizer);

    /**
     * Removes the finalizer from the job. A job that is already gone is not an error.
     */
    void removeFinalizer(JobKey key, String finalizer);

    Pod createPod(Pod pod);

    List<Pod> listPods(String namespace, Map<String, String> labels);

    void deletePod(String namespace, String name);

    /**
     * Returns the log of a pod container, or an empty string if the container produced none.
     */
    String getPodLog(String namespace, String podName, String containerName);

    GenericKubernetesResource createResource(ResourceKind kind, GenericKubernetesResource resource);

    Optional<GenericKubernetesResource> findResource(ResourceKind kind, String namespace, String name);

    /**
     * Lists resources of the given kind matching all labels. A kind not installed in the cluster has no resources.
     */
    List<GenericKubernetesResource> listResources(ResourceKind kind, String namespace, Map<String, String> labels);

    void deleteResource(ResourceKind kind, String namespace, String name);

    /**
     * Returns true if the API group and version of the kind are served by the cluster.
     */
    boolean isResourceKindAvailable(ResourceKind kind);

    /**
     * Emits job changes, deletions and changes of the pods owned by jobs. Every job is re-emitted at the resync
     * interval.
     */
    Flux<ValidationJobEvent> events(Duration resyncInterval);
}
