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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;

import io.fabric8.kubernetes.api.model.APIGroup;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.GenericKubernetesResourceList;
import io.fabric8.kubernetes.api.model.GroupVersionForDiscovery;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.NamespacedKubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import io.fabric8.kubernetes.client.informers.ResourceEventHandler;
import io.fabric8.kubernetes.client.informers.SharedIndexInformer;
import io.mlops.validator.api.model.JobKey;
import io.mlops.validator.api.model.ValidationJob;
import io.mlops.validator.common.util.StringExt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import static io.mlops.validator.server.kubernetes.ResourceLabels.LABEL_JOB_ID;
import static io.mlops.validator.server.kubernetes.ResourceLabels.LABEL_OWNER;

@Singleton
public class Fabric8ClusterApiFacade implements ClusterApiFacade {

    private static final Logger logger = LoggerFactory.getLogger(Fabric8ClusterApiFacade.class);

    private final NamespacedKubernetesClient kubernetesClient;

    @Inject
    public Fabric8ClusterApiFacade(NamespacedKubernetesClient kubernetesClient) {
        this.kubernetesClient = kubernetesClient;
    }

    @Override
    public Optional<ValidationJob> findValidationJob(JobKey key) {
        return execute("get job " + key, () -> {
            GenericKubernetesResource resource = jobs().inNamespace(key.getNamespace()).withName(key.getName()).get();
            return Optional.ofNullable(resource).map(ValidationJobCodec::decode);
        });
    }

    @Override
    public List<ValidationJob> listValidationJobs() {
        return execute("list jobs", () -> jobs().inAnyNamespace().list().getItems().stream()
                .map(ValidationJobCodec::decode)
                .collect(Collectors.toList())
        );
    }

    @Override
    public ValidationJob updateValidationJobStatus(ValidationJob job) {
        return execute("update status of job " + job.getKey(), () -> {
            Resource<GenericKubernetesResource> jobResource = jobs().inNamespace(job.getNamespace()).withName(job.getName());
            GenericKubernetesResource current = jobResource.get();
            if (current == null) {
                throw new KubeApiException("Job not found: " + job.getKey(), KubeApiException.ErrorCode.NOT_FOUND);
            }
            current.setAdditionalProperty("status", ValidationJobCodec.encodeStatus(job.getStatus()));
            return ValidationJobCodec.decode(jobResource.updateStatus(current));
        });
    }

    @Override
    public ValidationJob addFinalizer(JobKey key, String finalizer) {
        return execute("add finalizer to job " + key, () -> {
            Resource<GenericKubernetesResource> jobResource = jobs().inNamespace(key.getNamespace()).withName(key.getName());
            GenericKubernetesResource current = jobResource.get();
            if (current == null) {
                throw new KubeApiException("Job not found: " + key, KubeApiException.ErrorCode.NOT_FOUND);
            }
            List<String> finalizers = current.getMetadata().getFinalizers() == null
                    ? new ArrayList<>()
                    : new ArrayList<>(current.getMetadata().getFinalizers());
            if (finalizers.contains(finalizer)) {
                return ValidationJobCodec.decode(current);
            }
            finalizers.add(finalizer);
            current.getMetadata().setFinalizers(finalizers);
            return ValidationJobCodec.decode(jobResource.replace(current));
        });
    }

    @Override
    public void removeFinalizer(JobKey key, String finalizer) {
        execute("remove finalizer from job " + key, () -> {
            Resource<GenericKubernetesResource> jobResource = jobs().inNamespace(key.getNamespace()).withName(key.getName());
            GenericKubernetesResource current = jobResource.get();
            if (current == null || current.getMetadata().getFinalizers() == null
                    || !current.getMetadata().getFinalizers().contains(finalizer)) {
                return null;
            }
            List<String> finalizers = new ArrayList<>(current.getMetadata().getFinalizers());
            finalizers.remove(finalizer);
            current.getMetadata().setFinalizers(finalizers);
            jobResource.replace(current);
            return null;
        });
    }

    @Override
    public Pod createPod(Pod pod) {
        return execute("create pod " + pod.getMetadata().getName(),
                () -> kubernetesClient.pods().inNamespace(pod.getMetadata().getNamespace()).create(pod)
        );
    }

    @Override
    public List<Pod> listPods(String namespace, Map<String, String> labels) {
        return execute("list pods " + labels,
                () -> kubernetesClient.pods().inNamespace(namespace).withLabels(labels).list().getItems()
        );
    }

    @Override
    public void deletePod(String namespace, String name) {
        execute("delete pod " + name, () -> kubernetesClient.pods().inNamespace(namespace).withName(name).delete());
    }

    @Override
    public String getPodLog(String namespace, String podName, String containerName) {
        return execute("get log of pod " + podName, () -> StringExt.nonNull(
                kubernetesClient.pods().inNamespace(namespace).withName(podName).inContainer(containerName).getLog()
        ));
    }

    @Override
    public GenericKubernetesResource createResource(ResourceKind kind, GenericKubernetesResource resource) {
        return execute("create " + kind.getKind() + ' ' + resource.getMetadata().getName(),
                () -> resources(kind).inNamespace(resource.getMetadata().getNamespace()).create(resource)
        );
    }

    @Override
    public Optional<GenericKubernetesResource> findResource(ResourceKind kind, String namespace, String name) {
        return execute("get " + kind.getKind() + ' ' + name,
                () -> Optional.ofNullable(resources(kind).inNamespace(namespace).withName(name).get())
        );
    }

    @Override
    public List<GenericKubernetesResource> listResources(ResourceKind kind, String namespace, Map<String, String> labels) {
        try {
            return execute("list " + kind.getKind() + ' ' + labels,
                    () -> resources(kind).inNamespace(namespace).withLabels(labels).list().getItems()
            );
        } catch (KubeApiException e) {
            if (e.getErrorCode() == KubeApiException.ErrorCode.NOT_FOUND) {
                logger.debug("Resource kind {} not served by the cluster", kind.getApiVersion());
                return Collections.emptyList();
            }
            throw e;
        }
    }

    @Override
    public void deleteResource(ResourceKind kind, String namespace, String name) {
        execute("delete " + kind.getKind() + ' ' + name, () -> resources(kind).inNamespace(namespace).withName(name).delete());
    }

    @Override
    public boolean isResourceKindAvailable(ResourceKind kind) {
        return execute("discover API group " + kind.getGroup(), () -> {
            for (APIGroup group : kubernetesClient.getApiGroups().getGroups()) {
                if (kind.getGroup().equals(group.getName())) {
                    for (GroupVersionForDiscovery version : group.getVersions()) {
                        if (kind.getApiVersion().equals(version.getGroupVersion())) {
                            return true;
                        }
                    }
                }
            }
            return false;
        });
    }

    @Override
    public Flux<ValidationJobEvent> events(Duration resyncInterval) {
        return Flux.create(sink -> {
            SharedIndexInformer<GenericKubernetesResource> jobInformer = jobs().inAnyNamespace()
                    .inform(new JobEventHandler(sink), resyncInterval.toMillis());
            SharedIndexInformer<Pod> podInformer = kubernetesClient.pods().inAnyNamespace()
                    .withLabel(LABEL_JOB_ID)
                    .inform(new PodEventHandler(sink), 0);
            sink.onDispose(() -> {
                jobInformer.stop();
                podInformer.stop();
                logger.info("Job and pod informers stopped");
            });
            logger.info("Job and pod informers started: resyncInterval={}ms", resyncInterval.toMillis());
        });
    }

    private static JobKey jobKeyOf(HasMetadata resource) {
        return JobKey.of(resource.getMetadata().getNamespace(), resource.getMetadata().getName());
    }

    private MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> jobs() {
        return resources(ResourceKind.VALIDATION_JOB);
    }

    private MixedOperation<GenericKubernetesResource, GenericKubernetesResourceList, Resource<GenericKubernetesResource>> resources(ResourceKind kind) {
        return kubernetesClient.genericKubernetesResources(kind.getContext());
    }

    private static <T> T execute(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (KubernetesClientException e) {
            throw new KubeApiException(String.format("Kube API call failed [%s]: %s", operation, e.getMessage()), e);
        }
    }

    private static class JobEventHandler implements ResourceEventHandler<GenericKubernetesResource> {

        private final FluxSink<ValidationJobEvent> sink;

        private JobEventHandler(FluxSink<ValidationJobEvent> sink) {
            this.sink = sink;
        }

        @Override
        public void onAdd(GenericKubernetesResource job) {
            sink.next(ValidationJobEvent.updated(jobKeyOf(job)));
        }

        @Override
        public void onUpdate(GenericKubernetesResource oldJob, GenericKubernetesResource newJob) {
            sink.next(ValidationJobEvent.updated(jobKeyOf(newJob)));
        }

        @Override
        public void onDelete(GenericKubernetesResource job, boolean deletedFinalStateUnknown) {
            sink.next(ValidationJobEvent.deleted(jobKeyOf(job)));
        }
    }

    /**
     * Pod changes are reported as updates of the owning job. Pod deletions are not interesting, as the reconciler
     * re-discovers pods by label.
     */
    private static class PodEventHandler implements ResourceEventHandler<Pod> {

        private final FluxSink<ValidationJobEvent> sink;

        private PodEventHandler(FluxSink<ValidationJobEvent> sink) {
            this.sink = sink;
        }

        @Override
        public void onAdd(Pod pod) {
            emit(pod);
        }

        @Override
        public void onUpdate(Pod oldPod, Pod newPod) {
            emit(newPod);
        }

        @Override
        public void onDelete(Pod pod, boolean deletedFinalStateUnknown) {
            logger.debug("Validation pod deleted: {}/{}", pod.getMetadata().getNamespace(), pod.getMetadata().getName());
        }

        private void emit(Pod pod) {
            Map<String, String> labels = pod.getMetadata().getLabels();
            String owner = labels == null ? null : labels.get(LABEL_OWNER);
            if (StringExt.isNotEmpty(owner)) {
                sink.next(ValidationJobEvent.updated(JobKey.of(pod.getMetadata().getNamespace(), owner)));
            }
        }
    }
}
