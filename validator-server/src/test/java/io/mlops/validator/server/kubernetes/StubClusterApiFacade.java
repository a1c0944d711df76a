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
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.Pod;
import io.fabric8.kubernetes.api.model.PodBuilder;
import io.fabric8.kubernetes.api.model.PodStatus;
import io.mlops.validator.api.model.JobKey;
import io.mlops.validator.api.model.ValidationJob;
import io.mlops.validator.api.model.ValidationJobSpec;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * In-memory cluster. Objects are stored as given, and only change when a test says so.
 */
public class StubClusterApiFacade implements ClusterApiFacade {

    private final Map<JobKey, ValidationJob> jobs = new LinkedHashMap<>();
    private final Map<ResourceKind, Map<String, GenericKubernetesResource>> resources = new EnumMap<>(ResourceKind.class);
    private final Map<String, Pod> pods = new LinkedHashMap<>();
    private final Map<String, String> podLogs = new LinkedHashMap<>();
    private final Set<ResourceKind> availableKinds = EnumSet.noneOf(ResourceKind.class);

    private final Map<ResourceKind, Integer> createCounts = new EnumMap<>(ResourceKind.class);
    private int podCreateCount;
    private int statusUpdateCount;
    private long resourceVersion;

    private final Queue<KubeApiException> statusUpdateFailures = new LinkedList<>();
    private final Queue<KubeApiException> createFailures = new LinkedList<>();
    private KubeApiException discoveryFailure;

    private final Sinks.Many<ValidationJobEvent> eventSink = Sinks.many().multicast().onBackpressureBuffer();

    /*
     * Test setup and inspection.
     */

    public synchronized StubClusterApiFacade withAvailableKinds(ResourceKind... kinds) {
        Collections.addAll(availableKinds, kinds);
        return this;
    }

    public synchronized void addJob(ValidationJob job) {
        jobs.put(job.getKey(), job.toBuilder().withResourceVersion(Long.toString(++resourceVersion)).build());
    }

    /**
     * Replaces the job spec and bumps its generation, as the API server does on a spec change.
     */
    public synchronized void updateJobSpec(JobKey key, ValidationJobSpec spec) {
        ValidationJob job = getJob(key);
        jobs.put(key, job.toBuilder()
                .withSpec(spec)
                .withGeneration(job.getGeneration() + 1)
                .withResourceVersion(Long.toString(++resourceVersion))
                .build()
        );
    }

    /**
     * Marks the job for deletion. The job is removed once its last finalizer is gone.
     */
    public synchronized void requestJobDeletion(JobKey key) {
        ValidationJob job = getJob(key);
        if (job.getFinalizers().isEmpty()) {
            jobs.remove(key);
        } else {
            jobs.put(key, job.toBuilder().withDeletionRequested(true).build());
        }
    }

    public synchronized ValidationJob getJob(JobKey key) {
        ValidationJob job = jobs.get(key);
        if (job == null) {
            throw new IllegalStateException("Job not found: " + key);
        }
        return job;
    }

    public synchronized boolean hasJob(JobKey key) {
        return jobs.containsKey(key);
    }

    public synchronized List<GenericKubernetesResource> getResources(ResourceKind kind) {
        return new ArrayList<>(resources.getOrDefault(kind, Collections.emptyMap()).values());
    }

    public synchronized Optional<GenericKubernetesResource> getResource(ResourceKind kind, String namespace, String name) {
        return Optional.ofNullable(resources.getOrDefault(kind, Collections.emptyMap()).get(key(namespace, name)));
    }

    public synchronized void addResource(ResourceKind kind, GenericKubernetesResource resource) {
        resources.computeIfAbsent(kind, k -> new LinkedHashMap<>()).put(key(resource), resource);
    }

    public synchronized void setResourceStatus(ResourceKind kind, String namespace, String name, ObjectNode status) {
        GenericKubernetesResource resource = getResource(kind, namespace, name)
                .orElseThrow(() -> new IllegalStateException(kind + " not found: " + namespace + '/' + name));
        GenericResources.setStatus(resource, status);
    }

    public synchronized int getCreateCount(ResourceKind kind) {
        return createCounts.getOrDefault(kind, 0);
    }

    public synchronized List<Pod> getPods() {
        return new ArrayList<>(pods.values());
    }

    public synchronized Optional<Pod> getPod(String namespace, String name) {
        return Optional.ofNullable(pods.get(key(namespace, name)));
    }

    public synchronized void addPod(Pod pod) {
        pods.put(key(pod), pod);
    }

    public synchronized void setPodStatus(String namespace, String name, PodStatus status) {
        Pod pod = getPod(namespace, name).orElseThrow(() -> new IllegalStateException("Pod not found: " + namespace + '/' + name));
        pods.put(key(pod), new PodBuilder(pod).withStatus(status).build());
    }

    public synchronized void setPodLog(String namespace, String name, String log) {
        podLogs.put(key(namespace, name), log);
    }

    public synchronized int getPodCreateCount() {
        return podCreateCount;
    }

    public synchronized int getStatusUpdateCount() {
        return statusUpdateCount;
    }

    public synchronized void failNextStatusUpdate(KubeApiException error) {
        statusUpdateFailures.add(error);
    }

    public synchronized void failNextCreate(KubeApiException error) {
        createFailures.add(error);
    }

    public synchronized void failDiscovery(KubeApiException error) {
        this.discoveryFailure = error;
    }

    public void emit(ValidationJobEvent event) {
        eventSink.tryEmitNext(event);
    }

    /*
     * ClusterApiFacade.
     */

    @Override
    public synchronized Optional<ValidationJob> findValidationJob(JobKey key) {
        return Optional.ofNullable(jobs.get(key));
    }

    @Override
    public synchronized List<ValidationJob> listValidationJobs() {
        return new ArrayList<>(jobs.values());
    }

    @Override
    public synchronized ValidationJob updateValidationJobStatus(ValidationJob job) {
        KubeApiException failure = statusUpdateFailures.poll();
        if (failure != null) {
            throw failure;
        }
        ValidationJob stored = jobs.get(job.getKey());
        if (stored == null) {
            throw new KubeApiException("Job not found: " + job.getKey(), KubeApiException.ErrorCode.NOT_FOUND);
        }
        ValidationJob updated = stored.toBuilder()
                .withStatus(job.getStatus())
                .withResourceVersion(Long.toString(++resourceVersion))
                .build();
        jobs.put(job.getKey(), updated);
        statusUpdateCount++;
        return updated;
    }

    @Override
    public synchronized ValidationJob addFinalizer(JobKey key, String finalizer) {
        ValidationJob job = jobs.get(key);
        if (job == null) {
            throw new KubeApiException("Job not found: " + key, KubeApiException.ErrorCode.NOT_FOUND);
        }
        if (job.getFinalizers().contains(finalizer)) {
            return job;
        }
        List<String> finalizers = new ArrayList<>(job.getFinalizers());
        finalizers.add(finalizer);
        ValidationJob updated = job.toBuilder().withFinalizers(finalizers).withResourceVersion(Long.toString(++resourceVersion)).build();
        jobs.put(key, updated);
        return updated;
    }

    @Override
    public synchronized void removeFinalizer(JobKey key, String finalizer) {
        ValidationJob job = jobs.get(key);
        if (job == null) {
            return;
        }
        List<String> finalizers = new ArrayList<>(job.getFinalizers());
        finalizers.remove(finalizer);
        if (job.isDeletionRequested() && finalizers.isEmpty()) {
            jobs.remove(key);
            return;
        }
        jobs.put(key, job.toBuilder().withFinalizers(finalizers).build());
    }

    @Override
    public synchronized Pod createPod(Pod pod) {
        failCreateIfRequested();
        String key = key(pod);
        if (pods.containsKey(key)) {
            throw new KubeApiException("Pod already exists: " + key, KubeApiException.ErrorCode.CONFLICT_ALREADY_EXISTS);
        }
        Pod created = new PodBuilder(pod)
                .editMetadata().withUid("pod-uid-" + (++podCreateCount)).endMetadata()
                .withNewStatus().withPhase("Pending").endStatus()
                .build();
        pods.put(key, created);
        return created;
    }

    @Override
    public synchronized List<Pod> listPods(String namespace, Map<String, String> labels) {
        return pods.values().stream()
                .filter(pod -> namespace.equals(pod.getMetadata().getNamespace()) && matches(pod, labels))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void deletePod(String namespace, String name) {
        pods.remove(key(namespace, name));
    }

    @Override
    public synchronized String getPodLog(String namespace, String podName, String containerName) {
        return podLogs.getOrDefault(key(namespace, podName), "");
    }

    @Override
    public synchronized GenericKubernetesResource createResource(ResourceKind kind, GenericKubernetesResource resource) {
        failCreateIfRequested();
        Map<String, GenericKubernetesResource> byName = resources.computeIfAbsent(kind, k -> new LinkedHashMap<>());
        String key = key(resource);
        if (byName.containsKey(key)) {
            throw new KubeApiException(kind.getKind() + " already exists: " + key, KubeApiException.ErrorCode.CONFLICT_ALREADY_EXISTS);
        }
        byName.put(key, resource);
        createCounts.merge(kind, 1, Integer::sum);
        return resource;
    }

    @Override
    public synchronized Optional<GenericKubernetesResource> findResource(ResourceKind kind, String namespace, String name) {
        return getResource(kind, namespace, name);
    }

    @Override
    public synchronized List<GenericKubernetesResource> listResources(ResourceKind kind, String namespace, Map<String, String> labels) {
        return resources.getOrDefault(kind, Collections.emptyMap()).values().stream()
                .filter(resource -> namespace.equals(resource.getMetadata().getNamespace()) && matches(resource, labels))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void deleteResource(ResourceKind kind, String namespace, String name) {
        resources.getOrDefault(kind, Collections.emptyMap()).remove(key(namespace, name));
    }

    @Override
    public synchronized boolean isResourceKindAvailable(ResourceKind kind) {
        if (discoveryFailure != null) {
            throw discoveryFailure;
        }
        return availableKinds.contains(kind);
    }

    @Override
    public Flux<ValidationJobEvent> events(Duration resyncInterval) {
        return eventSink.asFlux();
    }

    private void failCreateIfRequested() {
        KubeApiException failure = createFailures.poll();
        if (failure != null) {
            throw failure;
        }
    }

    private static boolean matches(HasMetadata object, Map<String, String> labels) {
        Map<String, String> actual = object.getMetadata().getLabels();
        if (actual == null) {
            return labels.isEmpty();
        }
        return labels.entrySet().stream().allMatch(e -> e.getValue().equals(actual.get(e.getKey())));
    }

    private static String key(HasMetadata object) {
        return key(object.getMetadata().getNamespace(), object.getMetadata().getName());
    }

    private static String key(String namespace, String name) {
        return namespace + '/' + name;
    }
}
