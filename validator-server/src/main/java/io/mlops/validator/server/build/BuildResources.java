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

import java.util.Collection;
import java.util.List;
import java.util.Map;

import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.mlops.validator.server.kubernetes.ClusterApiFacade;
import io.mlops.validator.server.kubernetes.KubeApiException;
import io.mlops.validator.server.kubernetes.ResourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static io.mlops.validator.server.kubernetes.GenericResources.nameOf;

/**
 * Resource operations shared by the build strategies.
 */
public final class BuildResources {

    private static final Logger logger = LoggerFactory.getLogger(BuildResources.class);

    private BuildResources() {
    }

    /**
     * Creates the resource, or returns the existing one with the same name.
     */
    public static GenericKubernetesResource createOrGet(ClusterApiFacade clusterApi, ResourceKind kind, GenericKubernetesResource resource) {
        String namespace = resource.getMetadata().getNamespace();
        String name = nameOf(resource);
        try {
            GenericKubernetesResource created = clusterApi.createResource(kind, resource);
            logger.info("Created {} {}/{}", kind.getKind(), namespace, name);
            return created;
        } catch (KubeApiException e) {
            if (e.getErrorCode() != KubeApiException.ErrorCode.CONFLICT_ALREADY_EXISTS) {
                throw e;
            }
            logger.debug("{} {}/{} already exists, reusing it", kind.getKind(), namespace, name);
            return clusterApi.findResource(kind, namespace, name).orElseThrow(() -> e);
        }
    }

    /**
     * Deletes all resources of the given kinds matching the labels. Returns the number of deleted resources.
     */
    public static int deleteAll(ClusterApiFacade clusterApi, Collection<ResourceKind> kinds, String namespace, Map<String, String> labels) {
        int count = 0;
        for (ResourceKind kind : kinds) {
            List<GenericKubernetesResource> resources = clusterApi.listResources(kind, namespace, labels);
            for (GenericKubernetesResource resource : resources) {
                clusterApi.deleteResource(kind, namespace, nameOf(resource));
                logger.info("Deleted {} {}/{}", kind.getKind(), namespace, nameOf(resource));
                count++;
            }
        }
        return count;
    }

    /**
     * Pins an image reference to a digest, replacing its tag (registry/ns/image:tag + sha256:x = registry/ns/image@sha256:x).
     */
    public static String pinDigest(String imageReference, String digest) {
        if (digest == null || digest.isEmpty() || imageReference.contains("@")) {
            return imageReference;
        }
        int lastSlash = imageReference.lastIndexOf('/');
        int tagSeparator = imageReference.lastIndexOf(':');
        String repository = tagSeparator > lastSlash ? imageReference.substring(0, tagSeparator) : imageReference;
        return repository + '@' + digest;
    }
}
