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

import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import io.fabric8.kubernetes.api.model.OwnerReference;
import io.mlops.validator.common.util.DateTimeExt;

/**
 * Helpers for building and reading untyped custom resources (OpenShift builds, Tekton pipelines).
 */
public final class GenericResources {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private GenericResources() {
    }

    public static ObjectNode newObjectNode() {
        return MAPPER.createObjectNode();
    }

    public static GenericKubernetesResource newResource(ResourceKind kind,
                                                        String namespace,
                                                        String name,
                                                        Map<String, String> labels,
                                                        Map<String, String> annotations,
                                                        List<OwnerReference> ownerReferences,
                                                        ObjectNode spec) {
        ObjectMeta metadata = new ObjectMetaBuilder()
                .withNamespace(namespace)
                .withName(name)
                .withLabels(labels)
                .withAnnotations(annotations)
                .withOwnerReferences(ownerReferences)
                .build();
        GenericKubernetesResource resource = new GenericKubernetesResource();
        resource.setApiVersion(kind.getApiVersion());
        resource.setKind(kind.getKind());
        resource.setMetadata(metadata);
        resource.setAdditionalProperty("spec", MAPPER.convertValue(spec, MAP_TYPE));
        return resource;
    }

    /**
     * Returns the resource content (without metadata) as a JSON tree.
     */
    public static JsonNode toTree(GenericKubernetesResource resource) {
        return MAPPER.valueToTree(resource.getAdditionalProperties());
    }

    /**
     * Reads a text value at the JSON pointer (for example "/status/phase").
     */
    public static Optional<String> text(GenericKubernetesResource resource, String pointer) {
        return text(toTree(resource), pointer);
    }

    public static Optional<String> text(JsonNode tree, String pointer) {
        JsonNode value = tree.at(pointer);
        if (value.isMissingNode() || value.isNull() || value.asText().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    /**
     * Reads an RFC 3339 timestamp at the JSON pointer, returning 0 if absent.
     */
    public static long time(JsonNode tree, String pointer) {
        return text(tree, pointer).map(DateTimeExt::fromUtcDateTimeString).orElse(0L);
    }

    /**
     * Merges the given fields into the resource status. Used by tests and fakes simulating backend progress.
     */
    public static void setStatus(GenericKubernetesResource resource, ObjectNode status) {
        resource.setAdditionalProperty("status", MAPPER.convertValue(status, MAP_TYPE));
    }

    public static String nameOf(GenericKubernetesResource resource) {
        return resource.getMetadata().getName();
    }
}
