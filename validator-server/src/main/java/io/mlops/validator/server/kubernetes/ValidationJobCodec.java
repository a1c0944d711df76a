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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.mlops.validator.api.model.BuildConfig;
import io.mlops.validator.api.model.BuildPhase;
import io.mlops.validator.api.model.BuildStatus;
import io.mlops.validator.api.model.CellResult;
import io.mlops.validator.api.model.CellStatus;
import io.mlops.validator.api.model.Condition;
import io.mlops.validator.api.model.ConditionStatus;
import io.mlops.validator.api.model.ConditionType;
import io.mlops.validator.api.model.EnvVariable;
import io.mlops.validator.api.model.FallbackPolicy;
import io.mlops.validator.api.model.JobKey;
import io.mlops.validator.api.model.JobPhase;
import io.mlops.validator.api.model.ModelValidationConfig;
import io.mlops.validator.api.model.ModelValidationResult;
import io.mlops.validator.api.model.NotebookSource;
import io.mlops.validator.api.model.PodConfig;
import io.mlops.validator.api.model.ReasonCode;
import io.mlops.validator.api.model.ValidationJob;
import io.mlops.validator.api.model.ValidationJobSpec;
import io.mlops.validator.api.model.ValidationJobStatus;
import io.mlops.validator.api.service.ValidatorException;
import io.mlops.validator.common.util.DateTimeExt;
import io.mlops.validator.common.util.StringExt;

/**
 * Maps the NotebookValidationJob custom resource to the {@link ValidationJob} model and back. Only the status is
 * ever written by the controller, so only the status has an encoder.
 */
public final class ValidationJobCodec {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private static final ValidationJobSpec INVALID_SPEC = ValidationJobSpec.newBuilder()
            .withNotebook(new NotebookSource(null, null, null, null))
            .build();

    private ValidationJobCodec() {
    }

    /**
     * A spec that cannot be read does not fail the decoding. The job is returned with a placeholder spec and the
     * problem in {@link ValidationJob#getSpecError()}, so it can still be deleted and its status written.
     */
    public static ValidationJob decode(GenericKubernetesResource resource) {
        ObjectMeta metadata = resource.getMetadata();
        JsonNode status = toTree(resource.getAdditionalProperties().get("status"));
        ValidationJob.Builder builder = ValidationJob.newBuilder()
                .withKey(JobKey.of(metadata.getNamespace(), metadata.getName()))
                .withUid(metadata.getUid())
                .withGeneration(metadata.getGeneration() == null ? 0 : metadata.getGeneration())
                .withResourceVersion(metadata.getResourceVersion())
                .withDeletionRequested(StringExt.isNotEmpty(metadata.getDeletionTimestamp()))
                .withFinalizers(metadata.getFinalizers())
                .withStatus(decodeStatus(status));
        try {
            builder.withSpec(readSpec(toTree(resource.getAdditionalProperties().get("spec"))));
        } catch (IllegalArgumentException e) {
            builder.withSpec(INVALID_SPEC).withSpecError(e.getMessage());
        }
        return builder.build();
    }

    /**
     * Decodes the spec part of the resource. Structurally invalid input is reported as a configuration error.
     */
    public static ValidationJobSpec decodeSpec(JsonNode spec) {
        try {
            return readSpec(spec);
        } catch (IllegalArgumentException e) {
            throw ValidatorException.configurationInvalid(e.getMessage());
        }
    }

    private static ValidationJobSpec readSpec(JsonNode spec) {
        JsonNode notebook = spec.path("notebook");
        JsonNode git = notebook.path("git");
        NotebookSource notebookSource = new NotebookSource(
                text(git, "url"),
                text(git, "ref"),
                text(git, "credentialsSecret"),
                text(notebook, "path")
        );
        return ValidationJobSpec.newBuilder()
                .withNotebook(notebookSource)
                .withPodConfig(decodePodConfig(spec.path("podConfig")))
                .withTimeout(text(spec, "timeout"))
                .withModelValidation(decodeModelValidation(spec.path("modelValidation")))
                .build();
    }

    private static ModelValidationConfig decodeModelValidation(JsonNode modelValidation) {
        if (modelValidation.isMissingNode() || modelValidation.isNull()) {
            return ModelValidationConfig.disabled();
        }
        List<String> targetModels = new ArrayList<>();
        for (JsonNode item : modelValidation.path("targetModels")) {
            targetModels.add(item.asText());
        }
        return ModelValidationConfig.newBuilder()
                .withEnabled(modelValidation.path("enabled").asBoolean(true))
                .withPlatform(text(modelValidation, "platform"))
                .withPhase(text(modelValidation, "phase"))
                .withTargetModels(targetModels)
                .withTimeout(text(modelValidation, "timeout"))
                .build();
    }

    private static PodConfig decodePodConfig(JsonNode podConfig) {
        List<EnvVariable> env = new ArrayList<>();
        for (JsonNode item : podConfig.path("env")) {
            String name = text(item, "name");
            JsonNode valueFrom = item.path("valueFrom");
            if (valueFrom.has("secretKeyRef")) {
                JsonNode ref = valueFrom.path("secretKeyRef");
                env.add(EnvVariable.fromSecret(name, text(ref, "name"), text(ref, "key")));
            } else if (valueFrom.has("configMapKeyRef")) {
                JsonNode ref = valueFrom.path("configMapKeyRef");
                env.add(EnvVariable.fromConfigMap(name, text(ref, "name"), text(ref, "key")));
            } else {
                env.add(EnvVariable.literal(name, StringExt.nonNull(text(item, "value"))));
            }
        }
        List<String> envFromSecrets = new ArrayList<>();
        List<String> envFromConfigMaps = new ArrayList<>();
        for (JsonNode item : podConfig.path("envFrom")) {
            if (item.has("secretRef")) {
                envFromSecrets.add(text(item.path("secretRef"), "name"));
            } else if (item.has("configMapRef")) {
                envFromConfigMaps.add(text(item.path("configMapRef"), "name"));
            }
        }
        List<String> credentials = new ArrayList<>();
        for (JsonNode item : podConfig.path("credentials")) {
            credentials.add(item.asText());
        }
        JsonNode resources = podConfig.path("resources");
        return PodConfig.newBuilder()
                .withContainerImage(text(podConfig, "containerImage"))
                .withResourceLimits(stringMap(resources.path("limits")))
                .withResourceRequests(stringMap(resources.path("requests")))
                .withServiceAccountName(text(podConfig, "serviceAccountName"))
                .withEnv(env)
                .withEnvFromSecrets(envFromSecrets)
                .withEnvFromConfigMaps(envFromConfigMaps)
                .withCredentials(credentials)
                .withBuildConfig(decodeBuildConfig(podConfig.path("buildConfig")))
                .build();
    }

    private static BuildConfig decodeBuildConfig(JsonNode buildConfig) {
        if (buildConfig.isMissingNode() || buildConfig.isNull()) {
            return BuildConfig.disabled();
        }
        FallbackPolicy fallbackPolicy = FallbackPolicy.parse(text(buildConfig, "fallbackPolicy"));
        return BuildConfig.newBuilder()
                .withEnabled(buildConfig.path("enabled").asBoolean(false))
                .withStrategy(text(buildConfig, "strategy"))
                .withBaseImage(text(buildConfig, "baseImage"))
                .withDockerfile(text(buildConfig, "dockerfile"))
                .withFallbackPolicy(fallbackPolicy)
                .withRequirementsFile(text(buildConfig, "requirementsFile"))
                .withStrategyConfig(stringMap(buildConfig.path("strategyConfig")))
                .withTimeout(text(buildConfig, "timeout"))
                .build();
    }

    public static ValidationJobStatus decodeStatus(JsonNode status) {
        if (status.isMissingNode() || status.isNull()) {
            return ValidationJobStatus.empty();
        }
        List<Condition> conditions = new ArrayList<>();
        for (JsonNode item : status.path("conditions")) {
            conditions.add(new Condition(
                    ConditionType.valueOf(text(item, "type")),
                    ConditionStatus.valueOf(text(item, "status")),
                    text(item, "reason"),
                    text(item, "message"),
                    time(item, "lastTransitionTime")
            ));
        }
        List<CellResult> results = new ArrayList<>();
        for (JsonNode item : status.path("results")) {
            results.add(new CellResult(
                    item.path("cellIndex").asInt(),
                    CellStatus.valueOf(text(item, "status")),
                    DateTimeExt.parseDuration(text(item, "executionTime")).map(d -> d.toMillis()).orElse(0L),
                    text(item, "output"),
                    text(item, "errorMessage")
            ));
        }
        String phase = text(status, "phase");
        String reasonCode = text(status, "reasonCode");
        return ValidationJobStatus.newBuilder()
                .withPhase(phase == null ? null : JobPhase.valueOf(phase))
                .withBuildStatus(decodeBuildStatus(status.path("buildStatus")))
                .withConditions(conditions)
                .withResults(results)
                .withRetryCount(status.path("retryCount").asInt(0))
                .withLastRetryTime(time(status, "lastRetryTime"))
                .withStartTime(time(status, "startTime"))
                .withCompletionTime(time(status, "completionTime"))
                .withMessage(text(status, "message"))
                .withReasonCode(reasonCode == null ? null : ReasonCode.valueOf(reasonCode))
                .withValidationPodName(text(status, "validationPodName"))
                .withObservedGeneration(status.path("observedGeneration").asLong(0))
                .withSpecHash(text(status, "specHash"))
                .withModelValidationResult(decodeModelValidationResult(status.path("modelValidationResult")))
                .build();
    }

    private static ModelValidationResult decodeModelValidationResult(JsonNode result) {
        if (result.isMissingNode() || result.isNull()) {
            return null;
        }
        return new ModelValidationResult(
                text(result, "platform"),
                result.path("platformDetected").asBoolean(false),
                text(result, "message")
        );
    }

    private static BuildStatus decodeBuildStatus(JsonNode buildStatus) {
        if (buildStatus.isMissingNode() || buildStatus.isNull()) {
            return null;
        }
        String phase = text(buildStatus, "phase");
        return BuildStatus.newBuilder()
                .withPhase(phase == null ? BuildPhase.Pending : BuildPhase.valueOf(phase))
                .withStrategy(text(buildStatus, "strategy"))
                .withImageReference(text(buildStatus, "imageReference"))
                .withMessage(text(buildStatus, "message"))
                .withBuildName(text(buildStatus, "buildName"))
                .withStartTime(time(buildStatus, "startTime"))
                .withCompletionTime(time(buildStatus, "completionTime"))
                .build();
    }

    public static Map<String, Object> encodeStatus(ValidationJobStatus status) {
        ObjectNode node = MAPPER.createObjectNode();
        if (status.getPhase() != null) {
            node.put("phase", status.getPhase().name());
        }
        ArrayNode conditions = node.putArray("conditions");
        for (Condition condition : status.getConditions()) {
            ObjectNode item = conditions.addObject();
            item.put("type", condition.getType().name());
            item.put("status", condition.getStatus().name());
            item.put("reason", condition.getReason());
            item.put("message", condition.getMessage());
            putTime(item, "lastTransitionTime", condition.getLastTransitionTime());
        }
        if (!status.getResults().isEmpty()) {
            ArrayNode results = node.putArray("results");
            for (CellResult result : status.getResults()) {
                ObjectNode item = results.addObject();
                item.put("cellIndex", result.getCellIndex());
                item.put("status", result.getStatus().name());
                if (result.getExecutionTimeMs() > 0) {
                    item.put("executionTime", result.getExecutionTimeMs() + "ms");
                }
                putText(item, "output", result.getOutput());
                putText(item, "errorMessage", result.getErrorMessage());
            }
        }
        status.getBuildStatus().ifPresent(buildStatus -> {
            ObjectNode item = node.putObject("buildStatus");
            item.put("phase", buildStatus.getPhase().name());
            putText(item, "strategy", buildStatus.getStrategy());
            putText(item, "imageReference", buildStatus.getImageReference());
            putText(item, "message", buildStatus.getMessage());
            putText(item, "buildName", buildStatus.getBuildName());
            putTime(item, "startTime", buildStatus.getStartTime());
            putTime(item, "completionTime", buildStatus.getCompletionTime());
        });
        if (status.getRetryCount() > 0) {
            node.put("retryCount", status.getRetryCount());
        }
        putTime(node, "lastRetryTime", status.getLastRetryTime());
        putTime(node, "startTime", status.getStartTime());
        putTime(node, "completionTime", status.getCompletionTime());
        putText(node, "message", status.getMessage());
        status.getReasonCode().ifPresent(reasonCode -> node.put("reasonCode", reasonCode.name()));
        putText(node, "validationPodName", status.getValidationPodName());
        if (status.getObservedGeneration() > 0) {
            node.put("observedGeneration", status.getObservedGeneration());
        }
        putText(node, "specHash", status.getSpecHash());
        status.getModelValidationResult().ifPresent(result -> {
            ObjectNode item = node.putObject("modelValidationResult");
            putText(item, "platform", result.getPlatform());
            item.put("platformDetected", result.isPlatformDetected());
            putText(item, "message", result.getMessage());
        });
        return MAPPER.convertValue(node, MAP_TYPE);
    }

    private static JsonNode toTree(Object value) {
        if (value == null) {
            return MissingNode.getInstance();
        }
        return MAPPER.valueToTree(value);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    private static long time(JsonNode node, String field) {
        return DateTimeExt.fromUtcDateTimeString(text(node, field));
    }

    private static Map<String, String> stringMap(JsonNode node) {
        if (!node.isObject()) {
            return Collections.emptyMap();
        }
        Map<String, String> result = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            result.put(entry.getKey(), entry.getValue().asText());
        }
        return result;
    }

    private static void putText(ObjectNode node, String field, String value) {
        if (StringExt.isNotEmpty(value)) {
            node.put(field, value);
        }
    }

    private static void putTime(ObjectNode node, String field, long timestamp) {
        if (timestamp > 0) {
            node.put(field, DateTimeExt.toUtcDateTimeString(timestamp));
        }
    }
}
