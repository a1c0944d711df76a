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

package io.mlops.validator.api.service;

import java.util.Arrays;

import io.mlops.validator.api.model.ReasonCode;
import io.mlops.validator.api.service.ValidatorException.ErrorCategory;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ValidatorExceptionTest {

    @Test
    public void testCategories() {
        assertThat(ValidatorException.configurationInvalid("x").getCategory()).isEqualTo(ErrorCategory.ConfigurationError);
        assertThat(ValidatorException.strategyUnavailable("s2i", "BuildConfig API").getCategory()).isEqualTo(ErrorCategory.CapabilityUnavailable);
        assertThat(ValidatorException.buildFailed("job-build-1", "exit 1").getCategory()).isEqualTo(ErrorCategory.RetriableExecutionFailure);
        assertThat(ValidatorException.buildTimeout("job-build-1", "15m").getCategory()).isEqualTo(ErrorCategory.TerminalExecutionFailure);
        assertThat(ValidatorException.transientInfra("down", null).getCategory()).isEqualTo(ErrorCategory.TransientInfra);
    }

    @Test
    public void testMessagesNameTheRemedy() {
        ValidatorException error = ValidatorException.strategyNotFound("kaniko", Arrays.asList("s2i", "tekton"));

        assertThat(error.getReasonCode()).isEqualTo(ReasonCode.StrategyNotFound);
        assertThat(error.getMessage()).contains("kaniko").contains("[s2i, tekton]").contains("'auto'");
    }

    @Test
    public void testHasCategory() {
        assertThat(ValidatorException.hasCategory(ValidatorException.jobTimeout("job", "30m"), ErrorCategory.TerminalExecutionFailure)).isTrue();
        assertThat(ValidatorException.hasCategory(new IllegalStateException(), ErrorCategory.TransientInfra)).isFalse();
        assertThat(ErrorCategory.ConfigurationError.isTerminal()).isTrue();
        assertThat(ErrorCategory.ResourceExhaustion.isTerminal()).isFalse();
    }
}
