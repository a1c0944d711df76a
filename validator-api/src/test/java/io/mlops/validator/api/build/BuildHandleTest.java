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

package io.mlops.validator.api.build;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BuildHandleTest {

    @Test
    public void testResourceNames() {
        BuildHandle handle = BuildHandle.of("team-a", "churn-model", "uid-1", 2);

        assertThat(handle.getBuildBaseName()).isEqualTo("churn-model-build");
        assertThat(handle.getBuildName()).isEqualTo("churn-model-build-2");
    }

    @Test
    public void testFromBuildName() {
        assertThat(BuildHandle.fromBuildName("team-a", "churn-model", "uid-1", "churn-model-build-3"))
                .contains(BuildHandle.of("team-a", "churn-model", "uid-1", 3));
    }

    @Test
    public void testFromInvalidBuildName() {
        assertThat(BuildHandle.fromBuildName("team-a", "churn-model", "uid-1", null)).isEmpty();
        assertThat(BuildHandle.fromBuildName("team-a", "churn-model", "uid-1", "")).isEmpty();
        assertThat(BuildHandle.fromBuildName("team-a", "churn-model", "uid-1", "other-build-1")).isEmpty();
        assertThat(BuildHandle.fromBuildName("team-a", "churn-model", "uid-1", "churn-model-build-x")).isEmpty();
        assertThat(BuildHandle.fromBuildName("team-a", "churn-model", "uid-1", "churn-model-build-0")).isEmpty();
    }

    @Test
    public void testAttemptMustBePositive() {
        assertThatThrownBy(() -> BuildHandle.of("team-a", "churn-model", "uid-1", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
