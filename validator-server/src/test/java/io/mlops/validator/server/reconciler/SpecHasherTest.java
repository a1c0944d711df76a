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

import io.mlops.validator.api.model.ValidationJobSpec;
import io.mlops.validator.server.ValidationJobGenerator;
import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class SpecHasherTest {

    @Test
    public void testEqualSpecsHaveEqualHashes() {
        assertThat(SpecHasher.hash(ValidationJobGenerator.prebuiltImageSpec()))
                .isEqualTo(SpecHasher.hash(ValidationJobGenerator.prebuiltImageSpec()))
                .hasSize(16);
    }

    @Test
    public void testChangedSpecHasDifferentHash() {
        ValidationJobSpec spec = ValidationJobGenerator.prebuiltImageSpec();
        ValidationJobSpec changed = spec.toBuilder().withTimeout("1h").build();

        assertThat(SpecHasher.hash(changed)).isNotEqualTo(SpecHasher.hash(spec));
    }
}
