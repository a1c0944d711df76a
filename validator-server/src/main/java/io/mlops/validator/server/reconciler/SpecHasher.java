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

import java.nio.charset.StandardCharsets;

import com.google.common.hash.Hashing;
import io.mlops.validator.api.model.ValidationJobSpec;

/**
 * Fingerprint of a job spec, used to tell real spec changes from metadata only generation bumps.
 */
public final class SpecHasher {

    private SpecHasher() {
    }

    public static String hash(ValidationJobSpec spec) {
        return Hashing.sha256().hashString(spec.toString(), StandardCharsets.UTF_8).toString().substring(0, 16);
    }
}
