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

import java.time.Duration;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class ReconcileResultTest {

    @Test
    public void testRequeueAfter() {
        ReconcileResult result = ReconcileResult.requeueAfter(Duration.ofSeconds(30));

        assertThat(result.getAction()).isEqualTo(ReconcileResult.Action.RequeueAfter);
        assertThat(result.getDelay()).isEqualTo(Duration.ofSeconds(30));
        assertThat(result.isDone()).isFalse();
    }

    @Test
    public void testNonPositiveDelayRequeuesImmediately() {
        assertThat(ReconcileResult.requeueAfter(Duration.ZERO)).isEqualTo(ReconcileResult.requeueNow());
        assertThat(ReconcileResult.requeueAfter(Duration.ofSeconds(-1))).isEqualTo(ReconcileResult.requeueNow());
    }
}
