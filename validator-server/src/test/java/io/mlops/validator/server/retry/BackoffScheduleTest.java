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

package io.mlops.validator.server.retry;

import java.time.Duration;
import java.util.Collections;

import org.junit.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BackoffScheduleTest {

    @Test
    public void testDefaultSchedule() {
        BackoffSchedule schedule = BackoffSchedule.defaultSchedule();

        assertThat(schedule.delayFor(1)).isEqualTo(Duration.ofMinutes(1));
        assertThat(schedule.delayFor(2)).isEqualTo(Duration.ofMinutes(2));
        assertThat(schedule.delayFor(3)).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    public void testDelayIsCappedAtLastEntry() {
        assertThat(BackoffSchedule.defaultSchedule().delayFor(10)).isEqualTo(Duration.ofMinutes(5));
        assertThat(BackoffSchedule.defaultSchedule().delayFor(0)).isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    public void testEmptyScheduleIsRejected() {
        assertThatThrownBy(() -> new BackoffSchedule(Collections.emptyList())).isInstanceOf(IllegalArgumentException.class);
    }
}
