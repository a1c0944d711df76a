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

package io.mlops.validator.server.controller;

import io.mlops.validator.api.model.JobKey;
import io.mlops.validator.common.util.archaius2.Archaius2Ext;
import io.mlops.validator.server.kubernetes.StubClusterApiFacade;
import io.mlops.validator.server.kubernetes.ValidationJobEvent;
import org.junit.After;
import org.junit.Test;
import org.mockito.InOrder;

import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

public class ValidationJobControllerTest {

    private static final JobKey JOB = JobKey.of("ml-team", "churn");

    private final StubClusterApiFacade clusterApi = new StubClusterApiFacade();
    private final JobWorkQueue workQueue = mock(JobWorkQueue.class);

    private ValidationJobController controller;

    @After
    public void tearDown() {
        if (controller != null) {
            controller.shutdown();
        }
    }

    @Test
    public void testUpdateEventEnqueuesJob() {
        controller = newController("true");
        controller.activate();

        clusterApi.emit(ValidationJobEvent.updated(JOB));

        verify(workQueue).enqueue(JOB);
    }

    @Test
    public void testDeleteEventCancelsThenEnqueues() {
        controller = newController("true");
        controller.activate();

        clusterApi.emit(ValidationJobEvent.deleted(JOB));

        InOrder inOrder = inOrder(workQueue);
        inOrder.verify(workQueue).cancel(JOB);
        inOrder.verify(workQueue).enqueue(JOB);
    }

    @Test
    public void testDisabledControllerIgnoresEvents() {
        controller = newController("false");
        controller.activate();

        clusterApi.emit(ValidationJobEvent.updated(JOB));

        verifyNoInteractions(workQueue);
    }

    @Test
    public void testShutdownStopsWorkQueue() {
        controller = newController("true");
        controller.activate();

        controller.shutdown();
        controller = null;

        verify(workQueue).shutdown();
    }

    private ValidationJobController newController(String enabled) {
        return new ValidationJobController(
                clusterApi,
                workQueue,
                Archaius2Ext.newConfiguration(ValidatorControllerConfiguration.class, "notebook.validator.controller.enabled", enabled)
        );
    }
}
