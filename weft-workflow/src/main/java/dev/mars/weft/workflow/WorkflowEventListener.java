/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
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

package dev.mars.weft.workflow;

/**
 * Callback interface for execution lifecycle events.
 *
 * <p>Events are delivered after the corresponding state has been committed, on whichever
 * thread caused the transition. Events for one execution arrive in order, so callbacks
 * should return quickly. Exceptions thrown by a listener are logged and ignored.</p>
 */
public interface WorkflowEventListener {

    default void onExecutionStarted(ExecutionContext context) {
    }

    default void onStatusChanged(String executionId, ExecutionStatus from, ExecutionStatus to) {
    }

    default void onTaskStarted(String executionId, String taskName, int attempt) {
    }

    /**
     * Called for every recorded {@link TaskResult}, including skipped tasks.
     */
    default void onTaskFinished(String executionId, TaskResult result) {
    }

    default void onExecutionFinished(WorkflowResult result) {
    }
}
