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
 * Per-task state within one execution.
 */
public enum TaskState {

    /**
     * Not yet attempted, or waiting for its next retry.
     */
    PENDING,

    RUNNING,

    SUCCEEDED,

    /**
     * Retries exhausted.
     */
    FAILED,

    /**
     * Never attempted: a dependency failed or the execution was stopped first.
     */
    SKIPPED,

    /**
     * Had failed attempts and was waiting for a retry when the execution was stopped.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == SKIPPED || this == CANCELLED;
    }

    /**
     * Whether dependents may run once this task is in this state.
     */
    public boolean satisfiesDependents() {
        return this == SUCCEEDED || this == SKIPPED;
    }
}
