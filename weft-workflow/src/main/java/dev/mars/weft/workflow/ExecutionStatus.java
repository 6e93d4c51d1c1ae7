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
 * Lifecycle states of a workflow execution.
 * <p>
 * Executions follow this lifecycle:
 * <pre>
 *   PENDING → RUNNING → COMPLETED | FAILED
 *   RUNNING ⇄ PAUSED
 *   RUNNING | PAUSED → STOPPING → CANCELLED
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-04
 */
public enum ExecutionStatus {

    /**
     * Graph validated and execution recorded, nothing dispatched yet.
     */
    PENDING,

    /**
     * Ready tasks are being dispatched.
     */
    RUNNING,

    /**
     * No new attempts are dispatched. Attempts already running finish normally.
     */
    PAUSED,

    /**
     * A stop was requested. Running attempts drain without retries.
     */
    STOPPING,

    /**
     * Every task succeeded.
     */
    COMPLETED,

    /**
     * Every task is terminal and at least one failed or was skipped,
     * or the execution was aborted by an engine error.
     */
    FAILED,

    /**
     * Stopped by request.
     */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return this == RUNNING || this == PAUSED || this == STOPPING;
    }

    public boolean isSuccessful() {
        return this == COMPLETED;
    }

    /**
     * Checks whether a transition from this status to the given target status is valid.
     *
     * <p><strong>Valid transitions:</strong></p>
     * <pre>
     *   PENDING   → RUNNING, CANCELLED, FAILED
     *   RUNNING   → PAUSED, STOPPING, COMPLETED, FAILED
     *   PAUSED    → RUNNING, STOPPING, COMPLETED, FAILED
     *   STOPPING  → CANCELLED, FAILED
     *   COMPLETED, FAILED, CANCELLED → (terminal, no transitions)
     * </pre>
     *
     * @param target the target status
     * @return {@code true} if the transition is valid
     */
    public boolean canTransitionTo(ExecutionStatus target) {
        return switch (this) {
            case PENDING -> target == RUNNING || target == CANCELLED || target == FAILED;
            case RUNNING -> target == PAUSED || target == STOPPING
                        || target == COMPLETED || target == FAILED;
            case PAUSED -> target == RUNNING || target == STOPPING
                        || target == COMPLETED || target == FAILED;
            case STOPPING -> target == CANCELLED || target == FAILED;
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    /**
     * Returns all valid target statuses that this status can transition to.
     *
     * @return valid target statuses, empty for terminal states
     */
    public ExecutionStatus[] getValidTransitions() {
        return switch (this) {
            case PENDING -> new ExecutionStatus[]{RUNNING, CANCELLED, FAILED};
            case RUNNING, PAUSED -> new ExecutionStatus[]{
                    this == RUNNING ? PAUSED : RUNNING, STOPPING, COMPLETED, FAILED};
            case STOPPING -> new ExecutionStatus[]{CANCELLED, FAILED};
            case COMPLETED, FAILED, CANCELLED -> new ExecutionStatus[0];
        };
    }
}
