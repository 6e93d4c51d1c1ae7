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

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Attempt-scoped context passed to a {@link TaskExecutable}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-04
 * @version 1.0
 */
public final class TaskContext {

    private final String executionId;
    private final String workflowName;
    private final String taskName;
    private final int attempt;
    private final Map<String, String> parameters;
    private final Map<String, String> userData;
    private final Instant deadline;
    private final CancellationToken cancellationToken;

    public TaskContext(String executionId, String workflowName, String taskName, int attempt,
                       Map<String, String> parameters, Map<String, String> userData,
                       Instant deadline, CancellationToken cancellationToken) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowName = Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        this.taskName = Objects.requireNonNull(taskName, "Task name cannot be null");
        this.attempt = attempt;
        this.parameters = parameters != null ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters)) : Map.of();
        this.userData = userData != null ? Collections.unmodifiableMap(new LinkedHashMap<>(userData)) : Map.of();
        this.deadline = deadline;
        this.cancellationToken = Objects.requireNonNull(cancellationToken, "Cancellation token cannot be null");
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public String getTaskName() {
        return taskName;
    }

    /**
     * One-based attempt number.
     */
    public int getAttempt() {
        return attempt;
    }

    public Map<String, String> getParameters() {
        return parameters;
    }

    public String getParameter(String key) {
        return parameters.get(key);
    }

    public String getParameter(String key, String defaultValue) {
        return parameters.getOrDefault(key, defaultValue);
    }

    public Map<String, String> getUserData() {
        return userData;
    }

    public Optional<Instant> getDeadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left before the deadline, or empty when the attempt has none.
     */
    public Optional<Duration> getRemaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration remaining = Duration.between(Instant.now(), deadline);
        return Optional.of(remaining.isNegative() ? Duration.ZERO : remaining);
    }

    public CancellationToken getCancellationToken() {
        return cancellationToken;
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled() || Thread.currentThread().isInterrupted();
    }

    @Override
    public String toString() {
        return "TaskContext{" +
                "executionId='" + executionId + '\'' +
                ", task='" + taskName + '\'' +
                ", attempt=" + attempt +
                ", deadline=" + deadline +
                '}';
    }
}
