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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.mars.weft.core.ResultCode;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only summary of an execution, derived from its committed {@link ExecutionState}.
 *
 * <p>The result code is {@link ResultCode#SUCCESS} for completed and still running executions.
 * A failed execution reports the code of its first task that exhausted its retries, or
 * {@link ResultCode#ERROR} when it was aborted. A cancelled execution reports {@link ResultCode#ERROR}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-05
 * @version 1.0
 */
public final class WorkflowResult {

    private final String executionId;
    private final String workflowName;
    private final String workflowVersion;
    private final ExecutionStatus status;
    private final ResultCode resultCode;
    private final List<TaskResult> taskResults;
    private final Instant startTime;
    private final Instant endTime;
    private final Duration duration;
    private final String summary;

    @JsonCreator
    public WorkflowResult(@JsonProperty("executionId") String executionId,
                          @JsonProperty("workflowName") String workflowName,
                          @JsonProperty("workflowVersion") String workflowVersion,
                          @JsonProperty("status") ExecutionStatus status,
                          @JsonProperty("resultCode") ResultCode resultCode,
                          @JsonProperty("taskResults") List<TaskResult> taskResults,
                          @JsonProperty("startTime") Instant startTime,
                          @JsonProperty("endTime") Instant endTime,
                          @JsonProperty("duration") Duration duration,
                          @JsonProperty("summary") String summary) {
        this.executionId = Objects.requireNonNull(executionId, "Execution ID cannot be null");
        this.workflowName = workflowName;
        this.workflowVersion = workflowVersion;
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.resultCode = resultCode != null || !status.isTerminal() ? resultCode : ResultCode.ERROR;
        this.taskResults = taskResults != null ? List.copyOf(taskResults) : List.of();
        this.startTime = startTime;
        this.endTime = endTime;
        this.duration = duration != null ? duration : Duration.ZERO;
        this.summary = summary;
    }

    public static WorkflowResult from(ExecutionState state) {
        Objects.requireNonNull(state, "Execution state cannot be null");
        Instant end = state.getEndTime() != null ? state.getEndTime() : Instant.now();
        return new WorkflowResult(
                state.getExecutionId(),
                state.getWorkflowName(),
                state.getWorkflowVersion(),
                state.getStatus(),
                resultCodeOf(state),
                state.getResults(),
                state.getStartTime(),
                state.getEndTime(),
                Duration.between(state.getStartTime(), end),
                summarize(state, Duration.between(state.getStartTime(), end)));
    }

    private static ResultCode resultCodeOf(ExecutionState state) {
        return switch (state.getStatus()) {
            case FAILED -> state.getTaskStates().entrySet().stream()
                    .filter(e -> e.getValue() == TaskState.FAILED)
                    .findFirst()
                    .flatMap(e -> state.getLatestResult(e.getKey()))
                    .map(TaskResult::getResultCode)
                    .orElse(ResultCode.ERROR);
            case CANCELLED -> ResultCode.ERROR;
            case COMPLETED -> ResultCode.SUCCESS;
            default -> null;
        };
    }

    private static String summarize(ExecutionState state, Duration elapsed) {
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        int cancelled = 0;
        for (Map.Entry<String, TaskState> entry : state.getTaskStates().entrySet()) {
            switch (entry.getValue()) {
                case SUCCEEDED -> succeeded++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
                case CANCELLED -> cancelled++;
                default -> { }
            }
        }
        StringBuilder sb = new StringBuilder();
        sb.append("Workflow '").append(state.getWorkflowName()).append("' ")
          .append(state.getStatus())
          .append(": ").append(succeeded).append(" succeeded, ")
          .append(failed).append(" failed, ")
          .append(skipped).append(" skipped, ")
          .append(cancelled).append(" cancelled in ")
          .append(elapsed.toMillis()).append(" ms");
        if (state.getFailureReason() != null) {
            sb.append(" (").append(state.getFailureReason()).append(")");
        }
        return sb.toString();
    }

    public String getExecutionId() {
        return executionId;
    }

    public String getWorkflowName() {
        return workflowName;
    }

    public String getWorkflowVersion() {
        return workflowVersion;
    }

    public ExecutionStatus getStatus() {
        return status;
    }

    /**
     * Overall result code, or {@code null} while the execution has not reached a terminal status.
     */
    public ResultCode getResultCode() {
        return resultCode;
    }

    public List<TaskResult> getTaskResults() {
        return taskResults;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public Duration getDuration() {
        return duration;
    }

    public String getSummary() {
        return summary;
    }

    /**
     * Every recorded attempt of one task, in attempt order.
     */
    public List<TaskResult> getResultsFor(String taskName) {
        return taskResults.stream().filter(r -> r.getTaskName().equals(taskName)).toList();
    }

    public Optional<TaskResult> getLatestResultFor(String taskName) {
        List<TaskResult> forTask = getResultsFor(taskName);
        return forTask.isEmpty() ? Optional.empty() : Optional.of(forTask.get(forTask.size() - 1));
    }

    @JsonIgnore
    public boolean isSuccessful() {
        return status == ExecutionStatus.COMPLETED;
    }

    @Override
    public String toString() {
        return "WorkflowResult{" +
                "executionId='" + executionId + '\'' +
                ", status=" + status +
                ", resultCode=" + resultCode +
                ", taskResults=" + taskResults.size() +
                ", summary='" + summary + '\'' +
                '}';
    }
}
