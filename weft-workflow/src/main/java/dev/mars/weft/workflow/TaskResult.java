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
import java.util.Objects;

/**
 * Record of one task attempt. A task may have several, one per attempt; the latest is
 * authoritative. Tasks that were never attempted get a single record with attempt number 0
 * and outcome {@link AttemptOutcome#SKIPPED}.
 */
public final class TaskResult {

    private final String taskName;
    private final int attempt;
    private final Instant startTime;
    private final Instant endTime;
    private final AttemptOutcome outcome;
    private final ResultCode resultCode;
    private final String message;
    private final int retriesConsumed;

    @JsonCreator
    public TaskResult(@JsonProperty("taskName") String taskName,
                      @JsonProperty("attempt") int attempt,
                      @JsonProperty("startTime") Instant startTime,
                      @JsonProperty("endTime") Instant endTime,
                      @JsonProperty("outcome") AttemptOutcome outcome,
                      @JsonProperty("resultCode") ResultCode resultCode,
                      @JsonProperty("message") String message,
                      @JsonProperty("retriesConsumed") int retriesConsumed) {
        this.taskName = Objects.requireNonNull(taskName, "Task name cannot be null");
        this.attempt = attempt;
        this.startTime = startTime;
        this.endTime = endTime;
        this.outcome = Objects.requireNonNull(outcome, "Outcome cannot be null");
        this.resultCode = resultCode != null ? resultCode
                : (outcome == AttemptOutcome.SUCCESS ? ResultCode.SUCCESS : ResultCode.ERROR);
        this.message = message;
        this.retriesConsumed = retriesConsumed;
    }

    /**
     * Result for an attempt that ran.
     */
    public static TaskResult attempt(String taskName, int attempt, Instant startTime, Instant endTime,
                                     AttemptOutcome outcome, ResultCode resultCode, String message) {
        return new TaskResult(taskName, attempt, startTime, endTime, outcome, resultCode, message,
                Math.max(0, attempt - 1));
    }

    /**
     * Result for a task that was never attempted.
     */
    public static TaskResult skipped(String taskName, Instant at, String reason) {
        return new TaskResult(taskName, 0, at, at, AttemptOutcome.SKIPPED, ResultCode.ERROR, reason, 0);
    }

    /**
     * Result for a task whose pending retry was abandoned because the execution was stopped.
     */
    public static TaskResult cancelled(String taskName, Instant at, String reason) {
        return new TaskResult(taskName, 0, at, at, AttemptOutcome.CANCELLED, ResultCode.ERROR, reason, 0);
    }

    public String getTaskName() {
        return taskName;
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public AttemptOutcome getOutcome() {
        return outcome;
    }

    public ResultCode getResultCode() {
        return resultCode;
    }

    public String getMessage() {
        return message;
    }

    public int getRetriesConsumed() {
        return retriesConsumed;
    }

    @JsonIgnore
    public Duration getDuration() {
        if (startTime == null || endTime == null) {
            return Duration.ZERO;
        }
        return Duration.between(startTime, endTime);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return outcome == AttemptOutcome.SUCCESS;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskResult that = (TaskResult) o;
        return attempt == that.attempt &&
               retriesConsumed == that.retriesConsumed &&
               taskName.equals(that.taskName) &&
               Objects.equals(startTime, that.startTime) &&
               Objects.equals(endTime, that.endTime) &&
               outcome == that.outcome &&
               resultCode == that.resultCode &&
               Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskName, attempt, startTime, endTime, outcome, resultCode, message, retriesConsumed);
    }

    @Override
    public String toString() {
        return "TaskResult{" +
                "task='" + taskName + '\'' +
                ", attempt=" + attempt +
                ", outcome=" + outcome +
                ", code=" + resultCode +
                (message != null ? ", message='" + message + '\'' : "") +
                '}';
    }
}
