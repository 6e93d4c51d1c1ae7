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

import dev.mars.weft.core.ResultCode;

import java.util.Objects;

/**
 * Result reported by a {@link TaskExecutable} for one attempt.
 */
public final class TaskOutcome {

    private static final TaskOutcome SUCCESS = new TaskOutcome(ResultCode.SUCCESS, null);

    private final ResultCode resultCode;
    private final String message;

    private TaskOutcome(ResultCode resultCode, String message) {
        this.resultCode = Objects.requireNonNull(resultCode, "Result code cannot be null");
        this.message = message;
    }

    public static TaskOutcome success() {
        return SUCCESS;
    }

    public static TaskOutcome success(String message) {
        return new TaskOutcome(ResultCode.SUCCESS, message);
    }

    public static TaskOutcome failure(String message) {
        return new TaskOutcome(ResultCode.ERROR, message);
    }

    /**
     * Creates a failed outcome. A {@link ResultCode#SUCCESS} code is coerced to {@link ResultCode#ERROR}.
     */
    public static TaskOutcome failure(ResultCode resultCode, String message) {
        Objects.requireNonNull(resultCode, "Result code cannot be null");
        return new TaskOutcome(resultCode.isSuccess() ? ResultCode.ERROR : resultCode, message);
    }

    public boolean isSuccess() {
        return resultCode.isSuccess();
    }

    public ResultCode getResultCode() {
        return resultCode;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskOutcome that = (TaskOutcome) o;
        return resultCode == that.resultCode && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(resultCode, message);
    }

    @Override
    public String toString() {
        return "TaskOutcome{" + resultCode + (message != null ? ", '" + message + '\'' : "") + '}';
    }
}
