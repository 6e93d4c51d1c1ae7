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
 * The opaque unit of work behind a task.
 *
 * <p>Implementations may call into the resource layer, a rule engine or anything else.
 * They should observe {@link TaskContext#isCancelled()} and thread interruption so that
 * deadlines and stop requests can take effect promptly.</p>
 */
@FunctionalInterface
public interface TaskExecutable {

    /**
     * Runs one attempt of the task.
     *
     * @param context the attempt-scoped context
     * @return the outcome of the attempt, never {@code null}
     * @throws Exception any exception is recorded as a failed attempt
     */
    TaskOutcome execute(TaskContext context) throws Exception;
}
