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

import dev.mars.weft.core.exceptions.InvalidParameterException;

/**
 * Thrown when a task depends on a name that is not a task of the same workflow.
 */
public class UnknownDependencyException extends InvalidParameterException {

    private final String taskName;
    private final String missingDependency;

    public UnknownDependencyException(String workflowName, String taskName, String missingDependency) {
        super("Task '" + taskName + "' in workflow '" + workflowName
                + "' depends on unknown task '" + missingDependency + "'");
        this.taskName = taskName;
        this.missingDependency = missingDependency;
    }

    public String getTaskName() {
        return taskName;
    }

    public String getMissingDependency() {
        return missingDependency;
    }
}
