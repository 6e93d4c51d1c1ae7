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

import java.util.List;

/**
 * Thrown when the dependency relation of a workflow contains a cycle.
 * The cycle path starts and ends with the same task, for example {@code [A, B, A]}
 * where A depends on B and B depends on A.
 */
public class CyclicDependencyException extends InvalidParameterException {

    private final List<String> cyclePath;

    public CyclicDependencyException(String workflowName, List<String> cyclePath) {
        super("Cyclic dependency in workflow '" + workflowName + "': " + String.join(" -> ", cyclePath));
        this.cyclePath = List.copyOf(cyclePath);
    }

    public List<String> getCyclePath() {
        return cyclePath;
    }
}
