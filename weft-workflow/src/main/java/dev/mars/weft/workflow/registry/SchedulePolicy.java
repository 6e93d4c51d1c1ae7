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

package dev.mars.weft.workflow.registry;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Scheduling policy attached to a workflow. The engine stores it but does not interpret it;
 * a trigger component outside the engine reads it.
 *
 * @param policy policy name, for example {@code cron} or {@code interval}
 * @param data   policy-specific payload, for example a cron expression
 */
public record SchedulePolicy(String policy, String data) {

    @JsonCreator
    public SchedulePolicy(@JsonProperty("policy") String policy, @JsonProperty("data") String data) {
        Objects.requireNonNull(policy, "Policy cannot be null");
        if (policy.isBlank()) {
            throw new IllegalArgumentException("Policy cannot be blank");
        }
        this.policy = policy;
        this.data = data;
    }
}
