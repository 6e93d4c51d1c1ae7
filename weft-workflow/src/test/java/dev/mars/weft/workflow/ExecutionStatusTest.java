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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the execution, task and attempt state enums.
 */
class ExecutionStatusTest {

    // ========== Transition Table Tests ==========

    @ParameterizedTest
    @CsvSource({
            "PENDING, RUNNING",
            "PENDING, CANCELLED",
            "PENDING, FAILED",
            "RUNNING, PAUSED",
            "RUNNING, STOPPING",
            "RUNNING, COMPLETED",
            "RUNNING, FAILED",
            "PAUSED, RUNNING",
            "PAUSED, STOPPING",
            "PAUSED, COMPLETED",
            "PAUSED, FAILED",
            "STOPPING, CANCELLED",
            "STOPPING, FAILED"
    })
    void testAllowedTransitions(ExecutionStatus from, ExecutionStatus to) {
        assertTrue(from.canTransitionTo(to), from + " -> " + to);
        assertTrue(Arrays.asList(from.getValidTransitions()).contains(to));
    }

    @ParameterizedTest
    @CsvSource({
            "PENDING, PAUSED",
            "PENDING, COMPLETED",
            "RUNNING, RUNNING",
            "RUNNING, CANCELLED",
            "PAUSED, PAUSED",
            "PAUSED, CANCELLED",
            "STOPPING, RUNNING",
            "STOPPING, COMPLETED",
            "COMPLETED, RUNNING",
            "FAILED, RUNNING",
            "CANCELLED, RUNNING"
    })
    void testRejectedTransitions(ExecutionStatus from, ExecutionStatus to) {
        assertFalse(from.canTransitionTo(to), from + " -> " + to);
    }

    @ParameterizedTest
    @EnumSource(ExecutionStatus.class)
    void testValidTransitionsMatchTable(ExecutionStatus from) {
        Set<ExecutionStatus> listed = EnumSet.noneOf(ExecutionStatus.class);
        listed.addAll(Arrays.asList(from.getValidTransitions()));
        for (ExecutionStatus to : ExecutionStatus.values()) {
            assertEquals(listed.contains(to), from.canTransitionTo(to), from + " -> " + to);
        }
    }

    @ParameterizedTest
    @EnumSource(value = ExecutionStatus.class, names = {"COMPLETED", "FAILED", "CANCELLED"})
    void testTerminalStatusesHaveNoExits(ExecutionStatus status) {
        assertTrue(status.isTerminal());
        assertFalse(status.isActive());
        assertEquals(0, status.getValidTransitions().length);
    }

    @Test
    void testActiveAndSuccessfulFlags() {
        assertTrue(ExecutionStatus.RUNNING.isActive());
        assertTrue(ExecutionStatus.PAUSED.isActive());
        assertTrue(ExecutionStatus.STOPPING.isActive());
        assertFalse(ExecutionStatus.PENDING.isTerminal());
        assertTrue(ExecutionStatus.COMPLETED.isSuccessful());
        assertFalse(ExecutionStatus.FAILED.isSuccessful());
    }

    // ========== Task State Tests ==========

    @ParameterizedTest
    @EnumSource(value = TaskState.class, names = {"SUCCEEDED", "SKIPPED"})
    void testStatesThatReleaseDependents(TaskState state) {
        assertTrue(state.satisfiesDependents());
        assertTrue(state.isTerminal());
    }

    @ParameterizedTest
    @EnumSource(value = TaskState.class, names = {"PENDING", "RUNNING", "FAILED", "CANCELLED"})
    void testStatesThatHoldDependents(TaskState state) {
        assertFalse(state.satisfiesDependents());
    }

    @Test
    void testRetryableOutcomes() {
        assertTrue(AttemptOutcome.FAILURE.isRetryable());
        assertTrue(AttemptOutcome.TIMEOUT.isRetryable());
        assertFalse(AttemptOutcome.SUCCESS.isRetryable());
        assertFalse(AttemptOutcome.CANCELLED.isRetryable());
        assertFalse(AttemptOutcome.SKIPPED.isRetryable());
    }
}
