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

package dev.mars.weft.workflow.store;

import dev.mars.weft.core.ResultCode;
import dev.mars.weft.core.exceptions.StateStoreException;
import dev.mars.weft.workflow.AttemptOutcome;
import dev.mars.weft.workflow.ExecutionState;
import dev.mars.weft.workflow.ExecutionStatus;
import dev.mars.weft.workflow.TaskDefinition;
import dev.mars.weft.workflow.TaskResult;
import dev.mars.weft.workflow.TaskState;
import dev.mars.weft.workflow.WorkflowDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link InMemoryExecutionStateStore}.
 */
class InMemoryExecutionStateStoreTest {

    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private static final WorkflowDefinition ETL = WorkflowDefinition.builder("etl")
            .task(TaskDefinition.builder("extract").handler("shell").parameter("cmd", "dump"))
            .task(TaskDefinition.builder("load").dependsOn("extract").retryCount(1))
            .build();

    private static final WorkflowDefinition REPORT = WorkflowDefinition.builder("report")
            .task(TaskDefinition.builder("render"))
            .build();

    private InMemoryExecutionStateStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryExecutionStateStore();
    }

    private static ExecutionState pending(String id, WorkflowDefinition workflow, Instant start) {
        return ExecutionState.pending(id, workflow, Map.of("owner", "ops"), start);
    }

    private static ExecutionState completed(String id, WorkflowDefinition workflow, Instant start, Instant end) {
        ExecutionState.Builder builder = pending(id, workflow, start).toBuilder()
                .status(ExecutionStatus.COMPLETED)
                .endTime(end);
        for (TaskDefinition task : workflow.getTasks()) {
            builder.taskState(task.getName(), TaskState.SUCCEEDED)
                   .attempts(task.getName(), 1)
                   .result(TaskResult.attempt(task.getName(), 1, start, end,
                           AttemptOutcome.SUCCESS, ResultCode.SUCCESS, "ok"));
        }
        return builder.build();
    }

    @Test
    void testSaveAndFind() {
        ExecutionState state = pending("e1", ETL, T0);

        store.save(state);

        assertThat(store.find("e1")).contains(state);
        assertThat(store.find("missing")).isEmpty();
        assertThat(store.find(null)).isEmpty();
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void testSaveReplacesPreviousState() {
        store.save(pending("e1", ETL, T0));
        ExecutionState running = store.find("e1").orElseThrow().toBuilder()
                .status(ExecutionStatus.RUNNING)
                .build();

        store.save(running);

        assertThat(store.find("e1").orElseThrow().getStatus()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void testFindActiveExcludesTerminal() {
        store.save(pending("e1", ETL, T0));
        store.save(completed("e2", ETL, T0.plusSeconds(1), T0.plusSeconds(5)));

        assertThat(store.findActive())
                .extracting(ExecutionState::getExecutionId)
                .containsExactly("e1");
    }

    @Test
    void testPurge() {
        store.save(completed("e1", ETL, T0, T0.plusSeconds(1)));

        assertThat(store.purge("e1")).isTrue();
        assertThat(store.purge("e1")).isFalse();
        assertThat(store.find("e1")).isEmpty();
    }

    @Nested
    class History {

        @BeforeEach
        void populate() {
            store.save(completed("late", ETL, T0.plusSeconds(120), T0.plusSeconds(130)));
            store.save(completed("early", ETL, T0, T0.plusSeconds(10)));
            store.save(completed("middle", ETL, T0.plusSeconds(60), T0.plusSeconds(70)));
            store.save(completed("other", REPORT, T0.plusSeconds(60), T0.plusSeconds(61)));
        }

        @Test
        void testOrderedByStartTime() {
            assertThat(store.findHistory("etl", null, null))
                    .extracting(ExecutionState::getExecutionId)
                    .containsExactly("early", "middle", "late");
        }

        @Test
        void testBoundsAreInclusive() {
            assertThat(store.findHistory("etl", T0, T0.plusSeconds(60)))
                    .extracting(ExecutionState::getExecutionId)
                    .containsExactly("early", "middle");
        }

        @Test
        void testOpenLowerBound() {
            assertThat(store.findHistory("etl", null, T0.plusSeconds(59)))
                    .extracting(ExecutionState::getExecutionId)
                    .containsExactly("early");
        }

        @Test
        void testUnknownWorkflowHasNoHistory() {
            assertThat(store.findHistory("nothing", null, null)).isEmpty();
        }
    }

    @Nested
    class Eviction {

        @Test
        void testOldestTerminalExecutionsEvicted() {
            InMemoryExecutionStateStore capped = new InMemoryExecutionStateStore(2);
            capped.save(pending("active", ETL, T0));
            capped.save(completed("c1", ETL, T0, T0.plusSeconds(1)));
            capped.save(completed("c2", ETL, T0, T0.plusSeconds(2)));
            capped.save(completed("c3", ETL, T0, T0.plusSeconds(3)));

            assertThat(capped.find("c1")).isEmpty();
            assertThat(capped.find("c2")).isPresent();
            assertThat(capped.find("c3")).isPresent();
            // active executions never count against the cap
            assertThat(capped.find("active")).isPresent();
        }

        @Test
        void testCleanupOlderThan() {
            Instant now = Instant.now();
            store.save(completed("old", ETL, now.minus(Duration.ofHours(3)), now.minus(Duration.ofHours(2))));
            store.save(completed("recent", ETL, now.minusSeconds(10), now.minusSeconds(5)));
            store.save(pending("running", ETL, now.minus(Duration.ofHours(5))));

            int removed = store.cleanupOlderThan(Duration.ofHours(1));

            assertThat(removed).isEqualTo(1);
            assertThat(store.find("old")).isEmpty();
            assertThat(store.find("recent")).isPresent();
            assertThat(store.find("running")).isPresent();
        }
    }

    @Nested
    class Snapshots {

        @Test
        void testSnapshotRestoresEqualStates() {
            ExecutionState active = pending("e1", ETL, T0).toBuilder()
                    .status(ExecutionStatus.RUNNING)
                    .taskState("extract", TaskState.RUNNING)
                    .attempts("extract", 1)
                    .build();
            ExecutionState done = completed("e2", REPORT, T0, T0.plusSeconds(4));
            store.save(active);
            store.save(done);

            byte[] snapshot = store.takeSnapshot();
            InMemoryExecutionStateStore restored = new InMemoryExecutionStateStore();
            restored.save(pending("stale", ETL, T0));
            restored.restoreSnapshot(snapshot);

            assertThat(restored.size()).isEqualTo(2);
            assertThat(restored.find("e1")).contains(active);
            assertThat(restored.find("e2")).contains(done);
            assertThat(restored.find("stale")).isEmpty();
        }

        @Test
        void testSnapshotToFileAndBack(@TempDir Path dir) {
            store.save(completed("e1", ETL, T0, T0.plusSeconds(1)));
            Path file = dir.resolve("state").resolve("executions.json");

            store.snapshotTo(file);
            InMemoryExecutionStateStore restored = new InMemoryExecutionStateStore();
            restored.restoreFrom(file);

            assertThat(Files.exists(file)).isTrue();
            assertThat(restored.findAll()).isEqualTo(store.findAll());
        }

        @Test
        void testNewerFormatRejected() {
            byte[] future = "{\"formatVersion\":99,\"executions\":[],\"timestamp\":\"2026-03-01T10:00:00Z\"}"
                    .getBytes(StandardCharsets.UTF_8);

            assertThatThrownBy(() -> store.restoreSnapshot(future))
                    .isInstanceOf(StateStoreException.class)
                    .hasMessageContaining("99");
        }

        @Test
        void testCorruptSnapshotRejected() {
            byte[] garbage = "not json".getBytes(StandardCharsets.UTF_8);

            assertThatThrownBy(() -> store.restoreSnapshot(garbage))
                    .isInstanceOf(StateStoreException.class);
        }

        @Test
        void testMissingFileRejected(@TempDir Path dir) {
            assertThatThrownBy(() -> store.restoreFrom(dir.resolve("absent.json")))
                    .isInstanceOf(StateStoreException.class);
        }
    }
}
