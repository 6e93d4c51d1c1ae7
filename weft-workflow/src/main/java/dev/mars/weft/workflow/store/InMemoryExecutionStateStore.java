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

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.weft.core.exceptions.StateStoreException;
import dev.mars.weft.workflow.ExecutionState;
import dev.mars.weft.workflow.persistence.JacksonConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory execution state store with explicit JSON snapshots.
 *
 * <p>Terminal executions beyond the retention cap are evicted oldest first (by end time).
 * Active executions are never evicted. A cap of zero or less keeps everything.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public class InMemoryExecutionStateStore implements ExecutionStateStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryExecutionStateStore.class);

    private static final Comparator<ExecutionState> BY_START =
            Comparator.comparing(ExecutionState::getStartTime).thenComparing(ExecutionState::getExecutionId);

    private final Map<String, ExecutionState> executions = new ConcurrentHashMap<>();
    private final ObjectMapper objectMapper = JacksonConfig.createObjectMapper();
    private final Object evictionLock = new Object();
    private final int maxHistory;

    public InMemoryExecutionStateStore() {
        this(0);
    }

    public InMemoryExecutionStateStore(int maxHistory) {
        this.maxHistory = maxHistory;
    }

    @Override
    public void save(ExecutionState state) {
        Objects.requireNonNull(state, "Execution state cannot be null");
        executions.put(state.getExecutionId(), state);
        logger.trace("Saved execution state: id={}, status={}", state.getExecutionId(), state.getStatus());
        if (state.isTerminal() && maxHistory > 0) {
            evictOverflow();
        }
    }

    private void evictOverflow() {
        synchronized (evictionLock) {
            List<ExecutionState> terminal = executions.values().stream()
                    .filter(ExecutionState::isTerminal)
                    .sorted(Comparator.comparing((ExecutionState s) ->
                            s.getEndTime() != null ? s.getEndTime() : s.getStartTime()))
                    .toList();
            int excess = terminal.size() - maxHistory;
            for (int i = 0; i < excess; i++) {
                String id = terminal.get(i).getExecutionId();
                executions.remove(id);
                logger.debug("Evicted execution {} (history cap {})", id, maxHistory);
            }
        }
    }

    @Override
    public Optional<ExecutionState> find(String executionId) {
        if (executionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public List<ExecutionState> findAll() {
        return executions.values().stream().sorted(BY_START).toList();
    }

    @Override
    public List<ExecutionState> findActive() {
        return executions.values().stream()
                .filter(s -> !s.isTerminal())
                .sorted(BY_START)
                .toList();
    }

    @Override
    public List<ExecutionState> findHistory(String workflowName, Instant from, Instant to) {
        Objects.requireNonNull(workflowName, "Workflow name cannot be null");
        return executions.values().stream()
                .filter(s -> s.getWorkflowName().equals(workflowName))
                .filter(s -> from == null || !s.getStartTime().isBefore(from))
                .filter(s -> to == null || !s.getStartTime().isAfter(to))
                .sorted(BY_START)
                .toList();
    }

    @Override
    public boolean purge(String executionId) {
        ExecutionState removed = executions.remove(executionId);
        if (removed != null) {
            logger.debug("Purged execution state: {}", executionId);
            return true;
        }
        return false;
    }

    /**
     * Removes terminal executions that ended more than {@code maxAge} ago.
     *
     * @return the number of executions removed
     */
    public int cleanupOlderThan(Duration maxAge) {
        Instant cutoff = Instant.now().minus(maxAge);
        int before = executions.size();
        executions.entrySet().removeIf(entry -> {
            ExecutionState state = entry.getValue();
            return state.isTerminal()
                    && state.getEndTime() != null
                    && state.getEndTime().isBefore(cutoff);
        });
        int removed = before - executions.size();
        if (removed > 0) {
            logger.info("Cleaned up {} executions older than {}", removed, maxAge);
        }
        return removed;
    }

    @Override
    public int size() {
        return executions.size();
    }

    @Override
    public byte[] takeSnapshot() {
        try {
            ExecutionSnapshot snapshot = new ExecutionSnapshot(findAll());
            byte[] data = objectMapper.writeValueAsBytes(snapshot);
            logger.info("Created execution snapshot: size={}bytes, executions={}", data.length,
                    snapshot.getExecutions().size());
            return data;
        } catch (IOException e) {
            logger.error("Failed to create execution snapshot: executions={}", executions.size(), e);
            throw new StateStoreException("Failed to create execution snapshot", e);
        }
    }

    @Override
    public void restoreSnapshot(byte[] snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        try {
            ExecutionSnapshot restored = objectMapper.readValue(snapshot, ExecutionSnapshot.class);
            if (restored.getFormatVersion() > ExecutionSnapshot.FORMAT_VERSION) {
                throw new StateStoreException("Unsupported snapshot format version: " + restored.getFormatVersion());
            }
            executions.clear();
            for (ExecutionState state : restored.getExecutions()) {
                executions.put(state.getExecutionId(), state);
            }
            logger.info("Restored execution snapshot: executions={}, taken at {}",
                    executions.size(), restored.getTimestamp());
        } catch (IOException e) {
            logger.error("Failed to restore execution snapshot: size={}bytes, error={}", snapshot.length, e.getMessage());
            throw new StateStoreException("Failed to restore execution snapshot", e);
        }
    }

    @Override
    public void snapshotTo(Path file) {
        Objects.requireNonNull(file, "Snapshot file cannot be null");
        byte[] data = takeSnapshot();
        Path dir = file.toAbsolutePath().getParent();
        try {
            if (dir != null) {
                Files.createDirectories(dir);
            }
            Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            try {
                Files.write(tmp, data);
                Files.move(tmp, file,
                        StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
            logger.info("Wrote execution snapshot to {}", file);
        } catch (IOException e) {
            throw new StateStoreException("Failed to write execution snapshot to " + file, e);
        }
    }

    @Override
    public void restoreFrom(Path file) {
        Objects.requireNonNull(file, "Snapshot file cannot be null");
        try {
            restoreSnapshot(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new StateStoreException("Failed to read execution snapshot from " + file, e);
        }
    }
}
