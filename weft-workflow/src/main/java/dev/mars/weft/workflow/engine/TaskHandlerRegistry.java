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

package dev.mars.weft.workflow.engine;

import dev.mars.weft.workflow.TaskDefinition;
import dev.mars.weft.workflow.TaskExecutable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named task handlers, so that workflows loaded from JSON or YAML can refer to executables
 * by name. Handler names are case-insensitive.
 */
public class TaskHandlerRegistry {
    private static final Logger logger = LoggerFactory.getLogger(TaskHandlerRegistry.class);

    private final Map<String, TaskExecutable> handlers = new ConcurrentHashMap<>();

    public void registerHandler(String name, TaskExecutable handler) {
        Objects.requireNonNull(name, "Handler name cannot be null");
        Objects.requireNonNull(handler, "Handler cannot be null");
        TaskExecutable previous = handlers.put(name.toLowerCase(Locale.ROOT), handler);
        if (previous != null) {
            logger.info("Replaced task handler: {}", name);
        } else {
            logger.info("Registered task handler: {}", name);
        }
    }

    public Optional<TaskExecutable> getHandler(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(name.toLowerCase(Locale.ROOT)));
    }

    public boolean isHandlerRegistered(String name) {
        return getHandler(name).isPresent();
    }

    public Set<String> getHandlerNames() {
        return new TreeSet<>(handlers.keySet());
    }

    public void unregisterHandler(String name) {
        if (name != null && handlers.remove(name.toLowerCase(Locale.ROOT)) != null) {
            logger.info("Unregistered task handler: {}", name);
        }
    }

    /**
     * The task's inline executable if it has one, otherwise its named handler.
     */
    public Optional<TaskExecutable> resolve(TaskDefinition task) {
        if (task.getExecutable() != null) {
            return Optional.of(task.getExecutable());
        }
        return getHandler(task.getHandler());
    }
}
