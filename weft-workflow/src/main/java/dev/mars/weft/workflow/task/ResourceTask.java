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

package dev.mars.weft.workflow.task;

import dev.mars.weft.core.ResultCode;
import dev.mars.weft.resource.AccessMode;
import dev.mars.weft.resource.ResourceAccess;
import dev.mars.weft.resource.ResourceAccessException;
import dev.mars.weft.resource.ResourceHandle;
import dev.mars.weft.workflow.TaskContext;
import dev.mars.weft.workflow.TaskExecutable;
import dev.mars.weft.workflow.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Task that performs one operation on a resource reached through {@link ResourceAccess}.
 *
 * <p>Task parameters:</p>
 * <ul>
 *   <li>{@code uri} - resource to open (required)</li>
 *   <li>{@code operation} - {@code invoke} (default), {@code read}, {@code write},
 *       {@code getattr} or {@code setattr}</li>
 *   <li>{@code mode} - access mode symbol or name; defaults to what the operation needs</li>
 *   <li>{@code action}, {@code args} - for {@code invoke}; args default to {@code {}}</li>
 *   <li>{@code key}, {@code value} - for {@code getattr} and {@code setattr}</li>
 *   <li>{@code data} - UTF-8 payload for {@code write}</li>
 *   <li>{@code maxBytes} - read limit, default {@value #DEFAULT_MAX_BYTES}</li>
 * </ul>
 *
 * <p>The handle is always closed. Errors from the resource layer become a failed outcome
 * carrying the resource's {@link ResultCode}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-13
 * @version 1.0
 */
public class ResourceTask implements TaskExecutable {

    private static final Logger logger = LoggerFactory.getLogger(ResourceTask.class);

    /** Name under which this task is usually registered as a handler. */
    public static final String HANDLER_NAME = "resource";
    public static final int DEFAULT_MAX_BYTES = 65536;

    public enum Operation {
        INVOKE(AccessMode.READ_WRITE),
        READ(AccessMode.READ),
        WRITE(AccessMode.WRITE),
        GETATTR(AccessMode.READ),
        SETATTR(AccessMode.WRITE);

        private final AccessMode defaultMode;

        Operation(AccessMode defaultMode) {
            this.defaultMode = defaultMode;
        }

        public AccessMode getDefaultMode() {
            return defaultMode;
        }

        boolean isPermittedBy(AccessMode mode) {
            return switch (this) {
                case READ, GETATTR -> mode.allowsRead();
                case WRITE, SETATTR -> mode.allowsWrite();
                case INVOKE -> true;
            };
        }
    }

    private final ResourceAccess resourceAccess;

    public ResourceTask(ResourceAccess resourceAccess) {
        this.resourceAccess = Objects.requireNonNull(resourceAccess, "Resource access cannot be null");
    }

    @Override
    public TaskOutcome execute(TaskContext context) {
        String uri = context.getParameter("uri");
        if (uri == null || uri.isBlank()) {
            return TaskOutcome.failure(ResultCode.INVALID_PARAM, "Missing required parameter 'uri'");
        }

        Operation operation;
        AccessMode mode;
        try {
            operation = Operation.valueOf(context.getParameter("operation", "invoke").trim().toUpperCase(Locale.ROOT));
            String modeParam = context.getParameter("mode");
            mode = modeParam != null ? AccessMode.parse(modeParam) : operation.getDefaultMode();
        } catch (IllegalArgumentException e) {
            return TaskOutcome.failure(ResultCode.INVALID_PARAM, e.getMessage());
        }
        if (!operation.isPermittedBy(mode)) {
            return TaskOutcome.failure(ResultCode.INVALID_PARAM,
                    "Operation " + operation + " is not permitted with access mode " + mode);
        }
        if (context.isCancelled()) {
            return TaskOutcome.failure(ResultCode.ERROR, "Cancelled before opening " + uri);
        }

        ResourceHandle handle;
        try {
            handle = resourceAccess.open(uri, mode);
        } catch (ResourceAccessException e) {
            return TaskOutcome.failure(e.getResultCode(), "open " + uri + ": " + e.getMessage());
        }
        logger.debug("Task '{}' opened {} as handle {} ({})", context.getTaskName(), uri, handle.id(), mode);

        TaskOutcome outcome = null;
        try {
            outcome = perform(operation, handle, context);
        } catch (ResourceAccessException e) {
            outcome = TaskOutcome.failure(e.getResultCode(),
                    operation.name().toLowerCase(Locale.ROOT) + " " + uri + ": " + e.getMessage());
        } finally {
            TaskOutcome closeFailure = close(handle, uri);
            if (closeFailure != null && outcome != null && outcome.isSuccess()) {
                outcome = closeFailure;
            }
        }
        return outcome;
    }

    /**
     * Closes the handle, returning the failure to report if the close did not succeed.
     */
    private TaskOutcome close(ResourceHandle handle, String uri) {
        try {
            resourceAccess.close(handle);
            return null;
        } catch (ResourceAccessException e) {
            logger.warn("Failed to close handle {} for {}: {}", handle.id(), uri, e.getMessage());
            return TaskOutcome.failure(e.getResultCode(), "close " + uri + ": " + e.getMessage());
        }
    }

    private TaskOutcome perform(Operation operation, ResourceHandle handle, TaskContext context)
            throws ResourceAccessException {
        switch (operation) {
            case INVOKE: {
                String action = context.getParameter("action");
                if (action == null || action.isBlank()) {
                    return TaskOutcome.failure(ResultCode.INVALID_PARAM, "Missing required parameter 'action'");
                }
                String response = resourceAccess.invoke(handle, action, context.getParameter("args", "{}"));
                return TaskOutcome.success(response);
            }
            case READ: {
                int maxBytes;
                try {
                    maxBytes = Integer.parseInt(context.getParameter("maxBytes", String.valueOf(DEFAULT_MAX_BYTES)));
                } catch (NumberFormatException e) {
                    return TaskOutcome.failure(ResultCode.INVALID_PARAM, "Invalid maxBytes: " + e.getMessage());
                }
                byte[] data = resourceAccess.read(handle, maxBytes);
                return TaskOutcome.success(new String(data, StandardCharsets.UTF_8));
            }
            case WRITE: {
                byte[] data = context.getParameter("data", "").getBytes(StandardCharsets.UTF_8);
                int written = resourceAccess.write(handle, data);
                return TaskOutcome.success("wrote " + written + " bytes");
            }
            case GETATTR: {
                String key = context.getParameter("key");
                if (key == null) {
                    return TaskOutcome.failure(ResultCode.INVALID_PARAM, "Missing required parameter 'key'");
                }
                return TaskOutcome.success(resourceAccess.getAttribute(handle, key));
            }
            case SETATTR: {
                String key = context.getParameter("key");
                String value = context.getParameter("value");
                if (key == null || value == null) {
                    return TaskOutcome.failure(ResultCode.INVALID_PARAM, "Parameters 'key' and 'value' are required");
                }
                resourceAccess.setAttribute(handle, key, value);
                return TaskOutcome.success(key + " set");
            }
            default:
                return TaskOutcome.failure(ResultCode.NOT_SUPPORTED, "Unsupported operation " + operation);
        }
    }
}
