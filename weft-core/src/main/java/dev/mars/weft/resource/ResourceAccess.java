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

package dev.mars.weft.resource;

/**
 * Uniform access to heterogeneous resources such as sensors, actuators and services.
 *
 * <p>The engine never calls this interface itself. Task executables do, and translate the
 * {@link ResourceAccessException} result codes into their own outcome. Implementations live
 * outside this project.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public interface ResourceAccess {

    /**
     * Opens a resource.
     *
     * @param uri  the resource URI
     * @param mode how the resource will be used
     * @return a handle that must be passed to {@link #close}
     * @throws ResourceAccessException with NOT_FOUND, PERMISSION_DENIED or INVALID_PARAM
     */
    ResourceHandle open(String uri, AccessMode mode) throws ResourceAccessException;

    void close(ResourceHandle handle) throws ResourceAccessException;

    /**
     * Reads up to {@code maxBytes} bytes. An empty array means no data is available.
     */
    byte[] read(ResourceHandle handle, int maxBytes) throws ResourceAccessException;

    /**
     * Writes the data and returns the number of bytes accepted.
     */
    int write(ResourceHandle handle, byte[] data) throws ResourceAccessException;

    String getAttribute(ResourceHandle handle, String key) throws ResourceAccessException;

    void setAttribute(ResourceHandle handle, String key, String value) throws ResourceAccessException;

    /**
     * Invokes a named action on the resource.
     *
     * @param handle   the open handle
     * @param action   the action name, for example {@code "calibrate"}
     * @param argsJson action arguments as a JSON document, may be {@code null}
     * @return the action's JSON response, may be {@code null}
     */
    String invoke(ResourceHandle handle, String action, String argsJson) throws ResourceAccessException;
}
