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

import dev.mars.weft.core.ResultCode;
import dev.mars.weft.core.exceptions.WeftException;

/**
 * Failure reported by the resource access layer. The result code is the one the layer
 * returned, for example {@link ResultCode#PERMISSION_DENIED} or {@link ResultCode#NOT_SUPPORTED}.
 */
public class ResourceAccessException extends WeftException {

    public ResourceAccessException(ResultCode resultCode, String message) {
        super(resultCode, message);
    }

    public ResourceAccessException(ResultCode resultCode, String message, Throwable cause) {
        super(resultCode, message, cause);
    }
}
