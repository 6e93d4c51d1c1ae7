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

package dev.mars.weft.core.exceptions;

import dev.mars.weft.core.ResultCode;

/**
 * Thrown for malformed input: bad task graphs, unresolved template references,
 * tasks without an executable and similar caller errors.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class InvalidParameterException extends WeftException {

    public InvalidParameterException(String message) {
        super(ResultCode.INVALID_PARAM, message);
    }

    public InvalidParameterException(String message, Throwable cause) {
        super(ResultCode.INVALID_PARAM, message, cause);
    }
}
