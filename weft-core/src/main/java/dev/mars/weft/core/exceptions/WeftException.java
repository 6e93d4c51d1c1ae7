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

import java.util.Objects;

/**
 * Base exception class for all Weft checked exceptions.
 * Every failure carries the {@link ResultCode} a caller would see at the API boundary.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class WeftException extends Exception {

    private final ResultCode resultCode;

    public WeftException(ResultCode resultCode, String message) {
        super(message);
        this.resultCode = Objects.requireNonNull(resultCode, "Result code cannot be null");
    }

    public WeftException(ResultCode resultCode, String message, Throwable cause) {
        super(message, cause);
        this.resultCode = Objects.requireNonNull(resultCode, "Result code cannot be null");
    }

    public ResultCode getResultCode() {
        return resultCode;
    }
}
