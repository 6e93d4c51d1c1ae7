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

package dev.mars.weft.core;

/**
 * Numeric result codes shared by the engine and the resource layer it calls into.
 *
 * <p>The integer values are stable and can be exchanged with collaborators that
 * report plain status codes. Zero is success, every failure is negative.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public enum ResultCode {

    SUCCESS(0, "Success"),
    ERROR(-1, "Generic error"),
    INVALID_HANDLE(-2, "Invalid handle"),
    PERMISSION_DENIED(-3, "Permission denied"),
    NOT_FOUND(-4, "Not found"),
    ALREADY_EXISTS(-5, "Already exists"),
    TIMEOUT(-6, "Timed out"),
    INVALID_PARAM(-7, "Invalid parameter"),
    OUT_OF_MEMORY(-8, "Out of memory"),
    NOT_SUPPORTED(-9, "Not supported");

    private final int code;
    private final String description;

    ResultCode(int code, String description) {
        this.code = code;
        this.description = description;
    }

    public int code() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public boolean isSuccess() {
        return this == SUCCESS;
    }

    /**
     * Maps a raw status code back to its enum constant. Unknown codes map to {@link #ERROR}.
     *
     * @param code the raw code
     * @return the matching result code
     */
    public static ResultCode fromCode(int code) {
        for (ResultCode rc : values()) {
            if (rc.code == code) {
                return rc;
            }
        }
        return ERROR;
    }
}
