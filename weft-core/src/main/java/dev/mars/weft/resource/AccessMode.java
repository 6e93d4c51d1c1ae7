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
 * Access modes accepted by {@link ResourceAccess#open}. Each mode has a short symbolic form
 * used in task parameters.
 */
public enum AccessMode {
    READ("r"),
    WRITE("w"),
    READ_WRITE("rw"),
    APPEND("a"),
    CREATE("c"),
    EXECUTE("x");

    private final String symbol;

    AccessMode(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean allowsRead() {
        return this == READ || this == READ_WRITE;
    }

    public boolean allowsWrite() {
        return this == WRITE || this == READ_WRITE || this == APPEND || this == CREATE;
    }

    /**
     * Parses either the symbolic form ({@code "rw"}) or the constant name ({@code "READ_WRITE"}).
     *
     * @throws IllegalArgumentException if the value matches neither
     */
    public static AccessMode parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Access mode cannot be blank");
        }
        String trimmed = value.trim();
        for (AccessMode mode : values()) {
            if (mode.symbol.equalsIgnoreCase(trimmed) || mode.name().equalsIgnoreCase(trimmed)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown access mode: " + value);
    }
}
