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

import java.util.Objects;

/**
 * Opaque handle to an open resource, issued by {@link ResourceAccess#open}.
 *
 * @param id  the collaborator-assigned handle id
 * @param uri the resource the handle refers to
 */
public record ResourceHandle(int id, String uri) {

    public ResourceHandle {
        Objects.requireNonNull(uri, "URI cannot be null");
    }
}
