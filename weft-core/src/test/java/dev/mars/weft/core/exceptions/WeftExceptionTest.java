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
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class WeftExceptionTest {

    @Test
    void notFoundNamesTypeAndId() {
        NotFoundException ex = new NotFoundException("Workflow", "nightly-build");

        assertThat(ex.getResultCode()).isEqualTo(ResultCode.NOT_FOUND);
        assertThat(ex.getMessage()).isEqualTo("Workflow not found: nightly-build");
        assertThat(ex.getResourceType()).isEqualTo("Workflow");
        assertThat(ex.getResourceId()).isEqualTo("nightly-build");
    }

    @Test
    void notFoundWithDetailAppendsDetail() {
        NotFoundException ex = new NotFoundException("Workflow", "w1", "disabled");

        assertThat(ex.getMessage()).isEqualTo("Workflow not found: w1 (disabled)");
    }

    @Test
    void alreadyExistsCarriesCode() {
        AlreadyExistsException ex = new AlreadyExistsException("Task", "A");

        assertThat(ex.getResultCode()).isEqualTo(ResultCode.ALREADY_EXISTS);
        assertThat(ex.getMessage()).contains("Task").contains("A");
    }

    @Test
    void invalidParameterKeepsCause() {
        IllegalStateException cause = new IllegalStateException("boom");
        InvalidParameterException ex = new InvalidParameterException("bad input", cause);

        assertThat(ex.getResultCode()).isEqualTo(ResultCode.INVALID_PARAM);
        assertThat(ex).hasCause(cause);
    }

    @Test
    void stateStoreExceptionIsUnchecked() {
        assertThat(new StateStoreException("disk full")).isInstanceOf(RuntimeException.class);
    }
}
