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

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InvalidTransitionException.
 */
class InvalidTransitionExceptionTest {

    private enum Phase { IDLE, ACTIVE, DONE }

    @Test
    void constructor_withEntityId_formatsMessage() {
        Phase[] validTransitions = {Phase.ACTIVE, Phase.DONE};

        InvalidTransitionException ex = new InvalidTransitionException(
                "exec-123", Phase.IDLE, Phase.IDLE, validTransitions);

        assertEquals("Invalid transition for 'exec-123': IDLE → IDLE. Valid targets: [ACTIVE, DONE]",
                ex.getMessage());
        assertEquals("exec-123", ex.getEntityId());
        assertEquals(Phase.IDLE, ex.getCurrentState());
        assertEquals(Phase.IDLE, ex.getRequestedState());
        assertEquals(2, ex.getValidTransitions().length);
    }

    @Test
    void constructor_withEmptyTransitions_formatsEmptyArray() {
        InvalidTransitionException ex = new InvalidTransitionException(
                "exec-456", Phase.DONE, Phase.ACTIVE, new Phase[0]);

        assertTrue(ex.getMessage().endsWith("[]"));
        assertEquals(0, ex.getValidTransitions().length);
    }

    @Test
    void constructor_withNullTransitions_treatedAsEmpty() {
        InvalidTransitionException ex = new InvalidTransitionException(
                "exec-789", Phase.DONE, Phase.ACTIVE, null);

        assertTrue(ex.getMessage().endsWith("[]"));
        assertEquals(0, ex.getValidTransitions().length);
    }

    @Test
    void carriesInvalidParamResultCode() {
        InvalidTransitionException ex = new InvalidTransitionException(
                "exec-1", Phase.DONE, Phase.IDLE, new Phase[0]);

        assertInstanceOf(WeftException.class, ex);
        assertEquals(ResultCode.INVALID_PARAM, ex.getResultCode());
    }
}
