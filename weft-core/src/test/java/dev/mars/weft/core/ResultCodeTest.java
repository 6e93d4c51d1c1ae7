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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class ResultCodeTest {

    @ParameterizedTest
    @EnumSource(ResultCode.class)
    void fromCodeRoundTripsEveryConstant(ResultCode rc) {
        assertEquals(rc, ResultCode.fromCode(rc.code()));
    }

    @Test
    void codesMatchTheCollaboratorSurface() {
        assertEquals(0, ResultCode.SUCCESS.code());
        assertEquals(-1, ResultCode.ERROR.code());
        assertEquals(-4, ResultCode.NOT_FOUND.code());
        assertEquals(-6, ResultCode.TIMEOUT.code());
        assertEquals(-9, ResultCode.NOT_SUPPORTED.code());
    }

    @Test
    void unknownCodeMapsToError() {
        assertEquals(ResultCode.ERROR, ResultCode.fromCode(-42));
        assertEquals(ResultCode.ERROR, ResultCode.fromCode(7));
    }

    @Test
    void onlySuccessIsSuccess() {
        assertTrue(ResultCode.SUCCESS.isSuccess());
        assertFalse(ResultCode.TIMEOUT.isSuccess());
    }
}
