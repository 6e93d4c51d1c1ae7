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

package dev.mars.weft.workflow.task;

import dev.mars.weft.core.ResultCode;
import dev.mars.weft.resource.AccessMode;
import dev.mars.weft.resource.ResourceAccess;
import dev.mars.weft.resource.ResourceAccessException;
import dev.mars.weft.resource.ResourceHandle;
import dev.mars.weft.workflow.CancellationToken;
import dev.mars.weft.workflow.TaskContext;
import dev.mars.weft.workflow.TaskOutcome;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link ResourceTask} against a mocked {@link ResourceAccess}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-16
 * @version 1.0
 */
@ExtendWith(MockitoExtension.class)
class ResourceTaskTest {

    private static final String URI = "dev://lab/oven-1";
    private static final ResourceHandle HANDLE = new ResourceHandle(7, URI);

    @Mock
    private ResourceAccess resourceAccess;

    private static TaskContext context(String... keyValues) {
        return context(new CancellationToken(), keyValues);
    }

    private static TaskContext context(CancellationToken token, String... keyValues) {
        Map<String, String> parameters = new HashMap<>();
        parameters.put("uri", URI);
        for (int i = 0; i < keyValues.length; i += 2) {
            parameters.put(keyValues[i], keyValues[i + 1]);
        }
        return new TaskContext("exec-1", "lab", "step", 1, parameters, Map.of(), null, token);
    }

    // ========== Operation Tests ==========

    @Test
    void testInvokeDefaultsArgumentsAndClosesHandle() throws Exception {
        when(resourceAccess.open(URI, AccessMode.READ_WRITE)).thenReturn(HANDLE);
        when(resourceAccess.invoke(HANDLE, "calibrate", "{}")).thenReturn("{\"ok\":true}");

        TaskOutcome outcome = new ResourceTask(resourceAccess).execute(context("action", "calibrate"));

        assertTrue(outcome.isSuccess());
        assertEquals("{\"ok\":true}", outcome.getMessage());
        InOrder order = inOrder(resourceAccess);
        order.verify(resourceAccess).open(URI, AccessMode.READ_WRITE);
        order.verify(resourceAccess).invoke(HANDLE, "calibrate", "{}");
        order.verify(resourceAccess).close(HANDLE);
    }

    @Test
    void testReadHonoursMaxBytes() throws Exception {
        when(resourceAccess.open(URI, AccessMode.READ)).thenReturn(HANDLE);
        when(resourceAccess.read(HANDLE, 16)).thenReturn("21.5C".getBytes(StandardCharsets.UTF_8));

        TaskOutcome outcome = new ResourceTask(resourceAccess)
                .execute(context("operation", "read", "maxBytes", "16"));

        assertTrue(outcome.isSuccess());
        assertEquals("21.5C", outcome.getMessage());
        verify(resourceAccess).close(HANDLE);
    }

    @Test
    void testWriteReportsBytesAccepted() throws Exception {
        when(resourceAccess.open(URI, AccessMode.WRITE)).thenReturn(HANDLE);
        when(resourceAccess.write(eq(HANDLE), any())).thenReturn(4);

        TaskOutcome outcome = new ResourceTask(resourceAccess)
                .execute(context("operation", "WRITE", "data", "heat"));

        assertEquals("wrote 4 bytes", outcome.getMessage());
        verify(resourceAccess).write(HANDLE, "heat".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void testAttributes() throws Exception {
        when(resourceAccess.open(anyString(), any())).thenReturn(HANDLE);
        when(resourceAccess.getAttribute(HANDLE, "setpoint")).thenReturn("180");
        ResourceTask task = new ResourceTask(resourceAccess);

        assertEquals("180", task.execute(context("operation", "getattr", "key", "setpoint")).getMessage());
        assertEquals("setpoint set",
                task.execute(context("operation", "setattr", "key", "setpoint", "value", "200")).getMessage());

        verify(resourceAccess).open(URI, AccessMode.READ);
        verify(resourceAccess).open(URI, AccessMode.WRITE);
        verify(resourceAccess).setAttribute(HANDLE, "setpoint", "200");
        verify(resourceAccess, times(2)).close(HANDLE);
    }

    // ========== Parameter Validation Tests ==========

    @ParameterizedTest
    @CsvSource({
            "operation, format",
            "mode, sideways",
            "maxBytes, lots"
    })
    void testInvalidParametersRejected(String key, String value) throws Exception {
        lenient().when(resourceAccess.open(anyString(), any())).thenReturn(HANDLE);

        TaskOutcome outcome = new ResourceTask(resourceAccess)
                .execute(context("operation", "read", key, value));

        assertFalse(outcome.isSuccess());
        assertEquals(ResultCode.INVALID_PARAM, outcome.getResultCode());
    }

    @Test
    void testMissingUriNeverOpens() throws Exception {
        TaskContext noUri = new TaskContext("exec-1", "lab", "step", 1, Map.of(), Map.of(), null,
                new CancellationToken());

        TaskOutcome outcome = new ResourceTask(resourceAccess).execute(noUri);

        assertEquals(ResultCode.INVALID_PARAM, outcome.getResultCode());
        verifyNoInteractions(resourceAccess);
    }

    @Test
    void testModeMustPermitOperation() {
        TaskOutcome outcome = new ResourceTask(resourceAccess)
                .execute(context("operation", "write", "mode", "r"));

        assertEquals(ResultCode.INVALID_PARAM, outcome.getResultCode());
        assertTrue(outcome.getMessage().contains("not permitted"));
        verifyNoInteractions(resourceAccess);
    }

    @Test
    void testMissingActionStillClosesHandle() throws Exception {
        when(resourceAccess.open(URI, AccessMode.READ_WRITE)).thenReturn(HANDLE);

        TaskOutcome outcome = new ResourceTask(resourceAccess).execute(context());

        assertEquals(ResultCode.INVALID_PARAM, outcome.getResultCode());
        verify(resourceAccess).close(HANDLE);
    }

    @Test
    void testCancelledBeforeOpen() {
        CancellationToken token = new CancellationToken();
        token.cancel("stopped");

        TaskOutcome outcome = new ResourceTask(resourceAccess).execute(context(token, "action", "calibrate"));

        assertFalse(outcome.isSuccess());
        verifyNoInteractions(resourceAccess);
    }

    // ========== Error Mapping Tests ==========

    @Test
    void testOpenFailureKeepsResultCode() throws Exception {
        when(resourceAccess.open(URI, AccessMode.READ_WRITE))
                .thenThrow(new ResourceAccessException(ResultCode.PERMISSION_DENIED, "locked by operator"));

        TaskOutcome outcome = new ResourceTask(resourceAccess).execute(context("action", "calibrate"));

        assertEquals(ResultCode.PERMISSION_DENIED, outcome.getResultCode());
        assertEquals("open " + URI + ": locked by operator", outcome.getMessage());
        verify(resourceAccess, never()).close(any());
    }

    @Test
    void testOperationFailureClosesHandle() throws Exception {
        when(resourceAccess.open(URI, AccessMode.READ_WRITE)).thenReturn(HANDLE);
        when(resourceAccess.invoke(HANDLE, "calibrate", "{\"t\":1}"))
                .thenThrow(new ResourceAccessException(ResultCode.NOT_SUPPORTED, "no such action"));

        TaskOutcome outcome = new ResourceTask(resourceAccess)
                .execute(context("action", "calibrate", "args", "{\"t\":1}"));

        assertEquals(ResultCode.NOT_SUPPORTED, outcome.getResultCode());
        assertEquals("invoke " + URI + ": no such action", outcome.getMessage());
        verify(resourceAccess).close(HANDLE);
    }

    @Test
    void testUnexpectedErrorStillClosesHandle() throws Exception {
        when(resourceAccess.open(URI, AccessMode.READ_WRITE)).thenReturn(HANDLE);
        when(resourceAccess.invoke(HANDLE, "calibrate", "{}")).thenThrow(new IllegalStateException("driver bug"));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> new ResourceTask(resourceAccess).execute(context("action", "calibrate")));

        assertEquals("driver bug", e.getMessage());
        verify(resourceAccess).close(HANDLE);
    }

    @Test
    void testCloseFailureFailsSuccessfulOperation() throws Exception {
        when(resourceAccess.open(URI, AccessMode.READ)).thenReturn(HANDLE);
        when(resourceAccess.read(HANDLE, ResourceTask.DEFAULT_MAX_BYTES)).thenReturn(new byte[0]);
        doThrow(new ResourceAccessException(ResultCode.ERROR, "bus reset")).when(resourceAccess).close(HANDLE);

        TaskOutcome outcome = new ResourceTask(resourceAccess).execute(context("operation", "read"));

        assertFalse(outcome.isSuccess());
        assertEquals("close " + URI + ": bus reset", outcome.getMessage());
    }
}
