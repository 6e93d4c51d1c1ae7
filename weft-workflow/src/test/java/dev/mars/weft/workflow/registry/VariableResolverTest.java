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

package dev.mars.weft.workflow.registry;

import dev.mars.weft.workflow.TaskDefinition;
import dev.mars.weft.workflow.WorkflowDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Description for VariableResolverTest
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-15
 */
class VariableResolverTest {

    private VariableResolver resolver;

    @BeforeEach
    void setUp() {
        Map<String, String> defaults = Map.of(
                "baseUrl", "https://example.com",
                "outputDir", "/tmp/downloads",
                "version", "1.0"
        );
        resolver = new VariableResolver(defaults, Map.of());
    }

    @Test
    void testSimpleVariableResolution() {
        assertEquals("https://example.com/file.txt", resolver.resolve("{{baseUrl}}/file.txt"));
    }

    @Test
    void testMultipleVariableResolution() {
        String result = resolver.resolve("{{baseUrl}}/v{{version}}/{{outputDir}}/file.txt");
        assertEquals("https://example.com/v1.0//tmp/downloads/file.txt", result);
    }

    @Test
    void testWhitespaceInsideBracesIgnored() {
        assertEquals("1.0", resolver.resolve("{{ version }}"));
    }

    @Test
    void testOverridesWinOverDefaults() {
        VariableResolver overriding = new VariableResolver(
                Map.of("baseUrl", "https://example.com"), Map.of("baseUrl", "https://test.com"));

        assertEquals("https://test.com/file.txt", overriding.resolve("{{baseUrl}}/file.txt"));
        assertEquals(Map.of("baseUrl", "https://test.com"), overriding.getAllVariables());
    }

    @Test
    void testNoVariables() {
        assertEquals("plain text without variables", resolver.resolve("plain text without variables"));
        assertNull(resolver.resolve((String) null));
    }

    @Test
    void testUnknownVariableFails() {
        VariableResolver.VariableResolutionException e = assertThrows(
                VariableResolver.VariableResolutionException.class,
                () -> resolver.resolve("{{missing}}"));

        assertEquals("Variable not found: missing", e.getMessage());
    }

    @Test
    void testReplacementValuesAreLiteral() {
        VariableResolver special = new VariableResolver(Map.of("price", "$5 \\ each"), null);

        assertEquals("costs $5 \\ each", special.resolve("costs {{price}}"));
    }

    @Test
    void testVariableNames() {
        assertTrue(resolver.hasVariables("{{a}} and {{b}}"));
        assertFalse(resolver.hasVariables("none"));
        assertFalse(resolver.hasVariables(null));
        assertEquals(List.of("b", "a"), List.copyOf(resolver.getVariableNames("{{b}}/{{a}}/{{b}}")));
        assertEquals(Set.of(), resolver.getVariableNames(null));
    }

    @Test
    void testResolveTaskLeavesStructureAlone() {
        TaskDefinition task = TaskDefinition.builder("download")
                .dependsOn("prepare")
                .handler("http")
                .parameter("url", "{{baseUrl}}/data.csv")
                .parameter("dest", "{{outputDir}}")
                .retryCount(2)
                .build();

        TaskDefinition resolved = resolver.resolve(task);

        assertEquals("download", resolved.getName());
        assertEquals(List.of("prepare"), resolved.getDependsOn());
        assertEquals("http", resolved.getHandler());
        assertEquals("https://example.com/data.csv", resolved.getParameters().get("url"));
        assertEquals("/tmp/downloads", resolved.getParameters().get("dest"));
        assertEquals(2, resolved.getRetryCount());
    }

    @Test
    void testResolveWorkflowUsesItsOwnVariablesOnlyThroughTheResolver() {
        WorkflowDefinition workflow = WorkflowDefinition.builder("fetch")
                .description("Fetch version {{version}}")
                .task(TaskDefinition.builder("get").parameter("url", "{{baseUrl}}"))
                .build();

        WorkflowDefinition resolved = resolver.resolve(workflow);

        assertEquals("Fetch version 1.0", resolved.getDescription());
        assertEquals("https://example.com", resolved.getTask("get").orElseThrow().getParameters().get("url"));
        assertEquals("1.0", resolved.getVariables().get("version"));
    }
}
