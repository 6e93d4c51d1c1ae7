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

package dev.mars.weft.workflow.persistence;

import dev.mars.weft.core.ResultCode;
import dev.mars.weft.core.exceptions.InvalidParameterException;
import dev.mars.weft.workflow.TaskDefinition;
import dev.mars.weft.workflow.TaskOutcome;
import dev.mars.weft.workflow.WorkflowDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link WorkflowCodec}.
 */
class WorkflowCodecTest {

    private final WorkflowCodec codec = new WorkflowCodec();

    private static WorkflowDefinition sample() {
        return WorkflowDefinition.builder("ingest")
                .version("2.1.0")
                .description("Ingest partner feeds")
                .variable("region", "eu-west")
                .task(TaskDefinition.builder("fetch").handler("resource")
                        .parameter("uri", "feed://partner/{{region}}")
                        .parameter("operation", "read")
                        .timeoutSeconds(120))
                .task(TaskDefinition.builder("parse").dependsOn("fetch").retryCount(3)
                        .executable(context -> TaskOutcome.success()))
                .build();
    }

    @ParameterizedTest
    @CsvSource({
            "flow.json, JSON",
            "flow.yaml, YAML",
            "FLOW.YML, YAML",
            "flow.txt, JSON",
            "flow, JSON"
    })
    void testFormatFromExtension(String fileName, WorkflowCodec.Format expected) {
        assertThat(WorkflowCodec.Format.forPath(Path.of(fileName))).isEqualTo(expected);
    }

    @Test
    void testJsonOmitsExecutables() {
        String json = codec.toJson(sample());

        assertThat(json)
                .contains("\"name\" : \"ingest\"")
                .contains("\"timeoutSeconds\" : 120")
                .doesNotContain("executable");
    }

    @Test
    void testYamlIsBlockStyle() throws Exception {
        String yaml = codec.toYaml(sample());

        assertThat(yaml).contains("name: ingest").contains("tasks:").contains("- name: fetch");
        WorkflowDefinition decoded = codec.fromYaml(yaml);
        assertThat(decoded).isEqualTo(sample());
        assertThat(decoded.getTask("parse").orElseThrow().getExecutable()).isNull();
    }

    @Test
    void testHandWrittenYaml() throws Exception {
        String yaml = """
                name: backup
                description: Nightly backup
                tasks:
                  - name: snapshot
                    handler: resource
                    parameters:
                      uri: db://main
                      limit: 10
                  - name: upload
                    dependsOn: [snapshot]
                    retryCount: 2
                """;

        WorkflowDefinition workflow = codec.fromYaml(yaml);

        assertThat(workflow.getVersion()).isEqualTo(WorkflowDefinition.DEFAULT_VERSION);
        assertThat(workflow.isEnabled()).isTrue();
        assertThat(workflow.getTaskNames()).containsExactly("snapshot", "upload");
        assertThat(workflow.getTask("snapshot").orElseThrow().getParameters()).containsEntry("limit", "10");
        assertThat(workflow.getTask("upload").orElseThrow().getDependsOn()).containsExactly("snapshot");
    }

    @Test
    void testInvalidDocumentsRejected() {
        assertThatThrownBy(() -> codec.fromYaml("name: [unclosed"))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> codec.fromYaml("- just\n- a list\n"))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("Empty or invalid");
        assertThatThrownBy(() -> codec.fromYaml("description: no name\n"))
                .isInstanceOf(InvalidParameterException.class)
                .satisfies(e -> assertThat(((InvalidParameterException) e).getResultCode())
                        .isEqualTo(ResultCode.INVALID_PARAM));
        assertThatThrownBy(() -> codec.fromJson("   "))
                .isInstanceOf(InvalidParameterException.class);
        assertThatThrownBy(() -> codec.fromJson("{\"name\":\"x\",\"tasks\":[{\"name\":\"a\"},{\"name\":\"a\"}]}"))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("Duplicate task name");
    }
}
