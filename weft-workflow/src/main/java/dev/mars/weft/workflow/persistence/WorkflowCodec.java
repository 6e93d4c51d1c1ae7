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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.mars.weft.core.exceptions.InvalidParameterException;
import dev.mars.weft.workflow.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.DumperOptions;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.representer.Representer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Reads and writes workflow definitions as JSON or YAML.
 *
 * <p>Both formats share one structure: YAML documents are loaded with SnakeYAML's
 * {@link SafeConstructor} into plain maps and bound through Jackson, so a definition
 * exported in either format imports to an equal definition. Inline executables are
 * never serialized.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-12
 * @version 1.0
 */
public class WorkflowCodec {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowCodec.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() { };

    public enum Format {
        JSON,
        YAML;

        /**
         * Picks the format from a file extension. Anything other than .yaml or .yml is JSON.
         */
        public static Format forPath(Path path) {
            Path fileName = path.getFileName();
            String name = fileName != null ? fileName.toString().toLowerCase(Locale.ROOT) : "";
            return name.endsWith(".yaml") || name.endsWith(".yml") ? YAML : JSON;
        }
    }

    private final ObjectMapper objectMapper;

    public WorkflowCodec() {
        this(JacksonConfig.createObjectMapper());
    }

    public WorkflowCodec(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "ObjectMapper cannot be null");
    }

    public String toJson(WorkflowDefinition workflow) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(workflow);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize workflow '" + workflow.getName() + "'", e);
        }
    }

    public WorkflowDefinition fromJson(String json) throws InvalidParameterException {
        if (json == null || json.isBlank()) {
            throw new InvalidParameterException("Empty workflow document");
        }
        try {
            return objectMapper.readValue(json, WorkflowDefinition.class);
        } catch (JsonProcessingException e) {
            throw new InvalidParameterException("Invalid workflow JSON: " + e.getOriginalMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException("Invalid workflow definition: " + e.getMessage(), e);
        }
    }

    public String toYaml(WorkflowDefinition workflow) {
        Map<String, Object> tree = objectMapper.convertValue(workflow, MAP_TYPE);
        return dumper().dump(tree);
    }

    public WorkflowDefinition fromYaml(String yamlContent) throws InvalidParameterException {
        Object data;
        try {
            data = new Yaml(new SafeConstructor(new LoaderOptions())).load(yamlContent);
        } catch (YAMLException e) {
            throw new InvalidParameterException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (!(data instanceof Map<?, ?>)) {
            throw new InvalidParameterException("Empty or invalid YAML content");
        }
        try {
            return objectMapper.convertValue(data, WorkflowDefinition.class);
        } catch (IllegalArgumentException e) {
            throw new InvalidParameterException("Invalid workflow definition: " + rootMessage(e), e);
        }
    }

    public String encode(WorkflowDefinition workflow, Format format) {
        return format == Format.YAML ? toYaml(workflow) : toJson(workflow);
    }

    public WorkflowDefinition decode(String content, Format format) throws InvalidParameterException {
        return format == Format.YAML ? fromYaml(content) : fromJson(content);
    }

    /**
     * Writes the workflow to {@code path}, choosing the format from its extension.
     */
    public void write(WorkflowDefinition workflow, Path path) throws IOException {
        Format format = Format.forPath(path);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, encode(workflow, format), StandardCharsets.UTF_8);
        logger.debug("Wrote workflow '{}' to {} as {}", workflow.getName(), path, format);
    }

    /**
     * Reads a workflow from {@code path}, choosing the format from its extension.
     */
    public WorkflowDefinition read(Path path) throws IOException, InvalidParameterException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        return decode(content, Format.forPath(path));
    }

    private static Yaml dumper() {
        DumperOptions options = new DumperOptions();
        options.setDefaultFlowStyle(DumperOptions.FlowStyle.BLOCK);
        options.setIndent(2);
        options.setPrettyFlow(true);
        return new Yaml(new Representer(options), options);
    }

    private static String rootMessage(Throwable t) {
        Throwable root = t;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
