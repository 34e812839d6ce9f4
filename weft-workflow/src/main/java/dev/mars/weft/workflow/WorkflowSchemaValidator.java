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

package dev.mars.weft.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;

/**
 * Validates a loaded workflow document against the bundled {@code workflow-schema.json}
 * (JSON Schema draft-07).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class WorkflowSchemaValidator {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowSchemaValidator.class);

    static final String SCHEMA_RESOURCE = "/workflow-schema.json";

    private final JsonSchema schema;
    private final ObjectMapper objectMapper;

    public WorkflowSchemaValidator() {
        this(new ObjectMapper());
    }

    public WorkflowSchemaValidator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
        try (InputStream input = WorkflowSchemaValidator.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Workflow schema not found on classpath: " + SCHEMA_RESOURCE);
            }
            this.schema = factory.getSchema(input);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load workflow schema", e);
        }
        logger.debug("Loaded workflow schema from {}", SCHEMA_RESOURCE);
    }

    /**
     * Validates the document as loaded by SnakeYAML.
     */
    public ValidationResult validateWorkflowSchema(Map<String, Object> document) {
        JsonNode tree = objectMapper.valueToTree(document);
        return validate(tree);
    }

    public ValidationResult validate(JsonNode document) {
        ValidationResult result = new ValidationResult();
        Set<ValidationMessage> messages = schema.validate(document);
        messages.stream()
                .sorted(Comparator.comparing(ValidationMessage::getMessage))
                .forEach(message -> result.addError(message.getMessage()));
        if (!messages.isEmpty()) {
            logger.debug("Schema validation found {} errors", messages.size());
        }
        return result;
    }
}
