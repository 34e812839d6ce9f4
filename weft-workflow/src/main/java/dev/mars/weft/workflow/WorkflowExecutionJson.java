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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Renders execution snapshots as JSON for hosts that expose the engine over a network
 * boundary.
 *
 * <pre>
 * {"id", "workflowId", "status", "variables", "currentStep", "stepHistory": [...],
 *  "startTime", "endTime"?, "error"?}
 * </pre>
 *
 * Statuses are lower case, step types use their tag names and timestamps are ISO-8601.
 */
public class WorkflowExecutionJson {

    private final ObjectMapper objectMapper;

    public WorkflowExecutionJson() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    public WorkflowExecutionJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(WorkflowExecution execution) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toTree(execution));
    }

    /**
     * @throws IllegalArgumentException if a variable or step value cannot be serialized
     */
    public ObjectNode toTree(WorkflowExecution execution) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("id", execution.getExecutionId());
        root.put("workflowId", execution.getWorkflowId());
        root.put("status", execution.getStatus().getValue());
        root.set("variables", objectMapper.valueToTree(execution.getVariables()));
        root.put("currentStep", execution.getCurrentStep().orElse(null));

        ArrayNode history = root.putArray("stepHistory");
        for (StepExecutionRecord record : execution.getStepHistory()) {
            history.add(toTree(record));
        }

        root.set("startTime", objectMapper.valueToTree(execution.getStartTime()));
        execution.getEndTime().ifPresent(end -> root.set("endTime", objectMapper.valueToTree(end)));
        execution.getErrorMessage().ifPresent(error -> root.put("error", error));
        return root;
    }

    private ObjectNode toTree(StepExecutionRecord record) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("stepId", record.getStepId());
        node.put("stepType", record.getStepType().getTag());
        node.put("status", record.getStatus().getValue());
        node.set("startTime", objectMapper.valueToTree(record.getStartTime()));
        record.getEndTime().ifPresent(end -> node.set("endTime", objectMapper.valueToTree(end)));
        if (record.getInput() != null) {
            node.set("input", toNode(record.getInput()));
        }
        if (record.getOutput() != null) {
            node.set("output", toNode(record.getOutput()));
        }
        record.getErrorMessage().ifPresent(error -> node.put("error", error));
        node.put("retryCount", record.getRetryCount());
        return node;
    }

    private JsonNode toNode(Object value) {
        return objectMapper.valueToTree(value);
    }
}
