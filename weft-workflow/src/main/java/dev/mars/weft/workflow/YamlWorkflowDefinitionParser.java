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

import dev.mars.weft.workflow.step.AgentStep;
import dev.mars.weft.workflow.step.ConditionalStep;
import dev.mars.weft.workflow.step.HumanInTheLoopStep;
import dev.mars.weft.workflow.step.LoopStep;
import dev.mars.weft.workflow.step.ParallelStep;
import dev.mars.weft.workflow.step.RagStep;
import dev.mars.weft.workflow.step.StepInput;
import dev.mars.weft.workflow.step.StepType;
import dev.mars.weft.workflow.step.ToolStep;
import dev.mars.weft.workflow.step.TransformStep;
import dev.mars.weft.workflow.step.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * YAML-based implementation of WorkflowDefinitionParser.
 *
 * <pre>
 * id: customer-onboarding
 * version: 1.0.0
 * timeout: 30s
 * steps:
 *   - id: greet
 *     type: agent
 *     agentId: welcome-agent
 *     input: { variable: customer }
 *     output: welcome
 *   - type: conditional
 *     condition: "${premium}"
 *     then:
 *       - { type: tool, toolName: upgrade, input: { variable: customer } }
 * </pre>
 *
 * Documents are checked against the bundled JSON Schema before a {@link Workflow} is
 * built. Steps without an id get {@code step-N} in document order.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class YamlWorkflowDefinitionParser implements WorkflowDefinitionParser {

    private static final Logger logger = LoggerFactory.getLogger(YamlWorkflowDefinitionParser.class);

    private static final Pattern DURATION = Pattern.compile("(\\d+)(ms|s|m|h)?");

    private final Yaml yaml;
    private final WorkflowSchemaValidator schemaValidator;

    public YamlWorkflowDefinitionParser() {
        this(new WorkflowSchemaValidator());
    }

    public YamlWorkflowDefinitionParser(WorkflowSchemaValidator schemaValidator) {
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new SafeConstructor(loaderOptions));
        this.schemaValidator = schemaValidator;
    }

    @Override
    public Workflow parse(Path file) throws WorkflowParseException {
        try {
            String content = Files.readString(file);
            return parseFromString(content);
        } catch (IOException e) {
            throw new WorkflowParseException("Failed to read YAML file: " + file, e);
        }
    }

    @Override
    public Workflow parseFromString(String content) throws WorkflowParseException {
        Map<String, Object> data = load(content);

        ValidationResult schemaResult = schemaValidator.validateWorkflowSchema(data);
        if (!schemaResult.isValid()) {
            throw new WorkflowParseException("Workflow definition does not match the schema:", schemaResult);
        }

        Workflow workflow = parseWorkflow(data);
        ValidationResult semantic = validate(workflow);
        if (!semantic.isValid()) {
            throw new WorkflowParseException("Workflow '" + workflow.getId() + "' is invalid:", semantic);
        }
        semantic.getWarnings().forEach(warning ->
                logger.warn("Workflow '{}': {}", workflow.getId(), warning));
        logger.debug("Parsed workflow '{}' with {} top-level steps", workflow.getId(), workflow.getSteps().size());
        return workflow;
    }

    @Override
    public ValidationResult validateSchema(String content) {
        try {
            return schemaValidator.validateWorkflowSchema(load(content));
        } catch (WorkflowParseException e) {
            ValidationResult result = new ValidationResult();
            result.addError(e.getMessage());
            return result;
        }
    }

    @Override
    public ValidationResult validate(Workflow workflow) {
        ValidationResult result = new ValidationResult();
        if (workflow.getSteps().isEmpty()) {
            result.addWarning("steps", "No steps defined");
        }
        validateSteps(workflow.getSteps(), "steps", new HashSet<>(), result);
        return result;
    }

    private void validateSteps(List<WorkflowStep> steps, String path, Set<String> seenIds, ValidationResult result) {
        for (int i = 0; i < steps.size(); i++) {
            WorkflowStep step = steps.get(i);
            String stepPath = path + "[" + i + "]";
            if (!seenIds.add(step.id())) {
                result.addError(stepPath + ".id", "Duplicate step id: " + step.id());
            }
            if (step instanceof LoopStep) {
                LoopStep loop = (LoopStep) step;
                if (loop.maxIterations() != null && loop.maxIterations() < 0) {
                    result.addError(stepPath + ".maxIterations", "maxIterations cannot be negative");
                }
                validateSteps(loop.steps(), stepPath + ".steps", seenIds, result);
            } else if (step instanceof RagStep) {
                RagStep rag = (RagStep) step;
                if (rag.topK() != null && rag.topK() < 0) {
                    result.addError(stepPath + ".topK", "topK cannot be negative");
                }
            } else if (step instanceof ConditionalStep) {
                ConditionalStep conditional = (ConditionalStep) step;
                validateSteps(conditional.thenSteps(), stepPath + ".then", seenIds, result);
                if (conditional.elseSteps() != null) {
                    validateSteps(conditional.elseSteps(), stepPath + ".else", seenIds, result);
                }
            } else if (step instanceof ParallelStep) {
                List<List<WorkflowStep>> branches = ((ParallelStep) step).branches();
                for (int b = 0; b < branches.size(); b++) {
                    validateSteps(branches.get(b), stepPath + ".branches[" + b + "]", seenIds, result);
                }
            }
        }
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> load(String content) throws WorkflowParseException {
        Object data;
        try {
            data = yaml.load(content);
        } catch (YAMLException e) {
            throw new WorkflowParseException("YAML parsing failed: " + e.getMessage(), e);
        }
        if (!(data instanceof Map)) {
            throw new WorkflowParseException("Empty or invalid YAML content");
        }
        return (Map<String, Object>) data;
    }

    private Workflow parseWorkflow(Map<String, Object> data) throws WorkflowParseException {
        String id = getStringValue(data, "id");
        String name = getStringValue(data, "name");
        String version = getStringValue(data, "version");
        Duration timeout = parseDuration("timeout", data.get("timeout"));
        Map<String, String> metadata = parseMetadata(getMapValue(data, "metadata"));
        List<WorkflowStep> steps = parseSteps(getListValue(data, "steps"), "steps", new AtomicInteger());
        return new Workflow(id, name, version, steps, timeout, metadata);
    }

    private List<WorkflowStep> parseSteps(List<Object> stepsList, String path, AtomicInteger counter)
            throws WorkflowParseException {
        if (stepsList == null) {
            return List.of();
        }
        List<WorkflowStep> steps = new ArrayList<>();
        for (int i = 0; i < stepsList.size(); i++) {
            steps.add(parseStep(asMap(stepsList.get(i), path + "[" + i + "]"), path + "[" + i + "]", counter));
        }
        return steps;
    }

    private WorkflowStep parseStep(Map<String, Object> data, String path, AtomicInteger counter)
            throws WorkflowParseException {
        String id = getStringValue(data, "id");
        if (id == null) {
            id = "step-" + counter.incrementAndGet();
        }
        StepType type;
        try {
            type = StepType.fromTag(getStringValue(data, "type"));
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path + ".type", e.getMessage(), e);
        }
        String output = getStringValue(data, "output");

        try {
            switch (type) {
                case AGENT:
                    return new AgentStep(id, getStringValue(data, "agentId"),
                            parseInput(data.get("input"), path + ".input"), output,
                            parseDuration(path + ".timeout", data.get("timeout")));
                case TOOL:
                    return new ToolStep(id, getStringValue(data, "toolName"),
                            parseInput(data.get("input"), path + ".input"), output,
                            parseDuration(path + ".timeout", data.get("timeout")));
                case CONDITIONAL:
                    List<Object> elseList = getListValue(data, "else");
                    return new ConditionalStep(id, getStringValue(data, "condition"),
                            parseSteps(getListValue(data, "then"), path + ".then", counter),
                            elseList != null ? parseSteps(elseList, path + ".else", counter) : null);
                case PARALLEL:
                    List<List<WorkflowStep>> branches = new ArrayList<>();
                    List<Object> branchList = getListValue(data, "branches");
                    for (int b = 0; b < branchList.size(); b++) {
                        branches.add(parseSteps(asList(branchList.get(b), path + ".branches[" + b + "]"),
                                path + ".branches[" + b + "]", counter));
                    }
                    return new ParallelStep(id, branches, getBooleanValue(data, "waitForAll", true));
                case LOOP:
                    return new LoopStep(id, parseInput(data.get("collection"), path + ".collection"),
                            getStringValue(data, "itemVariable"), getIntegerValue(data, "maxIterations"),
                            parseSteps(getListValue(data, "steps"), path + ".steps", counter));
                case HUMAN_IN_THE_LOOP:
                    return new HumanInTheLoopStep(id, getStringValue(data, "prompt"),
                            parseStringList(getListValue(data, "options")),
                            parseDuration(path + ".timeout", data.get("timeout")),
                            getStringValue(data, "assignee"), output);
                case RAG:
                    return new RagStep(id, getStringValue(data, "pipeline"),
                            parseInput(data.get("query"), path + ".query"),
                            getIntegerValue(data, "topK"), output);
                case TRANSFORM:
                    return new TransformStep(id, parseInput(data.get("input"), path + ".input"),
                            getStringValue(data, "expression"), output);
                default:
                    throw new WorkflowParseException(path + ".type", "Unsupported step type: " + type);
            }
        } catch (IllegalArgumentException e) {
            throw new WorkflowParseException(path, e.getMessage(), e);
        }
    }

    private StepInput parseInput(Object value, String path) throws WorkflowParseException {
        Map<String, Object> data = asMap(value, path);
        if (data.containsKey("literal")) {
            return StepInput.literal(data.get("literal"));
        }
        if (data.containsKey("variable")) {
            return StepInput.variable(getStringValue(data, "variable"));
        }
        if (data.containsKey("expression")) {
            return StepInput.expression(getStringValue(data, "expression"));
        }
        throw new WorkflowParseException(path, "Step input needs one of literal, variable or expression");
    }

    static Duration parseDuration(String path, Object value) throws WorkflowParseException {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return Duration.ofMillis(((Number) value).longValue());
        }
        Matcher matcher = DURATION.matcher(value.toString().trim().toLowerCase());
        if (!matcher.matches()) {
            throw new WorkflowParseException(path, "Invalid duration: " + value);
        }
        long amount = Long.parseLong(matcher.group(1));
        String unit = matcher.group(2) != null ? matcher.group(2) : "ms";
        switch (unit) {
            case "s":
                return Duration.ofSeconds(amount);
            case "m":
                return Duration.ofMinutes(amount);
            case "h":
                return Duration.ofHours(amount);
            default:
                return Duration.ofMillis(amount);
        }
    }

    private String getStringValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value != null ? value.toString() : null;
    }

    private Integer getIntegerValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value instanceof Number ? ((Number) value).intValue() : null;
    }

    private boolean getBooleanValue(Map<String, Object> data, String key, boolean defaultValue) {
        Object value = data.get(key);
        return value instanceof Boolean ? (Boolean) value : defaultValue;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMapValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value instanceof Map ? (Map<String, Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    private List<Object> getListValue(Map<String, Object> data, String key) {
        Object value = data.get(key);
        return value instanceof List ? (List<Object>) value : null;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asMap(Object value, String path) throws WorkflowParseException {
        if (!(value instanceof Map)) {
            throw new WorkflowParseException(path, "Expected a mapping");
        }
        return (Map<String, Object>) value;
    }

    @SuppressWarnings("unchecked")
    private static List<Object> asList(Object value, String path) throws WorkflowParseException {
        if (!(value instanceof List)) {
            throw new WorkflowParseException(path, "Expected a list");
        }
        return (List<Object>) value;
    }

    private Map<String, String> parseMetadata(Map<String, Object> data) {
        if (data == null) {
            return Map.of();
        }
        Map<String, String> metadata = new LinkedHashMap<>();
        data.forEach((key, value) -> metadata.put(key, value != null ? value.toString() : null));
        return metadata;
    }

    private List<String> parseStringList(List<Object> data) {
        if (data == null) {
            return List.of();
        }
        List<String> result = new ArrayList<>();
        for (Object item : data) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }
}
