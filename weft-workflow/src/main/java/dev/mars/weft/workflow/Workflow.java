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

import dev.mars.weft.workflow.step.WorkflowStep;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable, named workflow definition: an ordered list of steps plus descriptive
 * metadata.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public final class Workflow {

    public static final String DEFAULT_VERSION = "1.0.0";

    private final String id;
    private final String name;
    private final String version;
    private final List<WorkflowStep> steps;
    private final Duration timeout;
    private final Map<String, String> metadata;

    public Workflow(String id, String name, String version, List<WorkflowStep> steps,
                    Duration timeout, Map<String, String> metadata) {
        this.id = Objects.requireNonNull(id, "Workflow ID cannot be null");
        this.name = name != null ? name : id;
        this.version = version != null ? version : DEFAULT_VERSION;
        this.steps = steps != null ? List.copyOf(steps) : List.of();
        this.timeout = timeout;
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
    }

    public Workflow(String id, String name, List<WorkflowStep> steps) {
        this(id, name, null, steps, null, null);
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getVersion() {
        return version;
    }

    public List<WorkflowStep> getSteps() {
        return steps;
    }

    /**
     * Default deadline for collaborator calls made by this workflow's steps.
     */
    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public Map<String, String> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Workflow workflow = (Workflow) o;
        return Objects.equals(id, workflow.id) && Objects.equals(version, workflow.version);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, version);
    }

    @Override
    public String toString() {
        return "Workflow{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", version='" + version + '\'' +
               ", steps=" + steps.size() +
               '}';
    }
}
