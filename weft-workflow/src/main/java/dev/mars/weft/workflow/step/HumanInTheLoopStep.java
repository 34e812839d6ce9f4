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

package dev.mars.weft.workflow.step;

import dev.mars.weft.core.exceptions.WeftException;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Suspends the step until a human answers the prompt through the checkpoint handler.
 */
public record HumanInTheLoopStep(String id, String prompt, List<String> options, Duration timeout,
                                 String assignee, String output) implements WorkflowStep {

    public HumanInTheLoopStep {
        Objects.requireNonNull(id, "Step id cannot be null");
        Objects.requireNonNull(prompt, "Prompt cannot be null");
        options = options != null ? List.copyOf(options) : List.of();
    }

    public HumanInTheLoopStep(String id, String prompt, List<String> options) {
        this(id, prompt, options, null, null, null);
    }

    public Optional<Duration> getTimeout() {
        return Optional.ofNullable(timeout);
    }

    public Optional<String> getAssignee() {
        return Optional.ofNullable(assignee);
    }

    @Override
    public Optional<String> getOutputVariable() {
        return Optional.ofNullable(output);
    }

    @Override
    public StepType type() {
        return StepType.HUMAN_IN_THE_LOOP;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws WeftException {
        return visitor.visitHumanInTheLoop(this);
    }
}
