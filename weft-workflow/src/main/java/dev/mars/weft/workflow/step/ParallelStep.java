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

import java.util.List;
import java.util.Objects;

/**
 * Runs each branch concurrently against an isolated copy of the execution variables.
 * The step output is the list of each branch's final variables, in declaration order.
 */
public record ParallelStep(String id, List<List<WorkflowStep>> branches, boolean waitForAll)
        implements WorkflowStep {

    public ParallelStep {
        Objects.requireNonNull(id, "Step id cannot be null");
        branches = branches != null
                ? branches.stream().map(List::copyOf).toList()
                : List.of();
    }

    public ParallelStep(String id, List<List<WorkflowStep>> branches) {
        this(id, branches, true);
    }

    @Override
    public StepType type() {
        return StepType.PARALLEL;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws WeftException {
        return visitor.visitParallel(this);
    }
}
