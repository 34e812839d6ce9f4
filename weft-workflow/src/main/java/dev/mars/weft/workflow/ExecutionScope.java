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

import java.util.Map;

/**
 * The state a sequence of steps runs against: the stored execution at the top level, or an
 * isolated copy inside a parallel branch.
 */
interface ExecutionScope {

    String executionId();

    String workflowId();

    /**
     * Status used for the pause and cancel check before each step.
     */
    WorkflowStatus status();

    Map<String, Object> variables();

    void setVariable(String name, Object value);

    /**
     * Appends a running record and makes the step current.
     *
     * @return the index of the record, for {@link #finishStep}
     */
    int beginStep(StepExecutionRecord running);

    void finishStep(int index, StepExecutionRecord finished);

    /**
     * A new isolated scope seeded with a copy of the current variables and an empty history.
     */
    ExecutionScope branch();
}
