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

import dev.mars.weft.core.exceptions.WeftException;

/**
 * Raised at a step boundary when the execution was paused or cancelled from outside.
 */
public class ExecutionInterruptedException extends WeftException {

    private static final long serialVersionUID = 1L;

    private final String executionId;
    private final WorkflowStatus status;

    public ExecutionInterruptedException(String executionId, WorkflowStatus status) {
        super(status == WorkflowStatus.PAUSED ? "Execution paused" : "Execution cancelled");
        this.executionId = executionId;
        this.status = status;
    }

    public String getExecutionId() {
        return executionId;
    }

    /**
     * The status observed at the boundary, {@link WorkflowStatus#PAUSED} or
     * {@link WorkflowStatus#CANCELLED}.
     */
    public WorkflowStatus getStatus() {
        return status;
    }
}
