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
import dev.mars.weft.workflow.step.StepType;

/**
 * A step failed: bad input, an unsupported collection, or a collaborator error.
 */
public class StepExecutionException extends WeftException {

    private static final long serialVersionUID = 1L;

    private final String stepId;
    private final StepType stepType;

    public StepExecutionException(String stepId, StepType stepType, String message) {
        super(message);
        this.stepId = stepId;
        this.stepType = stepType;
    }

    public StepExecutionException(String stepId, StepType stepType, String message, Throwable cause) {
        super(message, cause);
        this.stepId = stepId;
        this.stepType = stepType;
    }

    public String getStepId() {
        return stepId;
    }

    public StepType getStepType() {
        return stepType;
    }
}
