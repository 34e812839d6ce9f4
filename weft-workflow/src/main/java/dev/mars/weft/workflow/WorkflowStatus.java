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

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Enumeration of workflow execution statuses.
 */
public enum WorkflowStatus {

    /**
     * Workflow is currently running.
     */
    RUNNING,

    /**
     * Workflow execution has been paused.
     */
    PAUSED,

    /**
     * Workflow has completed successfully.
     */
    COMPLETED,

    /**
     * Workflow execution has failed.
     */
    FAILED,

    /**
     * Workflow execution has been cancelled.
     */
    CANCELLED;

    /**
     * Checks if the status represents a terminal state.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Checks if the status represents an active state.
     */
    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    /**
     * Statuses reachable from this one.
     */
    public Set<WorkflowStatus> validTransitions() {
        switch (this) {
            case RUNNING:
                return EnumSet.of(PAUSED, COMPLETED, FAILED, CANCELLED);
            case PAUSED:
                return EnumSet.of(RUNNING, CANCELLED);
            default:
                return EnumSet.noneOf(WorkflowStatus.class);
        }
    }

    public boolean canTransitionTo(WorkflowStatus target) {
        return validTransitions().contains(target);
    }

    /**
     * Lower-case wire name.
     */
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
