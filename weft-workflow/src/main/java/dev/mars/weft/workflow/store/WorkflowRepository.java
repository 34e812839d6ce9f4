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

package dev.mars.weft.workflow.store;

import dev.mars.weft.workflow.Workflow;

import java.util.List;
import java.util.Optional;

/**
 * Registry of workflow definitions, keyed by id and version.
 */
public interface WorkflowRepository {

    /**
     * Stores the workflow, replacing any definition with the same id and version.
     */
    void save(Workflow workflow);

    /**
     * The highest stored version of the workflow.
     */
    Optional<Workflow> get(String workflowId);

    Optional<Workflow> get(String workflowId, String version);

    /**
     * Every stored definition, all versions, ordered by id then version.
     */
    List<Workflow> list();

    /**
     * Deletes all versions of the workflow.
     *
     * @return true if anything was removed
     */
    boolean delete(String workflowId);

    boolean delete(String workflowId, String version);
}
