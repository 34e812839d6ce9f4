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

import dev.mars.weft.workflow.WorkflowExecution;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Keyed store of execution snapshots.
 *
 * <p>Snapshots are immutable, so readers never observe a partially applied change.
 * {@link #update} is atomic per execution id: concurrent updates to the same id are
 * applied one after the other, each against the result of the previous one.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface ExecutionStateStore {

    /**
     * Stores a new execution.
     *
     * @throws IllegalStateException if an execution with the same id is already stored
     */
    void create(WorkflowExecution execution);

    Optional<WorkflowExecution> get(String executionId);

    /**
     * Atomically replaces the stored snapshot with {@code updater.apply(current)}.
     *
     * @return the new snapshot, or empty if no execution with that id exists
     */
    Optional<WorkflowExecution> update(String executionId, UnaryOperator<WorkflowExecution> updater);

    List<WorkflowExecution> findAll(Predicate<WorkflowExecution> filter);

    boolean remove(String executionId);

    /**
     * Removes every execution matching the filter.
     *
     * @return number of executions removed
     */
    int removeIf(Predicate<WorkflowExecution> filter);

    void clear();

    int size();
}
