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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * {@link ExecutionStateStore} backed by a {@link ConcurrentHashMap}. Per-id atomicity
 * comes from {@link ConcurrentMap#computeIfPresent}.
 */
public class InMemoryExecutionStateStore implements ExecutionStateStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryExecutionStateStore.class);

    private final ConcurrentMap<String, WorkflowExecution> executions = new ConcurrentHashMap<>();

    @Override
    public void create(WorkflowExecution execution) {
        Objects.requireNonNull(execution, "Execution cannot be null");
        WorkflowExecution existing = executions.putIfAbsent(execution.getExecutionId(), execution);
        if (existing != null) {
            throw new IllegalStateException("Execution already exists: " + execution.getExecutionId());
        }
        logger.debug("Stored execution {}", execution.getExecutionId());
    }

    @Override
    public Optional<WorkflowExecution> get(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public Optional<WorkflowExecution> update(String executionId, UnaryOperator<WorkflowExecution> updater) {
        Objects.requireNonNull(updater, "Updater cannot be null");
        return Optional.ofNullable(executions.computeIfPresent(executionId, (id, current) ->
                Objects.requireNonNull(updater.apply(current), "Updater returned null")));
    }

    @Override
    public List<WorkflowExecution> findAll(Predicate<WorkflowExecution> filter) {
        return executions.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(WorkflowExecution::getStartTime))
                .collect(Collectors.toList());
    }

    @Override
    public boolean remove(String executionId) {
        return executions.remove(executionId) != null;
    }

    @Override
    public int removeIf(Predicate<WorkflowExecution> filter) {
        int before = executions.size();
        executions.values().removeIf(filter);
        int removed = before - executions.size();
        if (removed > 0) {
            logger.debug("Removed {} executions", removed);
        }
        return removed;
    }

    @Override
    public void clear() {
        executions.clear();
    }

    @Override
    public int size() {
        return executions.size();
    }
}
