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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Isolated scope of one parallel branch. Variable writes and step records stay local; the
 * pause and cancel check defers to the enclosing scope.
 */
final class BranchExecutionScope implements ExecutionScope {

    private final ExecutionScope parent;
    private final Map<String, Object> variables;
    private final List<StepExecutionRecord> history = new ArrayList<>();

    BranchExecutionScope(ExecutionScope parent, Map<String, Object> seed) {
        this.parent = parent;
        this.variables = Collections.synchronizedMap(new LinkedHashMap<>(seed));
    }

    @Override
    public String executionId() {
        return parent.executionId();
    }

    @Override
    public String workflowId() {
        return parent.workflowId();
    }

    @Override
    public WorkflowStatus status() {
        return parent.status();
    }

    @Override
    public Map<String, Object> variables() {
        synchronized (variables) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        }
    }

    @Override
    public void setVariable(String name, Object value) {
        variables.put(name, value);
    }

    @Override
    public synchronized int beginStep(StepExecutionRecord running) {
        history.add(running);
        return history.size() - 1;
    }

    @Override
    public synchronized void finishStep(int index, StepExecutionRecord finished) {
        history.set(index, finished);
    }

    @Override
    public ExecutionScope branch() {
        return new BranchExecutionScope(this, variables());
    }
}
