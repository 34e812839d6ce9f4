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

package dev.mars.weft.workflow.executor;

import dev.mars.weft.core.exceptions.WeftException;
import dev.mars.weft.workflow.StepExecutionException;
import dev.mars.weft.workflow.step.ParallelStep;
import dev.mars.weft.workflow.step.WorkflowStep;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Starts every branch at once and waits for all of them to settle. The output lists each
 * branch's final variables in declaration order. If any branch failed, the failure of the
 * first failing branch in declaration order is rethrown.
 */
public class ParallelStepExecutor implements StepExecutor<ParallelStep> {

    @Override
    public StepOutcome execute(ParallelStep step, StepExecutionContext context) throws WeftException {
        List<CompletableFuture<Map<String, Object>>> running = new ArrayList<>();
        for (List<WorkflowStep> branch : step.branches()) {
            running.add(context.executeBranch(branch));
        }

        List<Map<String, Object>> results = new ArrayList<>(running.size());
        WeftException firstFailure = null;
        for (CompletableFuture<Map<String, Object>> branch : running) {
            try {
                results.add(branch.get());
            } catch (ExecutionException e) {
                if (firstFailure == null) {
                    firstFailure = unwrap(step, e.getCause());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new StepExecutionException(step.id(), step.type(), "Interrupted waiting for parallel branches", e);
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
        return StepOutcome.of(null, results);
    }

    private static WeftException unwrap(ParallelStep step, Throwable failure) {
        Throwable cause = failure;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof WeftException) {
            return (WeftException) cause;
        }
        return new StepExecutionException(step.id(), step.type(),
                "Parallel branch failed: " + cause.getMessage(), cause);
    }
}
