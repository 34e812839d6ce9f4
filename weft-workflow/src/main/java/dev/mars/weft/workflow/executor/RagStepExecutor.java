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

import dev.mars.weft.capability.RagPipeline;
import dev.mars.weft.capability.RagQueryOptions;
import dev.mars.weft.capability.RetrievalResult;
import dev.mars.weft.core.exceptions.CapabilityNotFoundException;
import dev.mars.weft.core.exceptions.WeftException;
import dev.mars.weft.workflow.StepExecutionException;
import dev.mars.weft.workflow.step.RagStep;

import java.util.Map;

/**
 * Queries the named retrieval pipeline with the resolved query text.
 */
public class RagStepExecutor implements StepExecutor<RagStep> {

    private final Map<String, RagPipeline> pipelines;

    public RagStepExecutor(Map<String, RagPipeline> pipelines) {
        this.pipelines = pipelines != null ? Map.copyOf(pipelines) : Map.of();
    }

    @Override
    public StepOutcome execute(RagStep step, StepExecutionContext context) throws WeftException {
        RagPipeline pipeline = pipelines.get(step.pipeline());
        if (pipeline == null) {
            throw new CapabilityNotFoundException(CapabilityNotFoundException.CapabilityKind.RAG_PIPELINE, step.pipeline());
        }
        Object query = context.resolve(step, step.query());
        if (!(query instanceof String)) {
            throw new StepExecutionException(step.id(), step.type(), "RAG query must be a string");
        }
        RetrievalResult result = context.await(step,
                pipeline.query((String) query, new RagQueryOptions(step.topK())), null);
        return StepOutcome.of(query, result);
    }
}
