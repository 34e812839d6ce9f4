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

package dev.mars.weft.workflow.step;

import dev.mars.weft.core.exceptions.WeftException;

import java.util.Objects;
import java.util.Optional;

/**
 * Queries a named retrieval pipeline.
 *
 * @param topK maximum documents to retrieve, or null for the pipeline default
 */
public record RagStep(String id, String pipeline, StepInput query, Integer topK, String output)
        implements WorkflowStep {

    public RagStep {
        Objects.requireNonNull(id, "Step id cannot be null");
        Objects.requireNonNull(pipeline, "Pipeline name cannot be null");
        Objects.requireNonNull(query, "Query cannot be null");
    }

    public Optional<Integer> getTopK() {
        return Optional.ofNullable(topK);
    }

    @Override
    public Optional<String> getOutputVariable() {
        return Optional.ofNullable(output);
    }

    @Override
    public StepType type() {
        return StepType.RAG;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) throws WeftException {
        return visitor.visitRag(this);
    }
}
