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
import dev.mars.weft.workflow.StepExecutionException;
import dev.mars.weft.workflow.step.RagStep;
import dev.mars.weft.workflow.step.StepInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class RagStepExecutorTest {

    @Mock
    private StepExecutionContext context;

    @Mock
    private RagPipeline pipeline;

    private RagStepExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        executor = new RagStepExecutor(Map.of("kb", pipeline));
        when(context.await(any(), any(), isNull())).thenAnswer(invocation ->
                ((CompletableFuture<?>) invocation.getArgument(1)).get());
    }

    @Test
    void testQueriesPipelineWithTopK() throws Exception {
        RagStep step = new RagStep("r", "kb", StepInput.variable("q"), 4, "docs");
        when(context.resolve(step, step.query())).thenReturn("pricing");
        when(pipeline.query("pricing", new RagQueryOptions(4)))
                .thenReturn(CompletableFuture.completedFuture(RetrievalResult.empty()));

        StepOutcome outcome = executor.execute(step, context);

        assertEquals("pricing", outcome.input());
        assertEquals(RetrievalResult.empty(), outcome.output());
        verify(pipeline).query("pricing", new RagQueryOptions(4));
    }

    @Test
    void testQueryMustBeText() throws Exception {
        RagStep step = new RagStep("r", "kb", StepInput.literal(42), null, null);
        when(context.resolve(step, step.query())).thenReturn(42);

        StepExecutionException e = assertThrows(StepExecutionException.class, () -> executor.execute(step, context));
        assertEquals("RAG query must be a string", e.getMessage());
        verifyNoInteractions(pipeline);
    }

    @Test
    void testUnknownPipeline() {
        RagStep step = new RagStep("r", "elsewhere", StepInput.literal("q"), null, null);

        CapabilityNotFoundException e = assertThrows(CapabilityNotFoundException.class,
                () -> executor.execute(step, context));
        assertEquals("RAG pipeline not found: elsewhere", e.getMessage());
    }
}
