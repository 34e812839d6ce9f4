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

import dev.mars.weft.capability.AgentCapability;
import dev.mars.weft.capability.AgentInvocation;
import dev.mars.weft.core.exceptions.CapabilityNotFoundException;
import dev.mars.weft.workflow.step.AgentStep;
import dev.mars.weft.workflow.step.StepInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AgentStepExecutorTest {

    @Mock
    private StepExecutionContext context;

    @Mock
    private AgentCapability agents;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        when(context.getExecutionId()).thenReturn("exec-9");
        when(context.await(any(), any(), any())).thenAnswer(invocation ->
                ((CompletableFuture<?>) invocation.getArgument(1)).get());
    }

    @Test
    void testInvocationCarriesExecutionContext() throws Exception {
        AgentStep step = new AgentStep("s1", "summarizer", StepInput.expression("${text}"), "summary");
        when(context.resolve(step, step.input())).thenReturn("long text");
        when(agents.execute(any())).thenReturn(CompletableFuture.completedFuture("short"));

        StepOutcome outcome = new AgentStepExecutor(agents).execute(step, context);

        ArgumentCaptor<AgentInvocation> captor = ArgumentCaptor.forClass(AgentInvocation.class);
        verify(agents).execute(captor.capture());
        assertEquals(new AgentInvocation("exec-9", "s1", "summarizer", "long text"), captor.getValue());
        assertEquals("short", outcome.output());
    }

    @Test
    void testNoAgentCapability() {
        AgentStep step = new AgentStep("s1", "summarizer", StepInput.literal("x"), null);

        assertThrows(CapabilityNotFoundException.class, () -> new AgentStepExecutor(null).execute(step, context));
    }
}
