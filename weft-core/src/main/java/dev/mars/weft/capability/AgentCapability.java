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

package dev.mars.weft.capability;

import java.util.concurrent.CompletableFuture;

/**
 * Runs an autonomous agent for an agent step. The engine treats the returned value
 * as opaque and stores it as the step output.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@FunctionalInterface
public interface AgentCapability {

    /**
     * Executes the agent named by the invocation.
     *
     * @param invocation the agent call
     * @return future completing with the agent's result, or exceptionally on agent failure
     */
    CompletableFuture<Object> execute(AgentInvocation invocation);
}
