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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Surfaces a prompt to a human and completes with their answer. The workflow step
 * awaiting the answer stays suspended until the future completes.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
@FunctionalInterface
public interface HumanCheckpointHandler {

    /**
     * @param prompt  the question shown to the human
     * @param options allowed answers, empty when the answer is free text
     */
    CompletableFuture<String> request(String prompt, List<String> options);
}
