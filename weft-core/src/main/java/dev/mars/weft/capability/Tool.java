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
 * An executable capability registered under a name in the tool catalog.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public interface Tool {

    String getName();

    /**
     * Runs the tool against a resolved input.
     *
     * @param input the resolved step input (may be null)
     * @return future completing with the tool output, or exceptionally on failure
     */
    CompletableFuture<Object> execute(Object input);
}
