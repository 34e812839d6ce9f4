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

/**
 * Options passed to a retrieval pipeline query.
 *
 * @param limit maximum number of documents to return, or null for the pipeline default
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public record RagQueryOptions(Integer limit) {

    public RagQueryOptions {
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit cannot be negative: " + limit);
        }
    }

    public static RagQueryOptions defaults() {
        return new RagQueryOptions(null);
    }
}
