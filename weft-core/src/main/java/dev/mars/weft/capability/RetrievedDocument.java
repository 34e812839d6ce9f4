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

import java.util.Map;
import java.util.Objects;

/**
 * A document returned by a retrieval pipeline.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public record RetrievedDocument(String id, String content, Map<String, Object> metadata) {

    public RetrievedDocument {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(content, "content");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }
}
