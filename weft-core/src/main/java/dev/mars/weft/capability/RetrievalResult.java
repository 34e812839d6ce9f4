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

/**
 * Ranked result of a retrieval pipeline query. {@code scores} is parallel to
 * {@code documents}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public record RetrievalResult(List<RetrievedDocument> documents, List<Double> scores,
                              int count, double averageScore) {

    public RetrievalResult {
        documents = documents != null ? List.copyOf(documents) : List.of();
        scores = scores != null ? List.copyOf(scores) : List.of();
        if (scores.size() != documents.size()) {
            throw new IllegalArgumentException("scores must have one entry per document");
        }
    }

    /**
     * Builds a result, deriving {@code count} and {@code averageScore}.
     */
    public static RetrievalResult of(List<RetrievedDocument> documents, List<Double> scores) {
        List<Double> safeScores = scores != null ? scores : List.of();
        double average = safeScores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
        return new RetrievalResult(documents, safeScores, documents != null ? documents.size() : 0, average);
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of(), List.of(), 0, 0.0);
    }
}
