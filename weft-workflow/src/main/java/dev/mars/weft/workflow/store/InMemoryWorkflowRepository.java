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

package dev.mars.weft.workflow.store;

import dev.mars.weft.workflow.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe in-memory {@link WorkflowRepository}. Versions are ordered by comparing
 * their dot-separated components numerically where both are numbers, and lexically
 * otherwise, so {@code 1.10.0} sorts after {@code 1.9.2}.
 */
public class InMemoryWorkflowRepository implements WorkflowRepository {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryWorkflowRepository.class);

    static final Comparator<String> VERSION_ORDER = InMemoryWorkflowRepository::compareVersions;

    private final ConcurrentMap<String, NavigableMap<String, Workflow>> workflows = new ConcurrentHashMap<>();

    @Override
    public void save(Workflow workflow) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        workflows.compute(workflow.getId(), (id, versions) -> {
            NavigableMap<String, Workflow> updated = versions != null
                    ? new TreeMap<>(versions)
                    : new TreeMap<>(VERSION_ORDER);
            updated.put(workflow.getVersion(), workflow);
            return updated;
        });
        logger.info("Saved workflow {} version {}", workflow.getId(), workflow.getVersion());
    }

    @Override
    public Optional<Workflow> get(String workflowId) {
        NavigableMap<String, Workflow> versions = workflows.get(workflowId);
        return versions != null && !versions.isEmpty()
                ? Optional.of(versions.lastEntry().getValue())
                : Optional.empty();
    }

    @Override
    public Optional<Workflow> get(String workflowId, String version) {
        NavigableMap<String, Workflow> versions = workflows.get(workflowId);
        return versions != null ? Optional.ofNullable(versions.get(version)) : Optional.empty();
    }

    @Override
    public List<Workflow> list() {
        List<Workflow> all = new ArrayList<>();
        new TreeMap<>(workflows).values().forEach(versions -> all.addAll(versions.values()));
        return all;
    }

    @Override
    public boolean delete(String workflowId) {
        boolean removed = workflows.remove(workflowId) != null;
        if (removed) {
            logger.info("Deleted workflow {}", workflowId);
        }
        return removed;
    }

    @Override
    public boolean delete(String workflowId, String version) {
        boolean[] removed = {false};
        workflows.computeIfPresent(workflowId, (id, versions) -> {
            if (!versions.containsKey(version)) {
                return versions;
            }
            removed[0] = true;
            NavigableMap<String, Workflow> remaining = new TreeMap<>(versions);
            remaining.remove(version);
            return remaining.isEmpty() ? null : remaining;
        });
        if (removed[0]) {
            logger.info("Deleted workflow {} version {}", workflowId, version);
        }
        return removed[0];
    }

    public int size() {
        return workflows.values().stream().mapToInt(Map::size).sum();
    }

    static int compareVersions(String left, String right) {
        String[] a = left.split("\\.");
        String[] b = right.split("\\.");
        for (int i = 0; i < Math.max(a.length, b.length); i++) {
            String x = i < a.length ? a[i] : "0";
            String y = i < b.length ? b[i] : "0";
            int cmp;
            if (x.matches("\\d+") && y.matches("\\d+")) {
                cmp = new BigInteger(x).compareTo(new BigInteger(y));
            } else {
                cmp = x.compareTo(y);
            }
            if (cmp != 0) {
                return cmp;
            }
        }
        return 0;
    }
}
