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
import dev.mars.weft.workflow.WorkflowBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryWorkflowRepositoryTest {

    private InMemoryWorkflowRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryWorkflowRepository();
    }

    @Test
    void testLatestVersionWins() {
        repository.save(workflow("onboarding", "1.9.0"));
        repository.save(workflow("onboarding", "1.10.0"));
        repository.save(workflow("onboarding", "1.2.0"));

        assertEquals("1.10.0", repository.get("onboarding").orElseThrow().getVersion());
        assertEquals("1.2.0", repository.get("onboarding", "1.2.0").orElseThrow().getVersion());
        assertTrue(repository.get("onboarding", "3.0.0").isEmpty());
        assertTrue(repository.get("unknown").isEmpty());
        assertEquals(3, repository.size());
    }

    @Test
    void testSaveReplacesSameVersion() {
        repository.save(workflow("billing", "1.0.0"));
        repository.save(new WorkflowBuilder("billing", "1.0.0").name("Billing v2").build());

        assertEquals(1, repository.size());
        assertEquals("Billing v2", repository.get("billing").orElseThrow().getName());
    }

    @Test
    void testListIsOrderedByIdThenVersion() {
        repository.save(workflow("zeta", "1.0.0"));
        repository.save(workflow("alpha", "2.0.0"));
        repository.save(workflow("alpha", "1.0.0"));

        List<String> keys = repository.list().stream()
                .map(w -> w.getId() + "@" + w.getVersion())
                .collect(Collectors.toList());

        assertEquals(List.of("alpha@1.0.0", "alpha@2.0.0", "zeta@1.0.0"), keys);
    }

    @Test
    void testDeleteSingleVersion() {
        repository.save(workflow("billing", "1.0.0"));
        repository.save(workflow("billing", "2.0.0"));

        assertTrue(repository.delete("billing", "2.0.0"));
        assertFalse(repository.delete("billing", "2.0.0"));
        assertEquals("1.0.0", repository.get("billing").orElseThrow().getVersion());

        assertTrue(repository.delete("billing", "1.0.0"));
        assertTrue(repository.get("billing").isEmpty());
        assertTrue(repository.list().isEmpty());
    }

    @Test
    void testDeleteAllVersions() {
        repository.save(workflow("billing", "1.0.0"));
        repository.save(workflow("billing", "2.0.0"));

        assertTrue(repository.delete("billing"));
        assertFalse(repository.delete("billing"));
        assertEquals(0, repository.size());
    }

    @Test
    void testVersionComparison() {
        assertTrue(InMemoryWorkflowRepository.compareVersions("1.10", "1.9") > 0);
        assertEquals(0, InMemoryWorkflowRepository.compareVersions("1.0", "1.0.0"));
        assertTrue(InMemoryWorkflowRepository.compareVersions("2.0.0-beta", "2.0.0-alpha") > 0);
        assertTrue(InMemoryWorkflowRepository.compareVersions("99999999999999999999", "1") > 0);
    }

    private static Workflow workflow(String id, String version) {
        return new WorkflowBuilder(id, version).build();
    }
}
