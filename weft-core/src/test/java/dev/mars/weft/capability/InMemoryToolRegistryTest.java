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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryToolRegistryTest {

    private InMemoryToolRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new InMemoryToolRegistry();
    }

    @Test
    void testRegisterAndLookup() throws Exception {
        registry.register(tool("upper"));

        assertTrue(registry.contains("upper"));
        Tool found = registry.get("upper").orElseThrow();
        assertEquals("UPPER:hello", found.execute("hello").get());
    }

    @Test
    void testUnknownToolIsEmpty() {
        assertTrue(registry.get("missing").isEmpty());
        assertTrue(registry.get(null).isEmpty());
    }

    @Test
    void testDuplicateRegistrationRejected() {
        registry.register(tool("search"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> registry.register(tool("search")));
        assertEquals("Tool already registered: search", e.getMessage());
        assertEquals(1, registry.size());
    }

    @Test
    void testUnregister() {
        registry.register(tool("search"));

        assertTrue(registry.unregister("search"));
        assertFalse(registry.unregister("search"));
        assertEquals(0, registry.size());
    }

    @Test
    void testListIsSortedByName() {
        registry.register(tool("zeta"));
        registry.register(tool("alpha"));
        registry.register(tool("mid"));

        List<String> names = registry.list().stream().map(Tool::getName).collect(Collectors.toList());
        assertEquals(List.of("alpha", "mid", "zeta"), names);
    }

    @Test
    void testRetrievalResultAverages() {
        RetrievalResult result = RetrievalResult.of(
                List.of(new RetrievedDocument("d1", "one", null), new RetrievedDocument("d2", "two", null)),
                List.of(0.5, 1.0));

        assertEquals(2, result.count());
        assertEquals(0.75, result.averageScore(), 1e-9);
        assertThrows(IllegalArgumentException.class,
                () -> RetrievalResult.of(List.of(new RetrievedDocument("d1", "one", null)), List.of()));
        assertThrows(IllegalArgumentException.class, () -> new RagQueryOptions(-1));
    }

    private static Tool tool(String name) {
        return new Tool() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public CompletableFuture<Object> execute(Object input) {
                return CompletableFuture.completedFuture(name.toUpperCase() + ":" + input);
            }
        };
    }
}
