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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Thread-safe in-memory tool catalog.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class InMemoryToolRegistry implements ToolCapability {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryToolRegistry.class);

    private final ConcurrentMap<String, Tool> tools = new ConcurrentHashMap<>();

    /**
     * Registers a tool under its own name.
     *
     * @throws IllegalArgumentException if a tool with the same name is already registered
     */
    public void register(Tool tool) {
        Objects.requireNonNull(tool, "Tool cannot be null");
        String name = Objects.requireNonNull(tool.getName(), "Tool name cannot be null");
        Tool existing = tools.putIfAbsent(name, tool);
        if (existing != null) {
            throw new IllegalArgumentException("Tool already registered: " + name);
        }
        logger.debug("Registered tool: {}", name);
    }

    /**
     * @return true if a tool was removed
     */
    public boolean unregister(String name) {
        boolean removed = name != null && tools.remove(name) != null;
        if (removed) {
            logger.debug("Unregistered tool: {}", name);
        }
        return removed;
    }

    @Override
    public Optional<Tool> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(tools.get(name));
    }

    public boolean contains(String name) {
        return name != null && tools.containsKey(name);
    }

    public List<Tool> list() {
        List<Tool> result = new ArrayList<>(tools.values());
        result.sort(Comparator.comparing(Tool::getName));
        return result;
    }

    public int size() {
        return tools.size();
    }
}
