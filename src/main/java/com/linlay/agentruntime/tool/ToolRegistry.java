package com.linlay.agentruntime.tool;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of tools available to one run. Names are matched case-insensitively and must
 * be unique.
 */
public final class ToolRegistry {

    private static final ToolRegistry EMPTY = new ToolRegistry(List.of());

    private final Map<String, AgentTool> toolsByName;

    public ToolRegistry(Collection<? extends AgentTool> tools) {
        Map<String, AgentTool> byName = new LinkedHashMap<>();
        if (tools != null) {
            for (AgentTool tool : tools) {
                if (tool == null) {
                    continue;
                }
                String name = normalizeName(tool.name());
                if (name.isEmpty()) {
                    throw new IllegalArgumentException("tool name must not be blank");
                }
                if (byName.putIfAbsent(name, tool) != null) {
                    throw new IllegalArgumentException("Duplicate tool name: " + tool.name());
                }
            }
        }
        this.toolsByName = Collections.unmodifiableMap(byName);
    }

    public static ToolRegistry empty() {
        return EMPTY;
    }

    public static ToolRegistry of(AgentTool... tools) {
        return new ToolRegistry(List.of(tools));
    }

    public Optional<AgentTool> find(String toolName) {
        return Optional.ofNullable(toolsByName.get(normalizeName(toolName)));
    }

    public List<AgentTool> list() {
        return List.copyOf(toolsByName.values());
    }

    public boolean isEmpty() {
        return toolsByName.isEmpty();
    }

    public int size() {
        return toolsByName.size();
    }

    private static String normalizeName(String raw) {
        return raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    }
}
