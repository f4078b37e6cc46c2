package com.linlay.assistantrunner.tool;

import com.linlay.assistantrunner.config.ToolCatalogProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Component
public class ToolRegistry {

    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);

    private final Map<ToolName, AssistantTool> toolsByName;
    private final Set<ToolName> criticalTools;

    public ToolRegistry(List<AssistantTool> tools) {
        this(tools, new ToolCatalogProperties());
    }

    @Autowired
    public ToolRegistry(List<AssistantTool> tools, ToolCatalogProperties properties) {
        Set<ToolName> disabled = resolveNames(properties.getDisabled(), "disabled");
        this.criticalTools = resolveNames(properties.getCritical(), "critical");
        this.toolsByName = new EnumMap<>(ToolName.class);
        for (AssistantTool tool : tools == null ? List.<AssistantTool>of() : tools) {
            if (tool == null || tool.name() == null) {
                continue;
            }
            if (disabled.contains(tool.name())) {
                log.info("Tool '{}' is disabled by configuration", tool.name().wireName());
                continue;
            }
            AssistantTool previous = toolsByName.put(tool.name(), tool);
            if (previous != null) {
                log.warn("Duplicate tool '{}', {} replaces {}", tool.name().wireName(),
                        tool.getClass().getSimpleName(), previous.getClass().getSimpleName());
            }
        }
    }

    public Optional<AssistantTool> find(ToolName name) {
        return Optional.ofNullable(name == null ? null : toolsByName.get(name));
    }

    public boolean isCritical(ToolName name) {
        return name != null && criticalTools.contains(name);
    }

    public Collection<AssistantTool> list() {
        return List.copyOf(toolsByName.values());
    }

    private static Set<ToolName> resolveNames(List<String> names, String setting) {
        Set<ToolName> resolved = EnumSet.noneOf(ToolName.class);
        for (String raw : names == null ? List.<String>of() : names) {
            Optional<ToolName> name = ToolName.fromWire(raw);
            if (name.isPresent()) {
                resolved.add(name.get());
            } else {
                log.warn("Ignore unknown tool '{}' in assistant.tools.{}", raw, setting);
            }
        }
        return resolved;
    }
}
