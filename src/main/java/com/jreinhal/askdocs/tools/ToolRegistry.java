package com.jreinhal.askdocs.tools;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Registered answer tools, ordered by priority then name.
 */
@Component
public class ToolRegistry {
    private static final Logger log = LoggerFactory.getLogger(ToolRegistry.class);
    private final Map<String, AnswerTool> tools;
    private final List<AnswerTool> ordered;

    public ToolRegistry(List<AnswerTool> tools) {
        Map<String, AnswerTool> byName = new LinkedHashMap<>();
        tools.stream()
                .sorted(Comparator.comparingInt(AnswerTool::priority).thenComparing(AnswerTool::name))
                .forEach(tool -> {
                    AnswerTool previous = byName.putIfAbsent(tool.name(), tool);
                    if (previous != null) {
                        throw new IllegalStateException("Duplicate answer tool name: " + tool.name());
                    }
                });
        this.tools = Map.copyOf(byName);
        this.ordered = List.copyOf(byName.values());
        log.info("Registered answer tools: {}", byName.keySet());
    }

    public List<AnswerTool> all() {
        return this.ordered;
    }

    /**
     * Tools routable under the given document-actions toggle.
     */
    public List<AnswerTool> available(boolean documentActions) {
        return this.ordered.stream().filter(tool -> documentActions || !tool.documentAware()).toList();
    }

    public Optional<AnswerTool> find(String name) {
        return Optional.ofNullable(name == null ? null : this.tools.get(name));
    }
}
