package com.jreinhal.askdocs.tools;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Lists {@code Term: definition} lines from the context.
 */
@Component
public class ListDefinitionsTool implements AnswerTool {
    static final String NONE_FOUND = "No definition-style lines found in the provided context.";
    private static final Pattern INTENT = Pattern.compile("\\b(definitions?|define|glossary|terminology)\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern DEFINITION_LINE = Pattern.compile("^\\s*([A-Za-z0-9][^:\\[\\]]{1,60}):\\s+(.+)$");

    @Override
    public String name() {
        return "list_definitions";
    }

    @Override
    public String description() {
        return "List term definitions found in the retrieved passages";
    }

    @Override
    public boolean documentAware() {
        return true;
    }

    @Override
    public Pattern intentPattern() {
        return INTENT;
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public ToolOutput execute(ToolRequest request) {
        Map<String, String> definitions = findDefinitions(request.context());
        if (definitions.isEmpty()) {
            return new ToolOutput(this.name(), NONE_FOUND, Map.of("definitions", 0));
        }
        StringBuilder text = new StringBuilder();
        definitions.forEach((term, definition) -> {
            if (text.length() > 0) {
                text.append('\n');
            }
            text.append("- ").append(term).append(": ").append(definition);
        });
        return new ToolOutput(this.name(), text.toString(), Map.of("definitions", definitions.size()));
    }

    static Map<String, String> findDefinitions(String context) {
        Map<String, String> definitions = new LinkedHashMap<>();
        if (context == null) {
            return definitions;
        }
        for (String line : context.split("\n")) {
            // citation headers start blocks; look at the text after them
            String body = line.startsWith("[") && line.indexOf("] ") > 0 ? line.substring(line.indexOf("] ") + 2) : line;
            Matcher matcher = DEFINITION_LINE.matcher(body);
            if (matcher.matches()) {
                definitions.putIfAbsent(matcher.group(1).trim(), matcher.group(2).trim());
            }
        }
        return definitions;
    }
}
