package com.jreinhal.askdocs.tools;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Collects table-like blocks from the context: runs of consecutive lines containing a pipe or a
 * tab.
 */
@Component
public class FindTablesTool implements AnswerTool {
    static final String NONE_FOUND = "No tables found in the provided context.";
    private static final Pattern INTENT = Pattern.compile("\\b(tables?|tabular)\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "find_tables";
    }

    @Override
    public String description() {
        return "Find tables in the retrieved passages";
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
        List<String> tables = findTables(request.context());
        if (tables.isEmpty()) {
            return new ToolOutput(this.name(), NONE_FOUND, Map.of("tables", 0));
        }
        StringBuilder text = new StringBuilder();
        for (int i = 0; i < tables.size(); i++) {
            if (i > 0) {
                text.append("\n\n");
            }
            text.append("Table ").append(i + 1).append(":\n").append(tables.get(i));
        }
        return new ToolOutput(this.name(), text.toString(), Map.of("tables", tables.size()));
    }

    static List<String> findTables(String context) {
        List<String> tables = new ArrayList<>();
        if (context == null) {
            return tables;
        }
        List<String> current = new ArrayList<>();
        for (String line : context.split("\n", -1)) {
            if (line.contains("|") || line.contains("\t")) {
                current.add(line);
            } else if (!current.isEmpty()) {
                tables.add(String.join("\n", current));
                current.clear();
            }
        }
        if (!current.isEmpty()) {
            tables.add(String.join("\n", current));
        }
        return tables;
    }
}
