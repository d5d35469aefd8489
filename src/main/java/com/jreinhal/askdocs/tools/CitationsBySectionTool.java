package com.jreinhal.askdocs.tools;

import com.jreinhal.askdocs.retrieval.Candidate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Lists the context's citations grouped by the section their chunk came from.
 */
@Component
public class CitationsBySectionTool implements AnswerTool {
    static final String NONE_FOUND = "No citations available.";
    static final String UNSECTIONED = "General";
    private static final int SNIPPET_CHARS = 160;
    private static final Pattern INTENT = Pattern.compile(
            "\\b(citations?|sources?|references?)\\b.*\\bsections?\\b|\\bcite\\b|\\bwhich sections?\\b", Pattern.CASE_INSENSITIVE);

    @Override
    public String name() {
        return "citations_by_section";
    }

    @Override
    public String description() {
        return "Group the supporting citations by document section";
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
        List<Candidate> candidates = request.usedCandidates();
        if (candidates == null || candidates.isEmpty()) {
            return new ToolOutput(this.name(), NONE_FOUND, Map.of("sections", 0));
        }
        Map<String, List<String>> bySection = new LinkedHashMap<>();
        for (Candidate candidate : candidates) {
            String section = candidate.chunk().section() == null || candidate.chunk().section().isBlank()
                    ? UNSECTIONED : candidate.chunk().section();
            bySection.computeIfAbsent(section, s -> new ArrayList<>())
                    .add("[" + candidate.chunkId() + "] " + snippet(candidate.chunk().text()));
        }
        StringBuilder text = new StringBuilder();
        bySection.forEach((section, lines) -> {
            if (text.length() > 0) {
                text.append("\n\n");
            }
            text.append(section).append(":\n").append(String.join("\n", lines));
        });
        return new ToolOutput(this.name(), text.toString(), Map.of("sections", bySection.size(), "citations", candidates.size()));
    }

    static String snippet(String text) {
        String flat = text.replace('\n', ' ').trim();
        return flat.length() > SNIPPET_CHARS ? flat.substring(0, SNIPPET_CHARS) : flat;
    }
}
