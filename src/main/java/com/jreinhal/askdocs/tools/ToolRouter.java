package com.jreinhal.askdocs.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.askdocs.generation.CompletionClient;
import com.jreinhal.askdocs.generation.CompletionFailedException;
import com.jreinhal.askdocs.generation.CompletionRequest;
import com.jreinhal.askdocs.generation.LlmJson;
import com.jreinhal.askdocs.util.LogSanitizer;
import jakarta.annotation.PostConstruct;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Classifies query intent onto one of the registered {@link AnswerTool}s, or none for plain
 * question answering.
 *
 * <p>{@code RULES} mode matches each tool's intent pattern in registry order. {@code LLM} mode
 * asks the completion backend to pick from the available tool names and falls back to the
 * rules when the call fails or names an unknown tool.</p>
 */
@Component
public class ToolRouter {
    private static final Logger log = LoggerFactory.getLogger(ToolRouter.class);
    static final String NONE = "none";

    public enum Mode {
        RULES,
        LLM
    }

    private final ToolRegistry registry;
    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;
    @Value("${askdocs.tools.router-mode:rules}")
    private String routerMode = "rules";
    @Value("${askdocs.tools.router-timeout-ms:5000}")
    private long timeoutMs = 5000L;
    private Mode mode = Mode.RULES;

    public ToolRouter(ToolRegistry registry, CompletionClient completionClient, ObjectMapper objectMapper) {
        this.registry = registry;
        this.completionClient = completionClient;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        this.mode = Mode.valueOf(this.routerMode.trim().toUpperCase(Locale.ROOT));
        log.info("Tool router mode: {}", this.mode);
    }

    public Optional<ToolSelection> route(String query, String context) {
        return this.route(query, context, true, Duration.ofMillis(this.timeoutMs));
    }

    public Optional<ToolSelection> route(String query, String context, boolean documentActions, Duration timeout) {
        List<AnswerTool> available = this.registry.available(documentActions);
        if (query == null || query.isBlank() || available.isEmpty()) {
            return Optional.empty();
        }
        if (this.mode == Mode.LLM) {
            Classification classified = this.classify(query, context, available, timeout);
            if (classified.obtained()) {
                return Optional.ofNullable(classified.selection());
            }
        }
        return matchRules(query, available);
    }

    static Optional<ToolSelection> matchRules(String query, List<AnswerTool> available) {
        for (AnswerTool tool : available) {
            if (tool.intentPattern().matcher(query).find()) {
                return Optional.of(new ToolSelection(tool, "rules", "matched " + tool.intentPattern().pattern()));
            }
        }
        return Optional.empty();
    }

    private Classification classify(String query, String context, List<AnswerTool> available, Duration timeout) {
        StringBuilder system = new StringBuilder("Choose the single best tool for the user's request. Available tools:\n");
        for (AnswerTool tool : available) {
            system.append("- ").append(tool.name()).append(": ").append(tool.description()).append('\n');
        }
        system.append("- ").append(NONE).append(": answer the question directly\n")
                .append("Return JSON only: {\"tool\": \"<name>\", \"reason\": \"<short reason>\"}");
        String user = "Query: " + query + "\n\nContext preview:\n" + LogSanitizer.truncate(context, PromptedTool.CONTEXT_PREVIEW_CHARS);
        try {
            String raw = this.completionClient.complete(new CompletionRequest(system.toString(), user, 100, 0.0, timeout)).text();
            JsonNode json = LlmJson.parseObject(this.objectMapper, raw);
            String name = json.path("tool").asText("").trim();
            String reason = json.path("reason").asText("");
            if (NONE.equals(name)) {
                return new Classification(true, null);
            }
            for (AnswerTool tool : available) {
                if (tool.name().equals(name)) {
                    return new Classification(true, new ToolSelection(tool, "llm", reason));
                }
            }
            log.warn("Tool classifier named unavailable tool '{}', using rule routing", LogSanitizer.sanitize(name));
        } catch (CompletionFailedException e) {
            log.warn("Tool classification failed for {}, using rule routing: {}", LogSanitizer.querySummary(query), e.getMessage());
        }
        return new Classification(false, null);
    }

    public Mode getMode() {
        return this.mode;
    }

    // obtained=false means the classifier gave no usable answer; a null selection means "no tool"
    private record Classification(boolean obtained, ToolSelection selection) {
    }
}
