package com.jreinhal.askdocs.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jreinhal.askdocs.util.LogSanitizer;
import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Suggests two or three next questions. Best effort: any failure yields an empty list.
 */
@Service
public class FollowUpGenerator {
    private static final Logger log = LoggerFactory.getLogger(FollowUpGenerator.class);
    static final String SYSTEM_PROMPT = "Suggest short follow-up questions the user could ask next about the same documents. "
            + "Return JSON only: {\"follow_ups\": [\"question\", \"question\"]}";
    private static final int MAX_FOLLOW_UPS = 3;
    private static final int MIN_FOLLOW_UPS = 2;
    private static final int MAX_QUESTION_CHARS = 200;
    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;
    @Value("${askdocs.followups.timeout-ms:8000}")
    private long timeoutMs = 8000L;
    @Value("${askdocs.followups.context-preview-chars:800}")
    private int contextPreviewChars = 800;

    public FollowUpGenerator(CompletionClient completionClient, ObjectMapper objectMapper) {
        this.completionClient = completionClient;
        this.objectMapper = objectMapper;
    }

    public List<String> suggest(String query, String answer) {
        return this.suggest(query, answer, null, Duration.ofMillis(this.timeoutMs));
    }

    public List<String> suggest(String query, String answer, String context, Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            return List.of();
        }
        StringBuilder prompt = new StringBuilder()
                .append("Question: ").append(query)
                .append("\n\nAnswer: ").append(answer == null ? "" : answer);
        if (context != null && !context.isBlank()) {
            prompt.append("\n\nContext:\n").append(LogSanitizer.truncate(context, this.contextPreviewChars));
        }
        try {
            Completion completion = this.completionClient.complete(new CompletionRequest(SYSTEM_PROMPT, prompt.toString(), 200, 0.3,
                    timeout.compareTo(Duration.ofMillis(this.timeoutMs)) < 0 ? timeout : Duration.ofMillis(this.timeoutMs)));
            JsonNode json = LlmJson.parseObject(this.objectMapper, completion.text());
            Set<String> questions = new LinkedHashSet<>();
            for (String question : LlmJson.textList(json.path("follow_ups"))) {
                if (question.length() <= MAX_QUESTION_CHARS) {
                    questions.add(question);
                }
                if (questions.size() == MAX_FOLLOW_UPS) {
                    break;
                }
            }
            if (questions.size() < MIN_FOLLOW_UPS) {
                if (log.isDebugEnabled()) {
                    log.debug("Follow-up response for {} held {} usable questions, dropping", LogSanitizer.querySummary(query), questions.size());
                }
                return List.of();
            }
            return List.copyOf(questions);
        } catch (RuntimeException e) {
            log.warn("Follow-up generation failed for {}: {}", LogSanitizer.querySummary(query), e.getMessage());
            return List.of();
        }
    }
}
