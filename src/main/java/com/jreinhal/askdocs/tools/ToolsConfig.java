package com.jreinhal.askdocs.tools;

import com.jreinhal.askdocs.generation.CompletionClient;
import java.util.regex.Pattern;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Completion-backed answer tools. Document-aware tools are components in this package.
 */
@Configuration
public class ToolsConfig {
    @Value("${askdocs.tools.max-output-tokens:400}")
    private int maxOutputTokens;

    @Bean
    public AnswerTool summarizeTool(CompletionClient completionClient) {
        return new PromptedTool("summarize", "Summarize the relevant context",
                "Summarize the context succinctly for the query. Keep citations.",
                Pattern.compile("\\b(summari[sz]e|summary|tl;?dr|overview|gist)\\b", Pattern.CASE_INSENSITIVE),
                completionClient, this.maxOutputTokens);
    }

    @Bean
    public AnswerTool extractFactsTool(CompletionClient completionClient) {
        return new PromptedTool("extract_facts", "Extract factual statements with citations",
                "Extract factual statements from the context with citations.",
                Pattern.compile("\\b(extract|list|key)\\b.*\\b(facts?|points|figures)\\b", Pattern.CASE_INSENSITIVE),
                completionClient, this.maxOutputTokens);
    }

    @Bean
    public AnswerTool compareTool(CompletionClient completionClient) {
        return new PromptedTool("compare", "Compare entities or options",
                "Compare the key entities or options in the context. Use citations.",
                Pattern.compile("\\b(compare|comparison|versus|vs\\.?|difference between|differ)\\b", Pattern.CASE_INSENSITIVE),
                completionClient, this.maxOutputTokens);
    }

    @Bean
    public AnswerTool checklistTool(CompletionClient completionClient) {
        return new PromptedTool("generate_checklist", "Turn the context into a checklist",
                "Generate a checklist based on the context. Use citations.",
                Pattern.compile("\\b(check\\s?list|to-?do list|action items)\\b", Pattern.CASE_INSENSITIVE),
                completionClient, this.maxOutputTokens);
    }

    @Bean
    public AnswerTool draftEmailTool(CompletionClient completionClient) {
        return new PromptedTool("draft_email", "Draft an email grounded in the context",
                "Draft a professional email using the context. Cite sources if relevant.",
                Pattern.compile("\\b(draft|write|compose|prepare)\\b.*\\be-?mail\\b", Pattern.CASE_INSENSITIVE),
                completionClient, this.maxOutputTokens);
    }
}
