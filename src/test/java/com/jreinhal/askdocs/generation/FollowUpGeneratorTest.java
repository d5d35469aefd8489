package com.jreinhal.askdocs.generation;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FollowUpGeneratorTest {
    private CompletionClient completionClient;
    private FollowUpGenerator generator;

    @BeforeEach
    void setUp() {
        this.completionClient = mock(CompletionClient.class);
        this.generator = new FollowUpGenerator(this.completionClient, new ObjectMapper());
    }

    private void reply(String text) {
        when(this.completionClient.complete(any(CompletionRequest.class))).thenReturn(new Completion(text, TokenUsage.NONE));
    }

    @Test
    void returnsAtMostThreeDistinctQuestions() {
        this.reply("{\"follow_ups\": [\"How do I request a refund?\", \"Are fees refundable?\", \"Are fees refundable?\", "
                + "\"What about store credit?\", \"Who approves refunds?\"]}");

        List<String> followUps = this.generator.suggest("refund policy", "Refunds within 30 days.");

        assertEquals(List.of("How do I request a refund?", "Are fees refundable?", "What about store credit?"), followUps);
    }

    @Test
    void fewerThanTwoUsableQuestionsGivesEmpty() {
        this.reply("{\"follow_ups\": [\"Only one?\"]}");

        assertTrue(this.generator.suggest("q", "a").isEmpty());
    }

    @Test
    void malformedReplyGivesEmpty() {
        this.reply("Sure! You could ask about shipping.");

        assertTrue(this.generator.suggest("q", "a").isEmpty());
    }

    @Test
    void backendFailureGivesEmptyInsteadOfThrowing() {
        when(this.completionClient.complete(any(CompletionRequest.class)))
                .thenThrow(new CompletionFailedException("timed out", null, true));

        assertEquals(List.of(), this.generator.suggest("q", "a"));
    }

    @Test
    void noTimeLeftSkipsTheCall() {
        assertTrue(this.generator.suggest("q", "a", "ctx", Duration.ZERO).isEmpty());
        verifyNoInteractions(this.completionClient);
    }
}
