package com.jreinhal.askdocs.generation;

import com.jreinhal.askdocs.util.TokenEstimator;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * {@link CompletionClient} over the Spring AI {@link ChatClient}. Calls run on the LLM pool so
 * the caller can stop waiting at the timeout; the worker is interrupted on timeout.
 */
@Component
public class ChatClientCompletionClient implements CompletionClient {
    private static final Logger log = LoggerFactory.getLogger(ChatClientCompletionClient.class);
    private final ChatClient chatClient;
    private final ExecutorService llmExecutor;

    public ChatClientCompletionClient(ChatClient.Builder builder, @Qualifier("llmExecutor") ExecutorService llmExecutor) {
        this.chatClient = builder.build();
        this.llmExecutor = llmExecutor;
    }

    @Override
    public Completion complete(CompletionRequest request) {
        Future<Completion> future;
        try {
            future = this.llmExecutor.submit(() -> this.call(request));
        } catch (RejectedExecutionException e) {
            throw new CompletionFailedException("Completion pool saturated", e, false);
        }
        try {
            return future.get(request.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new CompletionFailedException("Completion timed out after " + request.timeout().toMillis() + "ms", e, true);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CompletionFailedException("Completion interrupted", e, false);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (log.isDebugEnabled()) {
                log.debug("Completion call failed: {}", cause.toString());
            }
            throw new CompletionFailedException("Completion failed: " + cause.getMessage(), cause, false);
        }
    }

    private Completion call(CompletionRequest request) {
        ChatOptions options = ChatOptions.builder()
                .temperature(request.temperature())
                .maxTokens(request.maxTokens())
                .build();
        ChatResponse response = this.chatClient.prompt()
                .messages(new SystemMessage(request.system()), new UserMessage(request.user()))
                .options(options)
                .call()
                .chatResponse();
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            throw new IllegalStateException("Completion backend returned no result");
        }
        String text = response.getResult().getOutput().getText();
        return new Completion(text == null ? "" : text, usageOf(response, request, text));
    }

    private static TokenUsage usageOf(ChatResponse response, CompletionRequest request, String text) {
        Usage usage = response.getMetadata() != null ? response.getMetadata().getUsage() : null;
        Integer prompt = usage != null ? usage.getPromptTokens() : null;
        Integer completion = usage != null ? usage.getCompletionTokens() : null;
        int promptTokens = prompt != null && prompt > 0 ? prompt : TokenEstimator.estimate(request.system()) + TokenEstimator.estimate(request.user());
        int completionTokens = completion != null && completion > 0 ? completion : TokenEstimator.estimate(text);
        return new TokenUsage(promptTokens, completionTokens);
    }
}
