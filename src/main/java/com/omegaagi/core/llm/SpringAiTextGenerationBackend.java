package com.omegaagi.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;

import java.util.Locale;
import java.util.Set;

/**
 * {@link TextGenerationBackend} backed by Spring AI's {@link ChatClient}.
 * <p>
 * The prompt is sent as a single user message, so braces in Omega scripts are never
 * treated as template placeholders. Model and temperature are set per call. The call
 * itself is bounded by {@link LlmService}, which abandons it when the timeout expires.
 */
@Component
public class SpringAiTextGenerationBackend implements TextGenerationBackend {

    private static final Logger log = LoggerFactory.getLogger(SpringAiTextGenerationBackend.class);

    private static final Set<String> REFUSAL_FINISH_REASONS = Set.of("content_filter", "safety", "refusal");
    private static final Set<String> REFUSAL_MARKERS = Set.of("content_policy", "content policy", "content management policy");

    private final ChatClient chatClient;

    public SpringAiTextGenerationBackend(ChatClient.Builder builder) {
        this.chatClient = builder.build();
    }

    @Override
    public String generate(String prompt, String modelId, double temperature, long timeoutMs) {
        var options = ChatOptions.builder()
                .model(modelId)
                .temperature(temperature)
                .build();

        ChatResponse response;
        try {
            response = chatClient.prompt(new Prompt(new UserMessage(prompt), options))
                    .call()
                    .chatResponse();
        } catch (TransientAiException e) {
            throw new BackendException("Model call failed transiently", BackendException.Reason.RATE_LIMITED, e);
        } catch (ResourceAccessException e) {
            throw new BackendException("Model endpoint unreachable", BackendException.Reason.NETWORK, e);
        } catch (NonTransientAiException e) {
            if (mentionsPolicy(e.getMessage())) {
                throw new BackendException("Model refused the request", BackendException.Reason.REFUSED, e);
            }
            throw new BackendException("Model call failed", BackendException.Reason.FAILED, e);
        }

        if (response == null || response.getResult() == null) {
            log.warn("Model {} returned no generation", modelId);
            return "";
        }
        var result = response.getResult();
        String finishReason = result.getMetadata() != null ? result.getMetadata().getFinishReason() : null;
        if (finishReason != null && REFUSAL_FINISH_REASONS.contains(finishReason.toLowerCase(Locale.ROOT))) {
            throw new BackendException("Model stopped with finish reason " + finishReason,
                    BackendException.Reason.REFUSED);
        }
        String text = result.getOutput() != null ? result.getOutput().getText() : null;
        return text == null ? "" : text;
    }

    private static boolean mentionsPolicy(String message) {
        if (message == null) {
            return false;
        }
        String lower = message.toLowerCase(Locale.ROOT);
        return REFUSAL_MARKERS.stream().anyMatch(lower::contains);
    }
}
