package com.omegaagi.core.llm;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.metadata.ChatGenerationMetadata;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link SpringAiTextGenerationBackend}.
 * <p>
 * Mocks the {@link ChatClient} chain so no real model calls are made.
 */
class SpringAiTextGenerationBackendTest {

    private ChatClient mockChatClient;
    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private SpringAiTextGenerationBackend backend;

    @BeforeEach
    void setUp() {
        mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt(any(Prompt.class))).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        backend = new SpringAiTextGenerationBackend(mockBuilder);
    }

    private static ChatResponse response(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    @Test
    @DisplayName("sends the prompt verbatim as one user message with model and temperature options")
    void sendsPromptWithOptions() {
        when(mockCallResponse.chatResponse()).thenReturn(response("42"));

        String text = backend.generate("DEFINE_SYMBOLS{A=\"Answer\"}", "gpt-4o-mini", 0.3, 1_000);

        assertEquals("42", text);
        ArgumentCaptor<Prompt> captor = ArgumentCaptor.forClass(Prompt.class);
        verify(mockChatClient).prompt(captor.capture());
        Prompt prompt = captor.getValue();
        assertEquals(1, prompt.getInstructions().size());
        assertEquals("DEFINE_SYMBOLS{A=\"Answer\"}", prompt.getContents());
        assertEquals("gpt-4o-mini", prompt.getOptions().getModel());
        assertEquals(Double.valueOf(0.3), prompt.getOptions().getTemperature());
    }

    @Test
    @DisplayName("a response without generations yields empty text")
    void emptyResponse() {
        when(mockCallResponse.chatResponse()).thenReturn(new ChatResponse(List.of()));
        assertEquals("", backend.generate("p", "m", 0.0, 1_000));
    }

    @Test
    @DisplayName("a content-filter finish reason is a refusal")
    void contentFilterIsRefusal() {
        var generation = new Generation(new AssistantMessage(""),
                ChatGenerationMetadata.builder().finishReason("CONTENT_FILTER").build());
        when(mockCallResponse.chatResponse()).thenReturn(new ChatResponse(List.of(generation)));

        var ex = assertThrows(BackendException.class, () -> backend.generate("p", "m", 0.0, 1_000));
        assertTrue(ex.isRefusal());
    }

    @Test
    @DisplayName("transient Spring AI failures map to a transient reason")
    void transientFailure() {
        when(mockCallResponse.chatResponse()).thenThrow(new TransientAiException("429 Too Many Requests"));

        var ex = assertThrows(BackendException.class, () -> backend.generate("p", "m", 0.0, 1_000));
        assertEquals(BackendException.Reason.RATE_LIMITED, ex.reason());
        assertTrue(ex.isTransient());
    }

    @Test
    @DisplayName("network failures map to NETWORK")
    void networkFailure() {
        when(mockCallResponse.chatResponse()).thenThrow(new ResourceAccessException("connection refused"));

        var ex = assertThrows(BackendException.class, () -> backend.generate("p", "m", 0.0, 1_000));
        assertEquals(BackendException.Reason.NETWORK, ex.reason());
    }

    @Test
    @DisplayName("a content policy rejection maps to REFUSED, other rejections to FAILED")
    void nonTransientFailures() {
        when(mockCallResponse.chatResponse())
                .thenThrow(new NonTransientAiException("400 - {\"code\": \"content_policy_violation\"}"))
                .thenThrow(new NonTransientAiException("401 - invalid api key"));

        var refused = assertThrows(BackendException.class, () -> backend.generate("p", "m", 0.0, 1_000));
        assertEquals(BackendException.Reason.REFUSED, refused.reason());

        var failed = assertThrows(BackendException.class, () -> backend.generate("p", "m", 0.0, 1_000));
        assertEquals(BackendException.Reason.FAILED, failed.reason());
        assertFalse(failed.isTransient());
    }
}
