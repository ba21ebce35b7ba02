package com.agentflow.core.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.client.ChatClient.CallResponseSpec;
import org.springframework.ai.chat.client.ChatClient.ChatClientRequestSpec;
import org.springframework.ai.chat.prompt.ChatOptions;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Mocks the entire {@link ChatClient} chain so no real model calls are made.
 */
class ChatClientCapabilityInvokerTest {

    private ChatClientRequestSpec mockRequestSpec;
    private CallResponseSpec mockCallResponse;
    private ChatClientCapabilityInvoker capabilityInvoker;

    @BeforeEach
    void setUp() {
        ChatClient mockChatClient = mock(ChatClient.class);
        mockRequestSpec = mock(ChatClientRequestSpec.class);
        mockCallResponse = mock(CallResponseSpec.class);

        when(mockChatClient.prompt()).thenReturn(mockRequestSpec);
        when(mockRequestSpec.options(any(ChatOptions.class))).thenReturn(mockRequestSpec);
        when(mockRequestSpec.system(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.user(anyString())).thenReturn(mockRequestSpec);
        when(mockRequestSpec.call()).thenReturn(mockCallResponse);

        ChatClient.Builder mockBuilder = mock(ChatClient.Builder.class);
        when(mockBuilder.build()).thenReturn(mockChatClient);

        capabilityInvoker = new ChatClientCapabilityInvoker(mockBuilder, new ObjectMapper(), "http://test:1234");
    }

    @Test
    @DisplayName("sends the prompt with per-call model options")
    void sendsPromptAndOptions() {
        when(mockCallResponse.content()).thenReturn("answer");

        String result = capabilityInvoker.invoke(
                new CapabilityRequest("gpt-4o-mini", "Summarize", Map.of(), 0.3, 256));

        assertEquals("answer", result);
        verify(mockRequestSpec).user("Summarize");
        verify(mockRequestSpec, never()).system(anyString());

        var optionsCaptor = ArgumentCaptor.forClass(ChatOptions.class);
        verify(mockRequestSpec).options(optionsCaptor.capture());
        assertEquals("gpt-4o-mini", optionsCaptor.getValue().getModel());
        assertEquals(0.3, optionsCaptor.getValue().getTemperature());
        assertEquals(256, optionsCaptor.getValue().getMaxTokens());
    }

    @Test
    @DisplayName("non-empty context is sent as a JSON system message")
    void sendsContext() {
        when(mockCallResponse.content()).thenReturn("ok");

        capabilityInvoker.invoke(new CapabilityRequest("m", "p", Map.of("topic", "graphs"), null, null));

        var systemCaptor = ArgumentCaptor.forClass(String.class);
        verify(mockRequestSpec).system(systemCaptor.capture());
        assertTrue(systemCaptor.getValue().startsWith("Workflow context (JSON):"));
        assertTrue(systemCaptor.getValue().contains("\"topic\" : \"graphs\""));
    }

    @Test
    @DisplayName("blank response is an error")
    void blankResponse() {
        when(mockCallResponse.content()).thenReturn("  ");

        assertThrows(LlmEmptyResponseException.class,
                () -> capabilityInvoker.invoke(new CapabilityRequest("m", "p", Map.of(), null, null)));
    }
}
