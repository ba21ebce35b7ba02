package com.agentflow.core.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Default {@link CapabilityInvoker} backed by Spring AI's {@link ChatClient}.
 * <p>
 * The model, temperature and token cap travel as per-call {@link ChatOptions},
 * so agents pointing at different models share one client. The invocation
 * context is sent as a JSON system message.
 */
@Service
public class ChatClientCapabilityInvoker implements CapabilityInvoker {

    private static final Logger log = LoggerFactory.getLogger(ChatClientCapabilityInvoker.class);

    private final ChatClient chatClient;
    private final ObjectMapper objectMapper;

    public ChatClientCapabilityInvoker(ChatClient.Builder builder, ObjectMapper objectMapper,
                                       @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        this.chatClient = builder.build();
        this.objectMapper = objectMapper;
        log.info("Capability invoker initialized, OpenAI base-url: {}", baseUrl);
    }

    @Override
    public String invoke(CapabilityRequest request) {
        String model = request.modelId();
        log.info("Capability call started → model {}", model);
        long start = System.currentTimeMillis();

        var options = ChatOptions.builder()
                .model(model)
                .temperature(request.temperature())
                .maxTokens(request.maxTokens())
                .build();

        var spec = chatClient.prompt()
                .options(options)
                .user(request.prompt());
        if (!request.context().isEmpty()) {
            spec = spec.system("Workflow context (JSON):\n" + toJson(request));
        }
        String response = spec.call().content();

        long elapsed = System.currentTimeMillis() - start;
        log.info("Capability call complete → model {} ({}s)", model, String.format("%.1f", elapsed / 1000.0));
        if (response == null || response.isBlank()) {
            throw new LlmEmptyResponseException("Model " + model + " returned empty content");
        }
        return response;
    }

    private String toJson(CapabilityRequest request) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(request.context());
        } catch (JsonProcessingException e) {
            throw new CapabilityException("Invocation context is not serializable: " + e.getOriginalMessage(), e);
        }
    }
}
