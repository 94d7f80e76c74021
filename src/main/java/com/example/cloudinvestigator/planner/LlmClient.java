package com.example.cloudinvestigator.planner;

import com.example.cloudinvestigator.config.InvestigatorProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Client for OpenAI-compatible chat completion endpoints.
 * <p>
 * The endpoint comes from {@code cloud-investigator.llm.base-url} when set,
 * otherwise from the provider name (openai, ollama).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LlmClient {

    private static final String OPENAI_API_URL = "https://api.openai.com/v1/chat/completions";
    private static final String OLLAMA_API_URL = "http://localhost:11434/v1/chat/completions";
    private static final MediaType JSON = MediaType.get("application/json");

    private final InvestigatorProperties properties;
    private final ObjectMapper objectMapper;
    private final OkHttpClient httpClient;

    /**
     * Send a conversation and return the assistant's text.
     *
     * @param timeout upper bound for the whole call
     * @throws PlannerException if the call fails or the response has no content
     */
    public String complete(List<ChatMessage> messages, Duration timeout) {
        InvestigatorProperties.LlmConfig cfg = properties.getLlm();
        if (requiresApiKey() && (cfg.getApiKey() == null || cfg.getApiKey().isBlank())) {
            throw new PlannerException("No API key configured for LLM provider '" + cfg.getProvider() + "'");
        }

        String body;
        try {
            body = buildRequestBody(messages);
        } catch (IOException e) {
            throw new PlannerException("Failed to build LLM request", e);
        }
        log.debug("LLM request with {} messages to {}", messages.size(), getApiUrl());

        Request.Builder request = new Request.Builder()
                .url(getApiUrl())
                .addHeader("Content-Type", "application/json")
                .post(RequestBody.create(body, JSON));
        if (cfg.getApiKey() != null && !cfg.getApiKey().isBlank()) {
            request.addHeader("Authorization", "Bearer " + cfg.getApiKey());
        }

        long cap = Math.min(timeout.toMillis(), Duration.ofSeconds(cfg.getTimeoutSeconds()).toMillis());
        OkHttpClient client = httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(Math.max(1, cap)))
                .readTimeout(Duration.ofMillis(Math.max(1, cap)))
                .build();

        try (Response response = client.newCall(request.build()).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                log.error("LLM API error: {} - {}", response.code(), text);
                throw new PlannerException("LLM API returned " + response.code());
            }
            return parseContent(text);
        } catch (IOException e) {
            throw new PlannerException("Failed to communicate with LLM: " + e.getMessage(), e);
        }
    }

    String getApiUrl() {
        InvestigatorProperties.LlmConfig cfg = properties.getLlm();
        if (cfg.getBaseUrl() != null && !cfg.getBaseUrl().isBlank()) {
            return cfg.getBaseUrl();
        }
        return switch (cfg.getProvider().toLowerCase(Locale.ROOT)) {
            case "ollama" -> OLLAMA_API_URL;
            default -> OPENAI_API_URL;
        };
    }

    private boolean requiresApiKey() {
        InvestigatorProperties.LlmConfig cfg = properties.getLlm();
        boolean customEndpoint = cfg.getBaseUrl() != null && !cfg.getBaseUrl().isBlank();
        return !customEndpoint && !"ollama".equalsIgnoreCase(cfg.getProvider());
    }

    private String buildRequestBody(List<ChatMessage> messages) throws IOException {
        InvestigatorProperties.LlmConfig cfg = properties.getLlm();
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", cfg.getModel());
        root.put("temperature", cfg.getTemperature());
        root.put("max_tokens", cfg.getMaxTokens());

        ArrayNode messagesArray = root.putArray("messages");
        for (ChatMessage msg : messages) {
            ObjectNode msgNode = messagesArray.addObject();
            msgNode.put("role", msg.getRole().name().toLowerCase(Locale.ROOT));
            msgNode.put("content", msg.getContent());
        }
        return objectMapper.writeValueAsString(root);
    }

    private String parseContent(String responseBody) throws IOException {
        JsonNode root = objectMapper.readTree(responseBody);
        JsonNode choices = root.get("choices");
        if (choices == null || choices.isEmpty()) {
            throw new PlannerException("No choices in LLM response");
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull() || content.asText().isBlank()) {
            throw new PlannerException("Empty content in LLM response");
        }
        return content.asText();
    }
}
