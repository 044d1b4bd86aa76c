package visualwatch.feedback;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import visualwatch.config.MonitorConfig;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Client for an OpenAI-compatible {@code /chat/completions} endpoint (Ollama,
 * vLLM, OpenAI). Retries on 5xx responses and I/O errors; other HTTP errors and
 * malformed replies fail immediately.
 */
public class LLMClient {

    private static final Logger log = LoggerFactory.getLogger(LLMClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String baseUrl;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final int retryCount;
    private final long retryDelayMs;
    private final OkHttpClient httpClient;

    public LLMClient(String baseUrl, String model, double temperature, int maxTokens,
                     int timeoutSec, int retryCount, long retryDelayMs) {
        this.baseUrl      = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model        = model;
        this.temperature  = temperature;
        this.maxTokens    = maxTokens;
        this.retryCount   = retryCount;
        this.retryDelayMs = retryDelayMs;
        this.httpClient   = new OkHttpClient.Builder()
                .connectTimeout(30, TimeUnit.SECONDS)
                .readTimeout(timeoutSec, TimeUnit.SECONDS)
                .writeTimeout(30, TimeUnit.SECONDS)
                .build();
    }

    /** Builds a client from the {@code ai.llm.*} keys of {@code config}. */
    public static LLMClient fromConfig(MonitorConfig config) {
        log.info("LLMClient configured: baseUrl={}, model={}, timeoutSec={}, retryCount={}",
                config.getLlmBaseUrl(), config.getLlmModel(), config.getLlmTimeoutSec(), config.getLlmRetryCount());
        return new LLMClient(config.getLlmBaseUrl(), config.getLlmModel(), config.getLlmTemperature(),
                config.getLlmMaxTokens(), config.getLlmTimeoutSec(), config.getLlmRetryCount(),
                config.getLlmRetryDelayMs());
    }

    /**
     * Sends a chat completion request.
     *
     * @param messages conversation in order
     * @return the assistant's reply ({@code choices[0].message.content}), trimmed
     * @throws IOException if the request fails after all retries
     */
    public String complete(List<ChatMessage> messages) throws IOException {
        String requestJson = buildRequestJson(messages);
        String url = baseUrl + "/chat/completions";
        log.debug("LLM request to {} | model={} | {} message(s)", url, model, messages.size());

        IOException lastException = null;

        for (int attempt = 0; attempt <= retryCount; attempt++) {
            if (attempt > 0) {
                log.warn("Retrying LLM request (attempt {}/{}) after {}ms delay",
                        attempt, retryCount, retryDelayMs);
                try {
                    Thread.sleep(retryDelayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted during retry delay", ie);
                }
            }

            Request request = new Request.Builder()
                    .url(url)
                    .post(RequestBody.create(requestJson, JSON))
                    .build();

            Response response;
            try {
                response = httpClient.newCall(request).execute();
            } catch (IOException e) {
                log.warn("LLM request I/O error on attempt {}: {}", attempt + 1, e.getMessage());
                lastException = e;
                continue;
            }

            try (response) {
                int statusCode = response.code();
                String body = response.body() != null ? response.body().string() : "";

                if (statusCode >= 500) {
                    log.warn("LLM endpoint returned {} on attempt {}: {}", statusCode, attempt + 1, body);
                    lastException = new IOException(
                            "LLM server error " + statusCode + " after " + (attempt + 1) + " attempt(s): " + body);
                    continue;
                }
                if (!response.isSuccessful()) {
                    throw new LLMResponseException("LLM request failed with HTTP " + statusCode + ": " + body);
                }
                return parseContent(body);
            }
        }

        throw new IOException(
                "LLM request failed after " + (retryCount + 1) + " attempt(s). Last error: "
                        + (lastException != null ? lastException.getMessage() : "unknown"),
                lastException);
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private String buildRequestJson(List<ChatMessage> messages) throws IOException {
        ObjectNode root = MAPPER.createObjectNode();
        root.put("model", model);
        root.put("temperature", temperature);
        root.put("max_tokens", maxTokens);
        root.put("stream", false);

        ArrayNode msgs = root.putArray("messages");
        for (ChatMessage msg : messages) {
            ObjectNode msgNode = msgs.addObject();
            msgNode.put("role", msg.role());
            msgNode.put("content", msg.content());
        }
        return MAPPER.writeValueAsString(root);
    }

    private static String parseContent(String responseBody) throws IOException {
        JsonNode root;
        try {
            root = MAPPER.readTree(responseBody);
        } catch (JsonProcessingException e) {
            throw new LLMResponseException("Failed to parse LLM response JSON: " + e.getOriginalMessage());
        }
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            throw new LLMResponseException("LLM response missing 'choices' array: " + responseBody);
        }
        JsonNode content = choices.get(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            throw new LLMResponseException("LLM response missing choices[0].message.content: " + responseBody);
        }
        return content.asText().trim();
    }

    // ── Nested types ──────────────────────────────────────────────────────

    /** One chat turn. */
    public record ChatMessage(String role, String content) {

        public static ChatMessage system(String content) {
            return new ChatMessage("system", content);
        }

        public static ChatMessage user(String content) {
            return new ChatMessage("user", content);
        }
    }

    /** Non-retriable failure: 4xx status or a reply that is not a chat completion. */
    public static class LLMResponseException extends IOException {
        public LLMResponseException(String msg) { super(msg); }
    }
}
