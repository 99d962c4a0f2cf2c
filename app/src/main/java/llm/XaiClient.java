package llm;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.List;
import java.util.Map;

// xAI Grok over its OpenAI-compatible chat completions endpoint.
class XaiClient extends HttpLlmClient {

    static final URI ENDPOINT = URI.create("https://api.x.ai/v1/chat/completions");

    XaiClient(String apiKey, String model, Duration timeout) {
        this(ENDPOINT, apiKey, model, timeout);
    }

    XaiClient(URI endpoint, String apiKey, String model, Duration timeout) {
        super(endpoint, apiKey, model, timeout);
    }

    @Override
    protected String provider() {
        return "xai";
    }

    @Override
    protected Map<String, Object> requestBody(String model, String system, String user) {
        return Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", system),
                        Map.of("role", "user", "content", user)
                ),
                "temperature", 0.2,
                "max_tokens", MAX_TOKENS
        );
    }

    @Override
    protected void authenticate(HttpRequest.Builder request, String apiKey) {
        request.header("Authorization", "Bearer " + apiKey);
    }

    @Override
    protected String extractText(JsonNode root) {
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.size() == 0) return null;
        return choices.get(0).path("message").path("content").asText("");
    }
}
