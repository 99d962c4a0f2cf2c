package llm;

import com.fasterxml.jackson.databind.JsonNode;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.List;
import java.util.Map;

// Anthropic Messages API.
class AnthropicClient extends HttpLlmClient {

    static final URI ENDPOINT = URI.create("https://api.anthropic.com/v1/messages");
    static final String API_VERSION = "2023-06-01";

    AnthropicClient(String apiKey, String model, Duration timeout) {
        this(ENDPOINT, apiKey, model, timeout);
    }

    AnthropicClient(URI endpoint, String apiKey, String model, Duration timeout) {
        super(endpoint, apiKey, model, timeout);
    }

    @Override
    protected String provider() {
        return "anthropic";
    }

    @Override
    protected Map<String, Object> requestBody(String model, String system, String user) {
        return Map.of(
                "model", model,
                "max_tokens", MAX_TOKENS,
                "system", system,
                "messages", List.of(Map.of("role", "user", "content", user))
        );
    }

    @Override
    protected void authenticate(HttpRequest.Builder request, String apiKey) {
        request.header("x-api-key", apiKey);
        request.header("anthropic-version", API_VERSION);
    }

    @Override
    protected String extractText(JsonNode root) {
        StringBuilder sb = new StringBuilder();
        for (JsonNode block : root.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                sb.append(block.path("text").asText(""));
            }
        }
        return sb.toString();
    }
}
