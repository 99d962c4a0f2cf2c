package llm;

import checks.Finding;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

// One POST per synthesis, bounded by the configured timeout.
abstract class HttpLlmClient implements LlmClient {

    private static final Logger log = LoggerFactory.getLogger(HttpLlmClient.class);

    static final int MAX_TOKENS = 4096;

    protected final ObjectMapper om = new ObjectMapper();

    private final HttpClient http;
    private final URI endpoint;
    private final String apiKey;
    private final String model;
    private final Duration timeout;

    HttpLlmClient(URI endpoint, String apiKey, String model, Duration timeout) {
        this.endpoint = endpoint;
        this.apiKey = apiKey;
        this.model = model;
        this.timeout = timeout;
        this.http = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    protected abstract String provider();

    protected abstract Map<String, Object> requestBody(String model, String system, String user);

    protected abstract void authenticate(HttpRequest.Builder request, String apiKey);

    // Narrative text from a successful response body; null or blank when the shape is unexpected.
    protected abstract String extractText(JsonNode root);

    public String model() {
        return model;
    }

    @Override
    public String name() {
        return provider() + ":" + model;
    }

    @Override
    public String synthesize(String startUrl, List<Finding> findings, String planContent) throws LlmException {
        String user = SynthesisPrompt.user(startUrl, findings, planContent);

        String body;
        try {
            body = om.writeValueAsString(requestBody(model, SynthesisPrompt.SYSTEM, user));
        } catch (JsonProcessingException e) {
            throw new LlmException("Could not encode request: " + e.getOriginalMessage(), e);
        }

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(endpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body));
        authenticate(request, apiKey);

        log.debug("Requesting narrative from {} ({} findings, plan: {})", name(), findings.size(),
                planContent == null ? "none" : planContent.length() + " chars");

        HttpResponse<String> response;
        try {
            response = http.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            throw new LlmException(name() + " timed out after " + timeout.toSeconds() + " s", e);
        } catch (IOException e) {
            throw new LlmException(name() + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmException(name() + " request interrupted", e);
        }

        if (response.statusCode() / 100 != 2) {
            throw new LlmException(name() + " returned HTTP " + response.statusCode() + errorDetail(response.body()));
        }

        String text;
        try {
            text = extractText(om.readTree(response.body()));
        } catch (JsonProcessingException e) {
            throw new LlmException(name() + " returned malformed JSON", e);
        }
        if (text == null || text.isBlank()) {
            throw new LlmException(name() + " returned an empty response");
        }
        return text.strip();
    }

    // Provider error message when the body carries one, so reports say more than a status code.
    private String errorDetail(String body) {
        try {
            JsonNode error = om.readTree(body).path("error");
            String message = error.isTextual() ? error.asText() : error.path("message").asText("");
            return message.isBlank() ? "" : ": " + message;
        } catch (JsonProcessingException | RuntimeException e) {
            return "";
        }
    }
}
