package llm;

import checks.Finding;
import checks.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class XaiClientTest {

    private static final List<Finding> FINDINGS = List.of(
            new Finding("title-missing", "https://example.com", Severity.CRITICAL, "Page has no <title>"));

    @Test
    void sendsChatCompletionAndReturnsFirstChoice() throws Exception {
        try (StubProvider provider = new StubProvider()) {
            provider.respond(200, """
                    {"choices":[{"message":{"role":"assistant","content":"  ## Summary\\nFix titles.  "}}]}
                    """);
            XaiClient client = new XaiClient(provider.uri(), "xai-secret", "grok-4", Duration.ofSeconds(5));

            String text = client.synthesize("https://example.com", FINDINGS, "Look at titles");

            assertEquals("## Summary\nFix titles.", text);
            assertEquals("Bearer xai-secret", provider.lastHeaders.get("authorization"));

            JsonNode sent = new ObjectMapper().readTree(provider.requestBodies.get(0));
            assertEquals("grok-4", sent.path("model").asText());
            assertEquals("system", sent.path("messages").get(0).path("role").asText());
            String user = sent.path("messages").get(1).path("content").asText();
            assertTrue(user.contains("- critical | title-missing | https://example.com | Page has no <title> | "));
            assertTrue(user.contains("Look at titles"));
        }
    }

    @Test
    void providerErrorBecomesLlmException() throws Exception {
        try (StubProvider provider = new StubProvider()) {
            provider.respond(401, "{\"error\":\"Incorrect API key provided\"}");
            XaiClient client = new XaiClient(provider.uri(), "bad", "grok-4", Duration.ofSeconds(5));

            LlmException e = assertThrows(LlmException.class,
                    () -> client.synthesize("https://example.com", FINDINGS, null));

            assertEquals("xai:grok-4 returned HTTP 401: Incorrect API key provided", e.getMessage());
        }
    }

    @Test
    void emptyChoicesAreRejected() throws Exception {
        try (StubProvider provider = new StubProvider()) {
            provider.respond(200, "{\"choices\":[]}");
            XaiClient client = new XaiClient(provider.uri(), "k", "grok-4", Duration.ofSeconds(5));

            LlmException e = assertThrows(LlmException.class,
                    () -> client.synthesize("https://example.com", FINDINGS, null));

            assertEquals("xai:grok-4 returned an empty response", e.getMessage());
        }
    }

    @Test
    void malformedJsonIsRejected() throws Exception {
        try (StubProvider provider = new StubProvider()) {
            provider.respond(200, "<html>gateway</html>");
            XaiClient client = new XaiClient(provider.uri(), "k", "grok-4", Duration.ofSeconds(5));

            LlmException e = assertThrows(LlmException.class,
                    () -> client.synthesize("https://example.com", FINDINGS, null));

            assertEquals("xai:grok-4 returned malformed JSON", e.getMessage());
        }
    }

    @Test
    void slowProviderTimesOut() throws Exception {
        try (StubProvider provider = new StubProvider()) {
            provider.respond(200, "{}").delay(3000);
            XaiClient client = new XaiClient(provider.uri(), "k", "grok-4", Duration.ofMillis(300));

            LlmException e = assertThrows(LlmException.class,
                    () -> client.synthesize("https://example.com", FINDINGS, null));

            assertTrue(e.getMessage().startsWith("xai:grok-4 timed out"), e.getMessage());
        }
    }
}
