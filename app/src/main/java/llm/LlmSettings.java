package llm;

import java.time.Duration;
import java.util.Objects;

// Credentials and limits the provider clients need.
public record LlmSettings(String xaiApiKey, String anthropicApiKey, Duration timeout) {

    public LlmSettings {
        Objects.requireNonNull(timeout, "timeout");
        xaiApiKey = xaiApiKey == null ? "" : xaiApiKey.trim();
        anthropicApiKey = anthropicApiKey == null ? "" : anthropicApiKey.trim();
    }
}
