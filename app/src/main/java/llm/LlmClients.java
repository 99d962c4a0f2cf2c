package llm;

import java.util.Locale;
import java.util.Map;

// provider:model, e.g. xai:grok-4 or anthropic:sonnet
public final class LlmClients {

    private static final Map<String, String> XAI_ALIASES = Map.of(
            "grok", "grok-4"
    );

    private static final Map<String, String> ANTHROPIC_ALIASES = Map.of(
            "sonnet", "claude-sonnet-4-20250514",
            "opus", "claude-opus-4-20250514",
            "haiku", "claude-3-5-haiku-20241022"
    );

    private LlmClients() {
    }

    public static LlmClient create(String modelId, LlmSettings settings) throws LlmUnavailableException {
        if (modelId == null || modelId.isBlank()) {
            throw new LlmUnavailableException("No LLM configured");
        }
        int colon = modelId.indexOf(':');
        if (colon <= 0 || colon == modelId.length() - 1) {
            throw new LlmUnavailableException("Expected provider:model, got '" + modelId + "'");
        }
        String provider = modelId.substring(0, colon).trim().toLowerCase(Locale.ROOT);
        String model = modelId.substring(colon + 1).trim();

        switch (provider) {
            case "xai":
                requireKey(settings.xaiApiKey(), "XAI_API_KEY");
                return new XaiClient(settings.xaiApiKey(), XAI_ALIASES.getOrDefault(model, model), settings.timeout());
            case "anthropic":
                requireKey(settings.anthropicApiKey(), "ANTHROPIC_API_KEY");
                return new AnthropicClient(settings.anthropicApiKey(),
                        ANTHROPIC_ALIASES.getOrDefault(model, model), settings.timeout());
            default:
                throw new LlmUnavailableException("Unknown LLM provider '" + provider + "' (use xai or anthropic)");
        }
    }

    private static void requireKey(String key, String variable) throws LlmUnavailableException {
        if (key == null || key.isBlank()) {
            throw new LlmUnavailableException(variable + " is not set");
        }
    }
}
