package audit;

import crawler.PacingLevel;
import llm.LlmSettings;

import java.time.Duration;

// Merged configuration. Null fields mean unset.
public record AuditConfig(
        String chromiumPath,
        boolean headless,
        BrowserKind browser,
        PacingLevel pacing,
        Integer maxPages,
        Integer defaultDepth,
        String defaultLlm,
        String xaiApiKey,
        String anthropicApiKey,
        String defaultPlan,
        String outputDir,
        Duration fetchTimeout,
        Duration llmTimeout
) {
    public static final String DEFAULT_LLM = "xai:grok-4";
    public static final Duration DEFAULT_FETCH_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_LLM_TIMEOUT = Duration.ofSeconds(120);

    public static AuditConfig defaults() {
        return new AuditConfig(null, true, BrowserKind.CHROMIUM, PacingLevel.MEDIUM, null, null,
                DEFAULT_LLM, "", "", null, null, DEFAULT_FETCH_TIMEOUT, DEFAULT_LLM_TIMEOUT);
    }

    public LlmSettings llmSettings() {
        return new LlmSettings(xaiApiKey, anthropicApiKey, llmTimeout);
    }
}
