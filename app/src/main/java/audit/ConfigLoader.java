package audit;

import crawler.PacingLevel;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

// Later sources win: defaults, ~/.saa/.env, ~/.saa/.keys, ./.env, ./.keys, then the environment.
public final class ConfigLoader {

    static final String CHROMIUM_PATH = "SAA_CHROMIUM_PATH";
    static final String HEADLESS = "SAA_HEADLESS";
    static final String BROWSER = "SAA_BROWSER";
    static final String PACING = "SAA_PACING";
    static final String MAX_PAGES = "SAA_MAX_PAGES";
    static final String DEFAULT_DEPTH = "SAA_DEFAULT_DEPTH";
    static final String DEFAULT_LLM = "SAA_DEFAULT_LLM";
    static final String XAI_API_KEY = "XAI_API_KEY";
    static final String ANTHROPIC_API_KEY = "ANTHROPIC_API_KEY";
    static final String DEFAULT_PLAN = "SAA_DEFAULT_PLAN";
    static final String OUTPUT_DIR = "SAA_OUTPUT_DIR";
    static final String FETCH_TIMEOUT = "SAA_FETCH_TIMEOUT_SECONDS";
    static final String LLM_TIMEOUT = "SAA_LLM_TIMEOUT_SECONDS";

    private ConfigLoader() {
    }

    public static AuditConfig load() throws IOException {
        return load(System.getenv(), Paths.get(System.getProperty("user.home")), Paths.get(""));
    }

    public static AuditConfig load(Map<String, String> env, Path home, Path workingDir) throws IOException {
        Map<String, String> values = new HashMap<>();
        Path global = home.resolve(".saa");
        readDotEnv(global.resolve(".env"), values);
        readDotEnv(global.resolve(".keys"), values);
        readDotEnv(workingDir.resolve(".env"), values);
        readDotEnv(workingDir.resolve(".keys"), values);
        values.putAll(env);
        return fromValues(values);
    }

    static AuditConfig fromValues(Map<String, String> values) {
        AuditConfig d = AuditConfig.defaults();
        return new AuditConfig(
                text(values, CHROMIUM_PATH, d.chromiumPath()),
                bool(values, HEADLESS, d.headless()),
                values.containsKey(BROWSER) && !values.get(BROWSER).isBlank()
                        ? BrowserKind.fromLabel(values.get(BROWSER)) : d.browser(),
                values.containsKey(PACING) && !values.get(PACING).isBlank()
                        ? PacingLevel.fromLabel(values.get(PACING)) : d.pacing(),
                nonNegative(values, MAX_PAGES, d.maxPages()),
                nonNegative(values, DEFAULT_DEPTH, d.defaultDepth()),
                text(values, DEFAULT_LLM, d.defaultLlm()),
                text(values, XAI_API_KEY, d.xaiApiKey()),
                text(values, ANTHROPIC_API_KEY, d.anthropicApiKey()),
                text(values, DEFAULT_PLAN, d.defaultPlan()),
                text(values, OUTPUT_DIR, d.outputDir()),
                seconds(values, FETCH_TIMEOUT, d.fetchTimeout()),
                seconds(values, LLM_TIMEOUT, d.llmTimeout())
        );
    }

    // Merge KEY=VALUE lines of a dotenv file into values; a missing file is skipped.
    static void readDotEnv(Path file, Map<String, String> values) throws IOException {
        if (!Files.isRegularFile(file)) return;
        values.putAll(parseDotEnv(Files.readAllLines(file, StandardCharsets.UTF_8)));
    }

    static Map<String, String> parseDotEnv(List<String> lines) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) line = line.substring("export ".length()).trim();

            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            String key = line.substring(0, eq).trim();
            String value = line.substring(eq + 1).trim();

            if (value.length() >= 2
                    && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
                value = value.substring(1, value.length() - 1);
            } else {
                // Unquoted values may carry a trailing comment
                int hash = value.indexOf(" #");
                if (hash >= 0) value = value.substring(0, hash).trim();
            }
            out.put(key, value);
        }
        return out;
    }

    private static String text(Map<String, String> values, String key, String fallback) {
        String v = values.get(key);
        return v == null || v.isBlank() ? fallback : v.trim();
    }

    private static boolean bool(Map<String, String> values, String key, boolean fallback) {
        String v = values.get(key);
        if (v == null || v.isBlank()) return fallback;
        String s = v.trim().toLowerCase(Locale.ROOT);
        if (s.equals("true") || s.equals("1") || s.equals("yes")) return true;
        if (s.equals("false") || s.equals("0") || s.equals("no")) return false;
        throw new IllegalArgumentException("Invalid boolean for " + key + ": " + v);
    }

    private static Integer nonNegative(Map<String, String> values, String key, Integer fallback) {
        String v = values.get(key);
        if (v == null || v.isBlank()) return fallback;
        try {
            int n = Integer.parseInt(v.trim());
            if (n < 0) throw new IllegalArgumentException(key + " must be >= 0: " + v);
            return n;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + v);
        }
    }

    private static Duration seconds(Map<String, String> values, String key, Duration fallback) {
        Integer n = nonNegative(values, key, null);
        if (n == null) return fallback;
        if (n == 0) throw new IllegalArgumentException(key + " must be > 0");
        return Duration.ofSeconds(n);
    }
}
