package audit;

import crawler.PacingLevel;

import java.nio.file.Path;
import java.nio.file.Paths;

// Parsed command line. Null fields were not given.
public record AuditArgs(
        String url,
        AuditMode mode,
        Integer depth,
        Integer maxPages,
        PacingLevel pacing,
        String llm,
        boolean noLlm,
        Path plan,
        boolean noPlan,
        Path output,
        boolean verbose,
        boolean help
) {
    public static final String USAGE = """
            Usage: saa <url> [options]

              -m, --mode own|competitor        audit mode (default: own)
              -d, --depth N                    max crawl depth (default: 10 own, 1 competitor)
                  --max-pages N                max pages to fetch (default: 200 own, 20 competitor)
                  --pacing off|low|medium|high delay between fetches (default: medium)
              -l, --llm provider:model         e.g. xai:grok-4, anthropic:sonnet
                  --no-llm                     skip LLM analysis (basic report only)
              -p, --plan PATH                  Markdown audit plan for the LLM pass
                  --no-plan                    ignore the configured audit plan
              -o, --output PATH                write the report to PATH instead of stdout
              -v, --verbose                    per-page progress on stderr
              -h, --help                       show this help

            Example: saa https://example.com --mode competitor --llm anthropic:sonnet -o report.md
            """;

    // Strict parsing: any malformed input is an IllegalArgumentException with a readable message.
    public static AuditArgs parse(String[] args) {
        String url = null;
        AuditMode mode = AuditMode.OWN;
        Integer depth = null;
        Integer maxPages = null;
        PacingLevel pacing = null;
        String llm = null;
        boolean noLlm = false;
        Path plan = null;
        boolean noPlan = false;
        Path output = null;
        boolean verbose = false;
        boolean help = false;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-m", "--mode" -> mode = AuditMode.fromLabel(value(args, ++i, arg));
                case "-d", "--depth" -> depth = parseNonNegative(value(args, ++i, arg), arg);
                case "--max-pages" -> maxPages = parseNonNegative(value(args, ++i, arg), arg);
                case "--pacing" -> pacing = PacingLevel.fromLabel(value(args, ++i, arg));
                case "-l", "--llm" -> llm = value(args, ++i, arg);
                case "--no-llm" -> noLlm = true;
                case "-p", "--plan" -> plan = Paths.get(value(args, ++i, arg));
                case "--no-plan" -> noPlan = true;
                case "-o", "--output" -> output = Paths.get(value(args, ++i, arg));
                case "-v", "--verbose" -> verbose = true;
                case "-h", "--help" -> help = true;
                default -> {
                    if (arg.startsWith("-")) throw new IllegalArgumentException("Unknown option: " + arg);
                    if (url != null) throw new IllegalArgumentException("Only one URL may be given (got " + url + " and " + arg + ")");
                    url = arg;
                }
            }
        }

        if (url == null && !help) throw new IllegalArgumentException("Missing URL");
        return new AuditArgs(url, mode, depth, maxPages, pacing, llm, noLlm, plan, noPlan, output, verbose, help);
    }

    private static String value(String[] args, int i, String option) {
        if (i >= args.length || args[i].startsWith("--")) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[i];
    }

    // Strict integer parsing with a clean error message.
    private static int parseNonNegative(String s, String option) {
        int n;
        try {
            n = Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + option + ": " + s);
        }
        if (n < 0) throw new IllegalArgumentException(option + " must be >= 0");
        return n;
    }
}
