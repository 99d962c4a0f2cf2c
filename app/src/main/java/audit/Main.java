package audit;

import checks.CheckRunner;
import crawler.BrowserSession;
import crawler.Pacer;
import crawler.PacingLevel;
import crawler.PageFetcher;
import crawler.PageHandle;
import crawler.PlaywrightBrowserSession;
import crawler.StaticBrowserSession;
import crawler.UrlCrawler;
import crawler.UrlUtil;
import llm.LlmClient;
import llm.LlmClients;
import llm.LlmUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import report.OutputManager;
import report.ReportGenerator;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.function.Supplier;

// CLI entry point that parses args, wires the pipeline and writes the report.
public class Main {

    private static final long SHUTDOWN_GRACE_MS = 30_000;

    // Set once the JVM is shutting down (Ctrl+C); System.exit must not be called after that.
    private static volatile boolean shutdownStarted = false;

    public static void main(String[] args) {
        AuditArgs parsed;
        try {
            parsed = AuditArgs.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println();
            System.err.println(AuditArgs.USAGE);
            System.exit(1);
            return;
        }
        if (parsed.help()) {
            System.out.println(AuditArgs.USAGE);
            return;
        }

        // Must happen before the first logger is created
        if (parsed.verbose()) {
            System.setProperty("saa.log.level", "DEBUG");
        }

        int code = run(parsed);
        if (!shutdownStarted) {
            System.exit(code);
        }
    }

    static int run(AuditArgs args) {
        AuditConfig config;
        try {
            config = ConfigLoader.load();
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Error: could not load configuration: " + e.getMessage());
            return 1;
        }
        return run(args, config, () -> openSession(config));
    }

    static int run(AuditArgs args, AuditConfig config, Supplier<BrowserSession> sessions) {
        Logger log = LoggerFactory.getLogger(Main.class);

        if (UrlUtil.normalize(args.url()) == null) {
            System.err.println("Error: not an absolute http(s) URL: " + args.url());
            return 1;
        }

        AuditMode mode = args.mode();
        CrawlLimits limits = CrawlLimits.resolve(args, config);
        int depth = limits.maxDepth();
        int maxPages = limits.maxPages();
        PacingLevel pacing = args.pacing() != null ? args.pacing() : config.pacing();

        String planContent;
        try {
            planContent = loadPlan(args, config, log);
        } catch (IOException e) {
            System.err.println("Error: could not read audit plan: " + e.getMessage());
            return 1;
        }
        Path output = resolveOutput(args, config, log);

        LlmClient llmClient = null;
        if (!args.noLlm()) {
            String modelId = args.llm() != null ? args.llm() : config.defaultLlm();
            try {
                llmClient = LlmClients.create(modelId, config.llmSettings());
                log.debug("Using LLM {}", llmClient.name());
            } catch (LlmUnavailableException e) {
                log.warn("LLM not available ({}); generating basic report without LLM analysis", e.getMessage());
            }
        }

        log.info("Auditing {} (mode {}, depth {}, max pages {}, pacing {})",
                args.url(), mode.label(), depth, maxPages, pacing.label());

        AuditResult result;
        UrlCrawler crawler;
        BrowserSession session = null;
        PageHandle page = null;
        try {
            session = sessions.get();
            page = session.newPage();
            crawler = new UrlCrawler(new PageFetcher(page, config.fetchTimeout()), new Pacer(pacing));
            AuditRunner runner = new AuditRunner(crawler, new CheckRunner(), new ReportGenerator());

            Thread hook = installShutdownHook(crawler, Thread.currentThread());
            try {
                result = runner.run(args.url(), mode, depth, maxPages, llmClient, planContent);
            } finally {
                removeShutdownHook(hook);
            }
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            // Browser launch failures surface here
            log.debug("Audit aborted", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        } finally {
            // A browser dying on close must not cost the finished report
            closeLogged(page, "page", log);
            closeLogged(session, "browser session", log);
        }

        if (result.outcome() == AuditOutcome.FAILED) {
            System.err.println("Failed to fetch any pages.");
            crawler.printFinalSummary(System.err);
            return 1;
        }

        String text = result.report().text();
        if (output != null) {
            OutputManager outputManager = new OutputManager();
            try {
                outputManager.writeReport(output, text);
                Path failures = outputManager.writeFailuresFile(output, result.crawl().failures());
                crawler.printFinalSummary(System.out);
                System.out.println("Report saved to: " + output);
                if (failures != null) System.out.println("Failures details: " + failures);
            } catch (IOException e) {
                System.err.println("Error: could not write report: " + e.getMessage());
                return 1;
            }
        } else {
            System.out.print(text);
            crawler.printFinalSummary(System.err);
        }

        if (result.outcome() == AuditOutcome.PARTIAL) {
            System.err.println(result.crawl().cancelled()
                    ? "Audit cancelled: report covers the pages fetched so far."
                    : "Narrative analysis unavailable: report contains deterministic findings only.");
        }
        return 0;
    }

    private static void closeLogged(AutoCloseable resource, String what, Logger log) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Could not close {}: {}", what, e.getMessage());
            log.debug("Close failure", e);
        }
    }

    private static BrowserSession openSession(AuditConfig config) {
        return switch (config.browser()) {
            case STATIC -> new StaticBrowserSession();
            case CHROMIUM -> PlaywrightBrowserSession.launch(config.chromiumPath(), config.headless());
        };
    }

    // Plan: --no-plan > --plan > configured default (when the file exists) > none.
    private static String loadPlan(AuditArgs args, AuditConfig config, Logger log) throws IOException {
        if (args.noPlan()) return null;

        Path plan = args.plan();
        if (plan == null && config.defaultPlan() != null) {
            Path configured = Paths.get(config.defaultPlan());
            if (Files.isRegularFile(configured)) {
                plan = configured;
            } else {
                log.warn("Configured plan not found: {}", configured);
            }
        }
        if (plan == null) return null;

        String content = PlanLoader.load(plan);
        log.debug("Loaded audit plan {} ({} chars)", plan, content.length());
        return content;
    }

    // Output: --output > <outputDir>/<host>_<timestamp>.md (when the dir exists) > stdout.
    private static Path resolveOutput(AuditArgs args, AuditConfig config, Logger log) {
        if (args.output() != null) return args.output();
        if (config.outputDir() == null) return null;

        Path dir = Paths.get(config.outputDir());
        if (!Files.isDirectory(dir)) {
            log.warn("Output dir not found: {}; printing report to stdout", dir);
            return null;
        }
        return OutputManager.autoReportPath(dir, args.url(), LocalDateTime.now());
    }

    // If user hits Ctrl+C, stop the crawl and give the pipeline time to write the partial report.
    private static Thread installShutdownHook(UrlCrawler crawler, Thread worker) {
        Thread hook = new Thread(() -> {
            shutdownStarted = true;
            crawler.cancel();
            try {
                worker.join(SHUTDOWN_GRACE_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "saa-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // Already shutting down; the hook is waiting for us to finish
            shutdownStarted = true;
        }
    }
}
