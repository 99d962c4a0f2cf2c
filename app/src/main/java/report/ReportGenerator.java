package report;

import audit.AuditMode;
import checks.Finding;
import checks.Severity;
import crawler.PageRecord;
import llm.LlmClient;
import llm.LlmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

// Markdown report. Everything but the narrative is a pure function of the inputs and the clock.
public class ReportGenerator {

    private static final Logger log = LoggerFactory.getLogger(ReportGenerator.class);

    private static final List<Severity> SEVERITY_ORDER = List.of(Severity.CRITICAL, Severity.WARNING, Severity.INFO);

    private final Clock clock;

    public ReportGenerator() {
        this(Clock.systemUTC());
    }

    public ReportGenerator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Report generate(String startUrl,
                           List<? extends PageRecord> pages,
                           List<Finding> findings,
                           AuditMode mode,
                           boolean incomplete,
                           LlmClient llmClient,
                           String planContent) {
        StringBuilder md = new StringBuilder();
        appendHeader(md, startUrl, pages, mode, incomplete);
        appendFindings(md, findings);
        appendPages(md, pages);

        NarrativeStatus narrative = NarrativeStatus.OMITTED;
        if (llmClient != null && incomplete) {
            // A cancelled run must finish within the shutdown grace period, so the LLM is not called
            log.info("Skipping narrative analysis: crawl cancelled");
            md.append("\n## Analysis\n\n");
            md.append("_Narrative analysis unavailable: crawl cancelled_\n");
            narrative = NarrativeStatus.UNAVAILABLE;
        } else if (llmClient != null) {
            md.append("\n## Analysis\n\n");
            try {
                String text = llmClient.synthesize(startUrl, findings, planContent);
                md.append(text.strip()).append('\n');
                narrative = NarrativeStatus.INCLUDED;
            } catch (LlmException | RuntimeException e) {
                log.warn("Narrative analysis unavailable: {}", e.getMessage());
                md.append("_Narrative analysis unavailable: ").append(oneLine(e.getMessage())).append("_\n");
                narrative = NarrativeStatus.UNAVAILABLE;
            }
        }
        return new Report(md.toString(), narrative);
    }

    private void appendHeader(StringBuilder md, String startUrl, List<? extends PageRecord> pages,
                              AuditMode mode, boolean incomplete) {
        long ok = pages.stream().filter(PageRecord::isSuccess).count();
        md.append("# Site Audit Report\n\n");
        md.append("- **URL:** ").append(startUrl).append('\n');
        md.append("- **Mode:** ").append(mode.label()).append('\n');
        md.append("- **Generated:** ")
                .append(DateTimeFormatter.ISO_INSTANT.format(clock.instant().truncatedTo(ChronoUnit.SECONDS)))
                .append('\n');
        md.append("- **Pages crawled:** ").append(pages.size())
                .append(" (").append(ok).append(" successful, ").append(pages.size() - ok).append(" failed)\n");
        md.append("- **Status:** ")
                .append(incomplete ? "incomplete (crawl cancelled, partial results)" : "complete")
                .append('\n');
    }

    private void appendFindings(StringBuilder md, List<Finding> findings) {
        Map<Severity, List<Finding>> bySeverity = new EnumMap<>(Severity.class);
        for (Finding f : findings) {
            bySeverity.computeIfAbsent(f.severity(), s -> new ArrayList<>()).add(f);
        }

        md.append("\n## Findings\n\n");
        if (findings.isEmpty()) {
            md.append("No findings.\n");
            return;
        }
        md.append("Total: ").append(findings.size())
                .append(" (critical ").append(count(bySeverity, Severity.CRITICAL))
                .append(", warning ").append(count(bySeverity, Severity.WARNING))
                .append(", info ").append(count(bySeverity, Severity.INFO))
                .append(")\n");

        for (Severity severity : SEVERITY_ORDER) {
            List<Finding> group = bySeverity.get(severity);
            if (group == null) continue;

            // Stable sort keeps input order within a URL
            List<Finding> sorted = new ArrayList<>(group);
            sorted.sort(Comparator.comparing(Finding::url));

            md.append("\n### ").append(capitalize(severity.label())).append("\n");
            String currentUrl = null;
            for (Finding f : sorted) {
                if (!f.url().equals(currentUrl)) {
                    currentUrl = f.url();
                    md.append("\n#### ").append(currentUrl).append("\n\n");
                }
                md.append("- [").append(f.checkId()).append("] ").append(oneLine(f.message())).append('\n');
                if (f.evidence() != null && !f.evidence().isBlank()) {
                    md.append("  - Evidence: ").append(oneLine(f.evidence())).append('\n');
                }
            }
        }
    }

    private void appendPages(StringBuilder md, List<? extends PageRecord> pages) {
        md.append("\n## Pages\n\n");
        if (pages.isEmpty()) {
            md.append("No pages were fetched.\n");
            return;
        }
        md.append("| URL | Depth | Status | Time (ms) | Error |\n");
        md.append("|---|---|---|---|---|\n");
        for (PageRecord page : pages) {
            String error = page instanceof PageRecord.Failure f ? cell(f.error()) : "";
            md.append("| ").append(cell(page.url()))
                    .append(" | ").append(page.depth())
                    .append(" | ").append(page.statusCode() == null ? "-" : page.statusCode())
                    .append(" | ").append(page.elapsedMs())
                    .append(" | ").append(error)
                    .append(" |\n");
        }
    }

    private static int count(Map<Severity, List<Finding>> bySeverity, Severity severity) {
        List<Finding> group = bySeverity.get(severity);
        return group == null ? 0 : group.size();
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    private static String oneLine(String s) {
        if (s == null || s.isBlank()) return "unknown error";
        return s.replaceAll("\\s*[\\r\\n]+\\s*", " ").trim();
    }

    private static String cell(String s) {
        return oneLine(s).replace("|", "\\|");
    }
}
