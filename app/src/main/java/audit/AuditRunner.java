package audit;

import checks.CheckRunner;
import checks.Finding;
import crawler.CrawlResult;
import crawler.UrlCrawler;
import llm.LlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import report.NarrativeStatus;
import report.Report;
import report.ReportGenerator;

import java.util.List;
import java.util.Objects;

// crawl -> checks -> report. Only a crawl without a single successful page stops here.
public class AuditRunner {

    private static final Logger log = LoggerFactory.getLogger(AuditRunner.class);

    private final UrlCrawler crawler;
    private final CheckRunner checkRunner;
    private final ReportGenerator reportGenerator;

    public AuditRunner(UrlCrawler crawler, CheckRunner checkRunner, ReportGenerator reportGenerator) {
        this.crawler = Objects.requireNonNull(crawler, "crawler");
        this.checkRunner = Objects.requireNonNull(checkRunner, "checkRunner");
        this.reportGenerator = Objects.requireNonNull(reportGenerator, "reportGenerator");
    }

    public AuditResult run(String startUrl, AuditMode mode, int maxDepth, int maxPages,
                           LlmClient llmClient, String planContent) {
        CrawlResult crawl = crawler.crawl(startUrl, maxDepth, maxPages);

        if (!crawl.hasSuccess()) {
            log.error("No page of {} could be fetched ({} attempt(s)); skipping checks and report",
                    crawl.startUrl(), crawl.pages().size());
            return new AuditResult(AuditOutcome.FAILED, crawl, List.of(), null);
        }

        List<Finding> findings = checkRunner.runChecks(crawl.pages(), mode.checkSet());
        log.info("{} finding(s) from {} page(s)", findings.size(), crawl.pages().size());

        Report report = reportGenerator.generate(crawl.startUrl(), crawl.pages(), findings, mode,
                crawl.cancelled(), llmClient, planContent);

        boolean partial = crawl.cancelled() || report.narrative() == NarrativeStatus.UNAVAILABLE;
        return new AuditResult(partial ? AuditOutcome.PARTIAL : AuditOutcome.COMPLETE, crawl, findings, report);
    }
}
