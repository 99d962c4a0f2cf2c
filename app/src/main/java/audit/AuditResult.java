package audit;

import checks.Finding;
import crawler.CrawlResult;
import report.Report;

import java.util.List;

// report is null when the outcome is FAILED
public record AuditResult(AuditOutcome outcome, CrawlResult crawl, List<Finding> findings, Report report) {

    public AuditResult {
        findings = List.copyOf(findings);
    }
}
