package checks;

import crawler.PageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

// Findings come out in page order, then check registration order.
public class CheckRunner {

    private static final Logger log = LoggerFactory.getLogger(CheckRunner.class);

    public List<Finding> runChecks(List<? extends PageRecord> pages, CheckSet checkSet) {
        SiteIndex site = SiteIndex.of(pages);
        List<Finding> findings = new ArrayList<>();

        for (PageRecord page : pages) {
            if (page instanceof PageRecord.Failure failure) {
                findings.add(unreachable(failure));
                continue;
            }
            PageRecord.Success success = (PageRecord.Success) page;
            for (Map.Entry<String, Check> entry : checkSet.checks().entrySet()) {
                FindingCollector out = new FindingCollector(entry.getKey(), success.url());
                try {
                    entry.getValue().evaluate(success, site, out);
                } catch (RuntimeException e) {
                    // One bad page must not hide the rest of the site
                    log.debug("Check {} skipped {}: {}", entry.getKey(), success.url(), e.toString());
                    continue;
                }
                findings.addAll(out.findings());
            }
        }
        log.debug("{} check(s) from set '{}' produced {} finding(s) over {} page(s)",
                checkSet.checks().size(), checkSet.name(), findings.size(), pages.size());
        return findings;
    }

    private static Finding unreachable(PageRecord.Failure failure) {
        String evidence = failure.statusCode() == null
                ? failure.kind().name()
                : failure.kind().name() + " (status " + failure.statusCode() + ")";
        return new Finding(BuiltInChecks.PAGE_UNREACHABLE, failure.url(), Severity.CRITICAL,
                "Page could not be fetched: " + failure.error(), evidence);
    }
}
