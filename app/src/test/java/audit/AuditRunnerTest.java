package audit;

import checks.CheckRunner;
import checks.Finding;
import crawler.FakeSite;
import crawler.FetchStatus;
import crawler.Pacer;
import crawler.PacingLevel;
import crawler.UrlCrawler;
import llm.LlmClient;
import llm.LlmException;
import org.junit.jupiter.api.Test;
import report.NarrativeStatus;
import report.ReportGenerator;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AuditRunnerTest {

    private static final String A = "https://example.com";
    private static final String B = "https://example.com/b";
    private static final String C = "https://example.com/c";

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneOffset.UTC);

    private static AuditRunner runner(UrlCrawler crawler) {
        return new AuditRunner(crawler, new CheckRunner(), new ReportGenerator(CLOCK));
    }

    private static UrlCrawler crawler(FakeSite site) {
        return new UrlCrawler(site.fetcher(), new Pacer(PacingLevel.OFF));
    }

    private static FakeSite smallSite() {
        return new FakeSite()
                .page(A, FakeSite.html("Example home page", "/b", "/c"))
                .page(B, FakeSite.html("Example second page"))
                .status(C, 500);
    }

    @Test
    void noSuccessfulPageFailsWithoutReport() {
        FakeSite site = new FakeSite().fail(A, FetchStatus.FAILED, "net::ERR_NAME_NOT_RESOLVED");

        AuditResult result = runner(crawler(site)).run(A, AuditMode.OWN, 2, 10, null, null);

        assertEquals(AuditOutcome.FAILED, result.outcome());
        assertNull(result.report());
        assertTrue(result.findings().isEmpty());
        assertEquals(1, result.crawl().pages().size());
    }

    @Test
    void deterministicRunIsComplete() {
        AuditResult result = runner(crawler(smallSite())).run(A, AuditMode.OWN, 2, 10, null, null);

        assertEquals(AuditOutcome.COMPLETE, result.outcome());
        assertNotNull(result.report());
        assertEquals(NarrativeStatus.OMITTED, result.report().narrative());
        assertEquals(3, result.crawl().pages().size());

        String text = result.report().text();
        assertTrue(text.contains("- **Pages crawled:** 3 (2 successful, 1 failed)\n"));
        assertTrue(text.contains("[page-unreachable]"));
        assertTrue(text.contains("[broken-internal-link]"));
        assertTrue(text.contains("[thin-content]"));
        assertTrue(text.contains("- **Status:** complete\n"));
    }

    @Test
    void competitorModeRunsTheLightCheckSet() {
        AuditResult result = runner(crawler(smallSite())).run(A, AuditMode.COMPETITOR, 1, 10, null, null);

        assertFalse(result.findings().stream().anyMatch(f -> f.checkId().equals("thin-content")));
        assertFalse(result.findings().stream().anyMatch(f -> f.checkId().equals("broken-internal-link")));
        assertTrue(result.findings().stream().anyMatch(f -> f.checkId().equals("meta-description-missing")));
    }

    @Test
    void sameSiteGivesIdenticalFindings() {
        List<Finding> first = runner(crawler(smallSite())).run(A, AuditMode.OWN, 2, 10, null, null).findings();
        List<Finding> second = runner(crawler(smallSite())).run(A, AuditMode.OWN, 2, 10, null, null).findings();

        assertEquals(first, second);
    }

    @Test
    void narrativeFailureStillWritesReport() {
        LlmClient failing = new LlmClient() {
            @Override
            public String name() {
                return "xai:grok-4";
            }

            @Override
            public String synthesize(String startUrl, List<Finding> findings, String planContent) throws LlmException {
                throw new LlmException("xai:grok-4 returned HTTP 503");
            }
        };

        AuditResult result = runner(crawler(smallSite())).run(A, AuditMode.OWN, 2, 10, failing, null);

        assertEquals(AuditOutcome.PARTIAL, result.outcome());
        assertEquals(NarrativeStatus.UNAVAILABLE, result.report().narrative());
        assertTrue(result.report().text().contains("_Narrative analysis unavailable: xai:grok-4 returned HTTP 503_"));
        assertFalse(result.findings().isEmpty());
    }

    @Test
    void narrativeReceivesFindingsAndPlan() {
        AtomicReference<String> seenPlan = new AtomicReference<>();
        AtomicReference<Integer> seenFindings = new AtomicReference<>();
        LlmClient client = new LlmClient() {
            @Override
            public String name() {
                return "anthropic:test";
            }

            @Override
            public String synthesize(String startUrl, List<Finding> findings, String planContent) {
                seenPlan.set(planContent);
                seenFindings.set(findings.size());
                return "All good.";
            }
        };

        AuditResult result = runner(crawler(smallSite())).run(A, AuditMode.OWN, 2, 10, client, "Check the blog");

        assertEquals(AuditOutcome.COMPLETE, result.outcome());
        assertEquals("Check the blog", seenPlan.get());
        assertEquals(result.findings().size(), seenFindings.get());
        assertTrue(result.report().text().endsWith("## Analysis\n\nAll good.\n"));
    }

    @Test
    void cancelledCrawlGivesPartialReport() {
        AtomicReference<UrlCrawler> ref = new AtomicReference<>();
        FakeSite site = smallSite().onNavigate(url -> {
            if (url.equals(B)) ref.get().cancel();
        });
        UrlCrawler crawler = crawler(site);
        ref.set(crawler);

        AuditResult result = runner(crawler).run(A, AuditMode.OWN, 2, 10, null, null);

        assertEquals(AuditOutcome.PARTIAL, result.outcome());
        assertTrue(result.crawl().cancelled());
        assertEquals(2, result.crawl().pages().size());
        assertTrue(result.report().text().contains("incomplete (crawl cancelled, partial results)"));
    }

    @Test
    void cancelledCrawlDoesNotWaitForTheNarrative() {
        AtomicReference<UrlCrawler> ref = new AtomicReference<>();
        FakeSite site = smallSite().onNavigate(url -> {
            if (url.equals(B)) ref.get().cancel();
        });
        UrlCrawler crawler = crawler(site);
        ref.set(crawler);
        LlmClient client = new LlmClient() {
            @Override
            public String name() {
                return "xai:grok-4";
            }

            @Override
            public String synthesize(String startUrl, List<Finding> findings, String planContent) throws LlmException {
                throw new AssertionError("narrative requested after cancel");
            }
        };

        AuditResult result = runner(crawler).run(A, AuditMode.OWN, 2, 10, client, null);

        assertEquals(AuditOutcome.PARTIAL, result.outcome());
        assertEquals(NarrativeStatus.UNAVAILABLE, result.report().narrative());
        assertTrue(result.report().text().contains("_Narrative analysis unavailable: crawl cancelled_"));
    }
}
