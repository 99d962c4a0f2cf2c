package checks;

import crawler.PageContent;
import crawler.PageRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuiltInChecksTest {

    private final CheckRunner runner = new CheckRunner();

    private List<Finding> run(CheckSet set, PageRecord... pages) {
        return runner.runChecks(List.of(pages), set);
    }

    private static List<String> ids(List<Finding> findings) {
        return findings.stream().map(Finding::checkId).toList();
    }

    @Test
    void healthyPageHasNoFindings() {
        assertTrue(run(BuiltInChecks.OWN, Pages.healthy("https://example.com").build()).isEmpty());
    }

    @Test
    void missingTitleIsCriticalAndSkipsLengthCheck() {
        List<Finding> findings = run(BuiltInChecks.OWN, Pages.healthy("https://example.com").title(null).build());

        assertEquals(List.of("title-missing"), ids(findings));
        assertEquals(Severity.CRITICAL, findings.get(0).severity());
    }

    @Test
    void titleLengthBounds() {
        List<Finding> shortTitle = run(BuiltInChecks.OWN, Pages.healthy("https://example.com").title("Home").build());
        List<Finding> longTitle = run(BuiltInChecks.OWN, Pages.healthy("https://example.com").title("x".repeat(61)).build());
        List<Finding> edge = run(BuiltInChecks.OWN, Pages.healthy("https://example.com").title("x".repeat(60)).build());

        assertEquals(List.of("title-length"), ids(shortTitle));
        assertEquals("Home", shortTitle.get(0).evidence());
        assertEquals(List.of("title-length"), ids(longTitle));
        assertTrue(edge.isEmpty());
    }

    @Test
    void descriptionChecks() {
        List<Finding> missing = run(BuiltInChecks.OWN,
                Pages.healthy("https://example.com").meta(PageContent.META_DESCRIPTION, null).build());
        List<Finding> tooShort = run(BuiltInChecks.OWN,
                Pages.healthy("https://example.com").meta(PageContent.META_DESCRIPTION, "Too short").build());

        assertEquals(List.of("meta-description-missing"), ids(missing));
        assertEquals(List.of("meta-description-length"), ids(tooShort));
        assertEquals(Severity.INFO, tooShort.get(0).severity());
    }

    @Test
    void headingChecks() {
        assertEquals(List.of("h1-missing"), ids(run(BuiltInChecks.OWN, Pages.healthy("https://example.com").h1().build())));

        List<Finding> multiple = run(BuiltInChecks.OWN, Pages.healthy("https://example.com").h1("One", "Two").build());
        assertEquals(List.of("h1-multiple"), ids(multiple));
        assertEquals("One, Two", multiple.get(0).evidence());
    }

    @Test
    void noindexAndMissingHeadFields() {
        PageRecord.Success page = Pages.healthy("https://example.com")
                .meta(PageContent.META_VIEWPORT, null)
                .meta(PageContent.META_LANG, null)
                .meta(PageContent.META_CANONICAL, null)
                .meta(PageContent.META_ROBOTS, "NOINDEX,nofollow")
                .build();

        assertEquals(List.of("viewport-missing", "lang-missing", "canonical-missing", "noindex"),
                ids(run(BuiltInChecks.OWN, page)));
    }

    @Test
    void imagesAndMixedContentEvidenceIsCapped() {
        PageRecord.Success page = Pages.healthy("https://example.com")
                .imagesWithoutAlt("/1.png", "/2.png", "/3.png", "/4.png", "/5.png", "/6.png", "/7.png")
                .insecure("http://cdn/x.js")
                .build();

        List<Finding> findings = run(BuiltInChecks.OWN, page);

        assertEquals(List.of("images-missing-alt", "mixed-content"), ids(findings));
        assertEquals("7 image(s) without alt text", findings.get(0).message());
        assertEquals("/1.png, /2.png, /3.png, /4.png, /5.png (+2 more)", findings.get(0).evidence());
        assertEquals(Severity.CRITICAL, findings.get(1).severity());
    }

    @Test
    void thinAndSlowPages() {
        PageRecord.Success page = Pages.healthy("https://example.com").words(40).elapsed(4500).build();

        assertEquals(List.of("thin-content", "slow-page"), ids(run(BuiltInChecks.OWN, page)));
    }

    @Test
    void duplicateTitlesAndDescriptionsAcrossPages() {
        PageRecord.Success a = Pages.healthy("https://example.com/a").title("Same title for both pages").build();
        PageRecord.Success b = Pages.healthy("https://example.com/b").title("same  TITLE for both pages").build();

        List<Finding> findings = run(BuiltInChecks.OWN, a, b);

        assertEquals(List.of("duplicate-title", "duplicate-meta-description",
                "duplicate-title", "duplicate-meta-description"), ids(findings));
        assertEquals("https://example.com/b", findings.get(0).evidence());
        assertEquals("https://example.com/a", findings.get(2).evidence());
    }

    @Test
    void brokenInternalLinkPointsAtFailedPage() {
        PageRecord.Success home = Pages.healthy("https://example.com").links("https://example.com/gone").build();
        PageRecord.Failure gone = Pages.failure("https://example.com/gone", 404, "HTTP 404");

        List<Finding> findings = run(BuiltInChecks.OWN, home, gone);

        assertEquals(List.of("broken-internal-link", BuiltInChecks.PAGE_UNREACHABLE), ids(findings));
        assertEquals("https://example.com/gone", findings.get(0).evidence());
    }

    @Test
    void competitorSetIsALightSubsetOfOwn() {
        for (String id : BuiltInChecks.COMPETITOR.ids()) {
            assertTrue(BuiltInChecks.OWN.contains(id), id);
        }
        assertFalse(BuiltInChecks.COMPETITOR.contains("duplicate-title"));
        assertFalse(BuiltInChecks.COMPETITOR.contains("broken-internal-link"));
        assertTrue(BuiltInChecks.COMPETITOR.ids().size() < BuiltInChecks.OWN.ids().size());
    }

    @Test
    void competitorSetIgnoresDeepIssues() {
        PageRecord.Success page = Pages.healthy("https://example.com").words(10).insecure("http://cdn/x.js").build();

        assertTrue(run(BuiltInChecks.COMPETITOR, page).isEmpty());
    }
}
