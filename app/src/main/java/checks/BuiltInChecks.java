package checks;

import crawler.PageContent;
import crawler.PageRecord;

import java.util.List;
import java.util.Locale;

// Shipped SEO checks. Competitor mode keeps only the cheap single-page ones.
public final class BuiltInChecks {

    public static final String PAGE_UNREACHABLE = "page-unreachable";

    static final int TITLE_MIN = 10;
    static final int TITLE_MAX = 60;
    static final int DESCRIPTION_MIN = 50;
    static final int DESCRIPTION_MAX = 160;
    static final int THIN_CONTENT_WORDS = 250;
    static final long SLOW_PAGE_MS = 3000;
    static final int MAX_EVIDENCE_ITEMS = 5;

    public static final CheckSet OWN = CheckSet.builder("own")
            .add("title-missing", BuiltInChecks::titleMissing)
            .add("title-length", BuiltInChecks::titleLength)
            .add("meta-description-missing", BuiltInChecks::descriptionMissing)
            .add("meta-description-length", BuiltInChecks::descriptionLength)
            .add("h1-missing", BuiltInChecks::h1Missing)
            .add("h1-multiple", BuiltInChecks::h1Multiple)
            .add("viewport-missing", BuiltInChecks::viewportMissing)
            .add("lang-missing", BuiltInChecks::langMissing)
            .add("canonical-missing", BuiltInChecks::canonicalMissing)
            .add("noindex", BuiltInChecks::noindex)
            .add("images-missing-alt", BuiltInChecks::imagesMissingAlt)
            .add("mixed-content", BuiltInChecks::mixedContent)
            .add("thin-content", BuiltInChecks::thinContent)
            .add("slow-page", BuiltInChecks::slowPage)
            .add("duplicate-title", BuiltInChecks::duplicateTitle)
            .add("duplicate-meta-description", BuiltInChecks::duplicateDescription)
            .add("broken-internal-link", BuiltInChecks::brokenInternalLink)
            .build();

    public static final CheckSet COMPETITOR = CheckSet.builder("competitor")
            .addFrom(OWN,
                    "title-missing",
                    "title-length",
                    "meta-description-missing",
                    "meta-description-length",
                    "h1-missing",
                    "h1-multiple",
                    "viewport-missing")
            .build();

    private BuiltInChecks() {
    }

    static void titleMissing(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        if (isBlank(page.title())) {
            out.add(Severity.CRITICAL, "Page has no <title>");
        }
    }

    static void titleLength(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        String title = page.title();
        if (isBlank(title)) return;
        int len = title.length();
        if (len < TITLE_MIN) {
            out.add(Severity.WARNING, "Title is too short (" + len + " chars, aim for " + TITLE_MIN + "-" + TITLE_MAX + ")", title);
        } else if (len > TITLE_MAX) {
            out.add(Severity.WARNING, "Title is too long (" + len + " chars, aim for " + TITLE_MIN + "-" + TITLE_MAX + ")", title);
        }
    }

    static void descriptionMissing(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        if (isBlank(page.content().meta(PageContent.META_DESCRIPTION))) {
            out.add(Severity.WARNING, "Missing meta description");
        }
    }

    static void descriptionLength(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        String description = page.content().meta(PageContent.META_DESCRIPTION);
        if (isBlank(description)) return;
        int len = description.length();
        if (len < DESCRIPTION_MIN || len > DESCRIPTION_MAX) {
            out.add(Severity.INFO, "Meta description is " + len + " chars (aim for "
                    + DESCRIPTION_MIN + "-" + DESCRIPTION_MAX + ")", description);
        }
    }

    static void h1Missing(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        if (page.content().h1().isEmpty()) {
            out.add(Severity.WARNING, "Page has no <h1> heading");
        }
    }

    static void h1Multiple(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        List<String> h1 = page.content().h1();
        if (h1.size() > 1) {
            out.add(Severity.INFO, "Page has " + h1.size() + " <h1> headings", joinLimited(h1));
        }
    }

    static void viewportMissing(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        if (isBlank(page.content().meta(PageContent.META_VIEWPORT))) {
            out.add(Severity.WARNING, "Missing viewport meta tag (page may not be mobile friendly)");
        }
    }

    static void langMissing(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        if (isBlank(page.content().meta(PageContent.META_LANG))) {
            out.add(Severity.INFO, "Missing lang attribute on <html>");
        }
    }

    static void canonicalMissing(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        if (isBlank(page.content().meta(PageContent.META_CANONICAL))) {
            out.add(Severity.INFO, "No canonical link declared");
        }
    }

    static void noindex(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        String robots = page.content().meta(PageContent.META_ROBOTS);
        if (robots != null && robots.toLowerCase(Locale.ROOT).contains("noindex")) {
            out.add(Severity.WARNING, "Page asks search engines not to index it", "robots: " + robots);
        }
    }

    static void imagesMissingAlt(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        List<String> images = page.content().imagesWithoutAlt();
        if (!images.isEmpty()) {
            out.add(Severity.WARNING, images.size() + " image(s) without alt text", joinLimited(images));
        }
    }

    static void mixedContent(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        List<String> insecure = page.content().insecureResources();
        if (!insecure.isEmpty()) {
            out.add(Severity.CRITICAL, "HTTPS page loads " + insecure.size() + " resource(s) over plain HTTP",
                    joinLimited(insecure));
        }
    }

    static void thinContent(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        int words = page.content().wordCount();
        if (words < THIN_CONTENT_WORDS) {
            out.add(Severity.INFO, "Thin content (" + words + " words)");
        }
    }

    static void slowPage(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        if (page.elapsedMs() > SLOW_PAGE_MS) {
            out.add(Severity.WARNING, "Slow page load (" + page.elapsedMs() + " ms)");
        }
    }

    static void duplicateTitle(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        List<String> others = site.otherPagesWithTitle(page.title(), page.url());
        if (!others.isEmpty()) {
            out.add(Severity.WARNING, "Title is shared with " + others.size() + " other page(s)", joinLimited(others));
        }
    }

    static void duplicateDescription(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        String description = page.content().meta(PageContent.META_DESCRIPTION);
        List<String> others = site.otherPagesWithDescription(description, page.url());
        if (!others.isEmpty()) {
            out.add(Severity.WARNING, "Meta description is shared with " + others.size() + " other page(s)",
                    joinLimited(others));
        }
    }

    static void brokenInternalLink(PageRecord.Success page, SiteIndex site, FindingCollector out) {
        for (String link : page.links()) {
            if (site.isFailed(link)) {
                out.add(Severity.CRITICAL, "Links to a page that could not be fetched", link);
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String joinLimited(List<String> items) {
        List<String> shown = items.size() > MAX_EVIDENCE_ITEMS ? items.subList(0, MAX_EVIDENCE_ITEMS) : items;
        String joined = String.join(", ", shown);
        if (items.size() > MAX_EVIDENCE_ITEMS) {
            joined += " (+" + (items.size() - MAX_EVIDENCE_ITEMS) + " more)";
        }
        return joined;
    }
}
