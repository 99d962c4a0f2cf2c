package crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

// Extracts links and head metadata from rendered HTML.
public class PageParser {

    // Elements whose src/href is loaded as a sub-resource of the page.
    private static final String SUB_RESOURCES =
            "img[src], script[src], iframe[src], audio[src], video[src], source[src], embed[src], link[rel=stylesheet][href]";

    // Result of parsing one document.
    public record ParsedPage(List<String> links, PageContent content) {
        public ParsedPage {
            links = List.copyOf(links);
        }
    }

    // documentUrl is the URL the HTML was served from; a <base href> in the document overrides it.
    public ParsedPage parse(String html, String documentUrl) {
        Document doc = Jsoup.parse(html, documentUrl);
        return new ParsedPage(extractLinks(doc), extractContent(doc, documentUrl));
    }

    // Absolute, normalized, de-duplicated http(s) links in document order.
    private List<String> extractLinks(Document doc) {
        // jsoup moves the base URI to <base href> while parsing
        String base = doc.baseUri();
        Set<String> links = new LinkedHashSet<>();
        for (Element a : doc.select("a[href]")) {
            String raw = a.attr("href");
            String href = UrlUtil.cleanHref(raw);     // raw href can be malformed
            if (href == null) continue;

            String resolved = href.equals(raw) ? a.absUrl("href") : "";
            if (resolved.isEmpty()) resolved = UrlUtil.resolveAgainst(base, href);
            if (resolved == null || !UrlUtil.isHttpLike(resolved)) continue;

            String normalized = UrlUtil.normalize(resolved);
            if (normalized != null) links.add(normalized);
        }
        return new ArrayList<>(links);
    }

    private PageContent extractContent(Document doc, String pageUrl) {
        Element titleEl = doc.selectFirst("title");
        String title = titleEl == null ? null : titleEl.text().trim();

        Map<String, String> meta = new LinkedHashMap<>();
        putMeta(meta, PageContent.META_DESCRIPTION, doc.selectFirst("meta[name=description]"), "content");
        putMeta(meta, PageContent.META_ROBOTS, doc.selectFirst("meta[name=robots]"), "content");
        putMeta(meta, PageContent.META_VIEWPORT, doc.selectFirst("meta[name=viewport]"), "content");
        putMeta(meta, PageContent.META_CANONICAL, doc.selectFirst("link[rel=canonical]"), "href");
        putMeta(meta, PageContent.META_OG_TITLE, doc.selectFirst("meta[property=og:title]"), "content");
        putMeta(meta, PageContent.META_OG_DESCRIPTION, doc.selectFirst("meta[property=og:description]"), "content");
        putMeta(meta, PageContent.META_LANG, doc.selectFirst("html[lang]"), "lang");
        putMeta(meta, PageContent.META_CHARSET, doc.selectFirst("meta[charset]"), "charset");

        List<String> h1 = new ArrayList<>();
        for (Element el : doc.select("h1")) {
            h1.add(el.text().trim());
        }

        List<String> imagesWithoutAlt = new ArrayList<>();
        for (Element img : doc.select("img:not([alt])")) {
            imagesWithoutAlt.add(img.hasAttr("src") ? img.absUrl("src") : "<inline>");
        }

        List<String> insecure = new ArrayList<>();
        if (pageUrl.toLowerCase(Locale.ROOT).startsWith("https://")) {
            for (Element el : doc.select(SUB_RESOURCES)) {
                String attr = el.hasAttr("src") ? "src" : "href";
                String raw = el.attr(attr).trim().toLowerCase(Locale.ROOT);
                if (raw.startsWith("http://")) insecure.add(el.attr(attr).trim());
            }
        }

        String text = doc.body() == null ? "" : doc.body().text().trim();
        int wordCount = text.isEmpty() ? 0 : text.split("\\s+").length;

        return new PageContent(title, meta, h1, imagesWithoutAlt, insecure, wordCount);
    }

    private static void putMeta(Map<String, String> meta, String key, Element el, String attr) {
        if (el == null || !el.hasAttr(attr)) return;
        String value = attr.equals("href") ? el.absUrl(attr) : el.attr(attr);
        if (value.isEmpty() && attr.equals("href")) value = el.attr(attr);
        meta.put(key, value.trim());
    }
}
