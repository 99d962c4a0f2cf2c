package checks;

import crawler.FetchStatus;
import crawler.PageContent;
import crawler.PageRecord;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// Hand-built page records for check tests.
final class Pages {

    static final Instant FETCHED_AT = Instant.parse("2026-03-01T10:00:00Z");

    private Pages() {
    }

    // A page that passes every single-page check.
    static Builder healthy(String url) {
        return new Builder(url)
                .title("A perfectly reasonable page title")
                .meta(PageContent.META_DESCRIPTION, "A meta description that is long enough to be useful to searchers and short enough.")
                .meta(PageContent.META_VIEWPORT, "width=device-width, initial-scale=1")
                .meta(PageContent.META_LANG, "en")
                .meta(PageContent.META_CANONICAL, url)
                .h1("Heading")
                .words(400);
    }

    static PageRecord.Failure failure(String url, Integer status, String error) {
        FetchStatus kind = status == null ? FetchStatus.FAILED : FetchStatus.HTTP_ERROR;
        return new PageRecord.Failure(url, 1, status, kind, error, FETCHED_AT, 12);
    }

    static final class Builder {
        private final String url;
        private String title;
        private final Map<String, String> meta = new LinkedHashMap<>();
        private List<String> h1 = List.of();
        private List<String> imagesWithoutAlt = List.of();
        private List<String> insecure = List.of();
        private List<String> links = List.of();
        private int words;
        private long elapsedMs = 100;

        Builder(String url) {
            this.url = url;
        }

        Builder title(String title) {
            this.title = title;
            return this;
        }

        Builder meta(String key, String value) {
            if (value == null) meta.remove(key);
            else meta.put(key, value);
            return this;
        }

        Builder h1(String... h1) {
            this.h1 = List.of(h1);
            return this;
        }

        Builder imagesWithoutAlt(String... images) {
            this.imagesWithoutAlt = List.of(images);
            return this;
        }

        Builder insecure(String... resources) {
            this.insecure = List.of(resources);
            return this;
        }

        Builder links(String... links) {
            this.links = List.of(links);
            return this;
        }

        Builder words(int words) {
            this.words = words;
            return this;
        }

        Builder elapsed(long elapsedMs) {
            this.elapsedMs = elapsedMs;
            return this;
        }

        PageRecord.Success build() {
            PageContent content = new PageContent(title, meta, h1, imagesWithoutAlt, insecure, words);
            return new PageRecord.Success(url, 0, 200, "<html></html>", links, content, FETCHED_AT, elapsedMs);
        }
    }
}
