package crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

// Ordinary load failures become Failure records. Nothing is retried here.
public class PageFetcher {

    private static final Logger log = LoggerFactory.getLogger(PageFetcher.class);

    private final PageHandle page;
    private final Duration timeout;
    private final PageParser parser;
    private final Clock clock;

    public PageFetcher(PageHandle page, Duration timeout) {
        this(page, timeout, new PageParser(), Clock.systemUTC());
    }

    public PageFetcher(PageHandle page, Duration timeout, PageParser parser, Clock clock) {
        this.page = Objects.requireNonNull(page, "page");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public PageRecord fetch(String url, int depth) {
        Instant fetchedAt = clock.instant();
        long started = System.nanoTime();

        Navigation nav;
        try {
            nav = page.navigate(url, timeout);
        } catch (RuntimeException e) {
            // A handle that breaks its contract still only costs this page
            nav = Navigation.failed(FetchStatus.FAILED, null, describe(e));
        }

        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();
        PageRecord record = toRecord(url, depth, nav, fetchedAt, elapsedMs);

        if (record instanceof PageRecord.Failure failure) {
            log.debug("Fetch failed [{}] depth={} {} ({})", failure.kind(), depth, url, failure.error());
        } else {
            log.debug("Fetched [{}] depth={} {} in {} ms", record.statusCode(), depth, url, elapsedMs);
        }
        return record;
    }

    private PageRecord toRecord(String url, int depth, Navigation nav, Instant fetchedAt, long elapsedMs) {
        if (nav == null) {
            return new PageRecord.Failure(url, depth, null, FetchStatus.FAILED, "No navigation result", fetchedAt, elapsedMs);
        }
        if (!nav.isLoaded()) {
            String error = nav.error() == null ? nav.kind().name() : nav.error();
            return new PageRecord.Failure(url, depth, nav.status(), nav.kind(), error, fetchedAt, elapsedMs);
        }
        int status = nav.status() == null ? 0 : nav.status();
        if (status / 100 != 2) {
            return new PageRecord.Failure(url, depth, status, FetchStatus.HTTP_ERROR, "HTTP " + status, fetchedAt, elapsedMs);
        }
        if (nav.html() == null) {
            return new PageRecord.Failure(url, depth, status, FetchStatus.FAILED, "Empty document", fetchedAt, elapsedMs);
        }

        // Relative links resolve against the served document, not the normalized request URL
        String documentUrl = nav.finalUrl() == null || nav.finalUrl().isBlank() ? url : nav.finalUrl();
        PageParser.ParsedPage parsed;
        try {
            parsed = parser.parse(nav.html(), documentUrl);
        } catch (RuntimeException e) {
            return new PageRecord.Failure(url, depth, status, FetchStatus.FAILED,
                    "Could not parse document: " + describe(e), fetchedAt, elapsedMs);
        }
        return new PageRecord.Success(url, depth, status, nav.html(), parsed.links(), parsed.content(), fetchedAt, elapsedMs);
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
