package crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

// Breadth-first, same-host, one fetch in flight. maxPages caps attempts, not successes.
public class UrlCrawler {

    private static final Logger log = LoggerFactory.getLogger(UrlCrawler.class);

    private final PageFetcher pageFetcher;
    private final Pacer pacer;

    // For graceful shutdown
    private volatile boolean shuttingDown = false;
    private volatile CrawlState state = CrawlState.IDLE;

    // Counters for a clean summary at the end
    private final AtomicInteger pagesFetchedOk = new AtomicInteger(0);
    private final AtomicInteger pagesHttpError = new AtomicInteger(0);
    private final AtomicInteger pagesTimedOut = new AtomicInteger(0);
    private final AtomicInteger pagesFailed = new AtomicInteger(0);

    public UrlCrawler(PageFetcher pageFetcher, Pacer pacer) {
        this.pageFetcher = Objects.requireNonNull(pageFetcher, "pageFetcher");
        this.pacer = Objects.requireNonNull(pacer, "pacer");
    }

    public CrawlState state() {
        return state;
    }

    // Ask the crawl to stop before its next fetch; pages collected so far are kept.
    public void cancel() {
        shuttingDown = true;
    }

    public CrawlResult crawl(String startUrl, int maxDepth, int maxPages) {
        synchronized (this) {
            if (state != CrawlState.IDLE) {
                throw new IllegalStateException("A crawler runs a single session; state is " + state);
            }
            state = CrawlState.RUNNING;
        }

        Frontier frontier = new Frontier(startUrl, maxDepth, maxPages);
        frontier.enqueue(frontier.startUrl(), 0);
        log.info("Crawling {} (max depth {}, max pages {}, pacing {})",
                frontier.startUrl(), maxDepth, maxPages, pacer.level().label());

        List<PageRecord> pages = new ArrayList<>();
        boolean cancelled = false;
        try {
            while (!frontier.shouldStop()) {
                if (cancelRequested()) {
                    cancelled = true;
                    break;
                }

                FrontierEntry entry = frontier.next().orElse(null);
                if (entry == null) break;

                if (!pages.isEmpty()) {
                    try {
                        pacer.pause();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        shuttingDown = true;
                    }
                    // Cancellation may have arrived while we slept
                    if (cancelRequested()) {
                        cancelled = true;
                        break;
                    }
                }

                PageRecord record = pageFetcher.fetch(entry.url(), entry.depth());
                frontier.markFetched();
                pages.add(record);
                count(record);

                if (record instanceof PageRecord.Success success && entry.depth() < maxDepth) {
                    int childDepth = entry.depth() + 1;
                    for (String link : success.links()) {
                        frontier.enqueue(link, childDepth);
                    }
                }
            }
        } finally {
            state = cancelled ? CrawlState.CANCELLED : CrawlState.DRAINING;
        }

        if (cancelled) {
            log.warn("Crawl cancelled after {} page(s); keeping partial results", pages.size());
        } else {
            log.info("Crawl finished: {} page(s), {} still queued", pages.size(), frontier.queuedCount());
        }
        CrawlResult result = new CrawlResult(frontier.startUrl(), pages, cancelled);
        state = CrawlState.DONE;
        return result;
    }

    private boolean cancelRequested() {
        if (Thread.currentThread().isInterrupted()) shuttingDown = true;
        return shuttingDown;
    }

    private void count(PageRecord record) {
        if (record instanceof PageRecord.Failure failure) {
            switch (failure.kind()) {
                case HTTP_ERROR -> pagesHttpError.incrementAndGet();
                case TIMEOUT -> pagesTimedOut.incrementAndGet();
                default -> pagesFailed.incrementAndGet();
            }
        } else {
            pagesFetchedOk.incrementAndGet();
        }
    }

    // Print a minimal end-of-run summary.
    public void printFinalSummary(PrintStream out) {
        out.println("==== Crawl summary ====");
        out.println("Fetched OK : " + pagesFetchedOk.get());
        out.println("HTTP errors: " + pagesHttpError.get());
        out.println("Timeouts   : " + pagesTimedOut.get());
        out.println("Failed     : " + pagesFailed.get());
        if (shuttingDown) {
            out.println("Cancelled  : yes (partial results)");
        }
    }
}
