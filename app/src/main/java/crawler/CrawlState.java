package crawler;

// Lifecycle of a crawl session: IDLE -> RUNNING -> (DRAINING | CANCELLED) -> DONE.
public enum CrawlState {
    IDLE,
    RUNNING,
    DRAINING,
    CANCELLED,
    DONE
}
