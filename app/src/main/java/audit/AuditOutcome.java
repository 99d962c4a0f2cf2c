package audit;

public enum AuditOutcome {
    COMPLETE,
    // A report was produced, but the crawl was cancelled or the narrative was unavailable
    PARTIAL,
    // Not a single page could be fetched; no checks ran and no report exists
    FAILED
}
