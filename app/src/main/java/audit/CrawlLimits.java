package audit;

// Depth and page cap of one audit.
public record CrawlLimits(int maxDepth, int maxPages) {

    // Explicit CLI values win. Configured defaults only widen or narrow own mode; competitor
    // mode keeps its light defaults so a global setting never deepens a scan of someone else's site.
    public static CrawlLimits resolve(AuditArgs args, AuditConfig config) {
        AuditMode mode = args.mode();
        boolean useConfig = mode == AuditMode.OWN;
        int depth = firstNonNull(args.depth(), useConfig ? config.defaultDepth() : null, mode.defaultDepth());
        int maxPages = firstNonNull(args.maxPages(), useConfig ? config.maxPages() : null, mode.defaultMaxPages());
        return new CrawlLimits(depth, maxPages);
    }

    private static int firstNonNull(Integer first, Integer second, int fallback) {
        if (first != null) return first;
        if (second != null) return second;
        return fallback;
    }
}
