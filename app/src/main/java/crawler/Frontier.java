package crawler;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

// FIFO of URLs to visit plus every URL seen. Access is serialized on this instance.
public class Frontier {

    private final String startUrl;
    private final String host;
    private final int maxDepth;
    private final int maxPages;

    private final Deque<FrontierEntry> queue = new ArrayDeque<>();
    // Queued or already visited (normalized)
    private final Set<String> seen = new HashSet<>();
    private final AtomicInteger fetched = new AtomicInteger(0);

    public Frontier(String startUrl, int maxDepth, int maxPages) {
        Objects.requireNonNull(startUrl, "startUrl");
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxPages < 0) throw new IllegalArgumentException("maxPages must be >= 0");

        String normalized = UrlUtil.normalize(startUrl);
        if (normalized == null) {
            throw new IllegalArgumentException("Not an absolute http(s) URL: " + startUrl);
        }
        this.startUrl = normalized;
        this.host = UrlUtil.hostOf(normalized);
        this.maxDepth = maxDepth;
        this.maxPages = maxPages;
    }

    public String startUrl() {
        return startUrl;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public int maxPages() {
        return maxPages;
    }

    public synchronized boolean enqueue(String url, int depth) {
        if (depth < 0 || depth > maxDepth) return false;

        String normalized = UrlUtil.normalize(url);
        if (normalized == null) return false;

        // Cross-domain links are discovered but never followed
        if (!host.equals(UrlUtil.hostOf(normalized))) return false;

        if (!seen.add(normalized)) return false;
        queue.addLast(new FrontierEntry(normalized, depth));
        return true;
    }

    // Earliest-enqueued entry, or empty when nothing is left.
    public synchronized Optional<FrontierEntry> next() {
        return Optional.ofNullable(queue.pollFirst());
    }

    // Count one fetch attempt, successful or not, against the page cap.
    public void markFetched() {
        fetched.incrementAndGet();
    }

    public int fetchedCount() {
        return fetched.get();
    }

    public synchronized boolean shouldStop() {
        return fetched.get() >= maxPages || queue.isEmpty();
    }

    public synchronized int queuedCount() {
        return queue.size();
    }

    public synchronized boolean hasSeen(String url) {
        String normalized = UrlUtil.normalize(url);
        return normalized != null && seen.contains(normalized);
    }
}
