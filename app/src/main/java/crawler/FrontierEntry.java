package crawler;

// A normalized URL waiting to be fetched, with the depth it was discovered at.
public record FrontierEntry(String url, int depth) { }
