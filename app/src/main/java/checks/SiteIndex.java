package checks;

import crawler.PageContent;
import crawler.PageRecord;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

// Read-only view over all pages of a crawl, for the cross-page checks.
public final class SiteIndex {

    private final Map<String, List<String>> urlsByTitle;
    private final Map<String, List<String>> urlsByDescription;
    private final Set<String> failedUrls;

    private SiteIndex(Map<String, List<String>> urlsByTitle,
                      Map<String, List<String>> urlsByDescription,
                      Set<String> failedUrls) {
        this.urlsByTitle = urlsByTitle;
        this.urlsByDescription = urlsByDescription;
        this.failedUrls = failedUrls;
    }

    public static SiteIndex of(List<? extends PageRecord> pages) {
        Map<String, List<String>> byTitle = new LinkedHashMap<>();
        Map<String, List<String>> byDescription = new LinkedHashMap<>();
        Set<String> failed = new HashSet<>();

        for (PageRecord page : pages) {
            if (page instanceof PageRecord.Success s) {
                index(byTitle, s.content().title(), s.url());
                index(byDescription, s.content().meta(PageContent.META_DESCRIPTION), s.url());
            } else {
                failed.add(page.url());
            }
        }
        return new SiteIndex(freeze(byTitle), freeze(byDescription), Collections.unmodifiableSet(failed));
    }

    // Other pages sharing this title (case- and whitespace-insensitive), in crawl order.
    public List<String> otherPagesWithTitle(String title, String url) {
        return others(urlsByTitle, title, url);
    }

    public List<String> otherPagesWithDescription(String description, String url) {
        return others(urlsByDescription, description, url);
    }

    public boolean isFailed(String url) {
        return failedUrls.contains(url);
    }

    private static List<String> others(Map<String, List<String>> index, String value, String url) {
        String key = key(value);
        if (key == null) return List.of();
        List<String> out = new ArrayList<>();
        for (String candidate : index.getOrDefault(key, List.of())) {
            if (!candidate.equals(url)) out.add(candidate);
        }
        return out;
    }

    private static void index(Map<String, List<String>> index, String value, String url) {
        String key = key(value);
        if (key == null) return;
        List<String> urls = index.computeIfAbsent(key, k -> new ArrayList<>());
        if (!urls.contains(url)) urls.add(url);
    }

    private static String key(String value) {
        if (value == null) return null;
        String k = value.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return k.isEmpty() ? null : k;
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> index) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        index.forEach((k, v) -> out.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(out);
    }
}
