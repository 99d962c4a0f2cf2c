package crawler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

// SEO facts of one document. title is null when the element is absent.
public record PageContent(
        String title,
        Map<String, String> meta,
        List<String> h1,
        List<String> imagesWithoutAlt,
        List<String> insecureResources,
        int wordCount
) {
    public static final String META_DESCRIPTION = "description";
    public static final String META_ROBOTS = "robots";
    public static final String META_VIEWPORT = "viewport";
    public static final String META_CANONICAL = "canonical";
    public static final String META_OG_TITLE = "og:title";
    public static final String META_OG_DESCRIPTION = "og:description";
    public static final String META_LANG = "lang";
    public static final String META_CHARSET = "charset";

    public PageContent {
        meta = Collections.unmodifiableMap(new LinkedHashMap<>(meta));
        h1 = List.copyOf(h1);
        imagesWithoutAlt = List.copyOf(imagesWithoutAlt);
        insecureResources = List.copyOf(insecureResources);
    }

    public static PageContent empty() {
        return new PageContent(null, Map.of(), List.of(), List.of(), List.of(), 0);
    }

    // Value of a meta field, or null when the page does not declare it.
    public String meta(String key) {
        return meta.get(key);
    }
}
