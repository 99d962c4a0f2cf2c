package crawler;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;

public class UrlUtil {

    private UrlUtil() {
    }

    // Create a filesystem-safe file name from an arbitrary label.
    // Prefer a readable base; only add a hash when length requires it.
    public static String toSafeFilename(String label, String extension) {
        // Replace anything not [a-zA-Z0-9] with underscore, so it works as a filename.
        String safe = label.replaceAll("[^a-zA-Z0-9]+", "_");
        int maxBase = 160;
        if (safe.length() > maxBase) {
            safe = safe.substring(0, maxBase);
            return safe + "__" + shortHash(label) + extension;
        }
        return safe + extension;
    }

    // Short hash for filenames to avoid collisions.
    private static String shortHash(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 6; i++) sb.append(String.format("%02x", digest[i]));
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    // Lowercased scheme and host, no default port, fragment or trailing slash; query kept.
    // Null when url is not an absolute http(s) URL.
    public static String normalize(String url) {
        if (url == null) return null;
        try {
            URI uri = new URI(url.trim()).normalize();
            String scheme = uri.getScheme();
            String host = uri.getHost();
            if (scheme == null || host == null) return null;
            scheme = scheme.toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) return null;

            int port = uri.getPort();
            if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
                port = -1;
            }

            String path = uri.getRawPath() == null ? "" : uri.getRawPath();
            while (path.endsWith("/")) {
                path = path.substring(0, path.length() - 1);
            }

            StringBuilder sb = new StringBuilder();
            sb.append(scheme).append("://");
            if (uri.getRawUserInfo() != null) sb.append(uri.getRawUserInfo()).append('@');
            sb.append(host.toLowerCase(Locale.ROOT));
            if (port != -1) sb.append(':').append(port);
            sb.append(path);
            if (uri.getRawQuery() != null) sb.append('?').append(uri.getRawQuery());
            return sb.toString();
        } catch (URISyntaxException e) {
            return null;
        }
    }

    // Lowercased host of an absolute URL, or null when there is none.
    public static String hostOf(String url) {
        if (url == null) return null;
        try {
            String host = new URI(url).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }

    // Only accept http/https links.
    public static boolean isHttpLike(String url) {
        String u = url.toLowerCase(Locale.ROOT);
        return u.startsWith("http://") || u.startsWith("https://");
    }

    // Trim and sanitize raw href strings from HTML.
    public static String cleanHref(String href) {
        if (href == null) return null;
        String s = href.trim();
        if (s.isEmpty()) return null;

        // Strip surrounding quotes if present
        if ((s.startsWith("\"") && s.endsWith("\"")) || (s.startsWith("'") && s.endsWith("'"))) {
            s = s.substring(1, s.length() - 1).trim();
        }

        // If there are extra tokens (like target="_blank"), keep only the first token
        int ws = s.indexOf(' ');
        if (ws > 0) s = s.substring(0, ws).trim();

        // Drop trailing quote/angle bracket artifacts
        while (s.endsWith("\"") || s.endsWith("'") || s.endsWith(">")) {
            s = s.substring(0, s.length() - 1).trim();
        }

        // In-page anchors never point at another document
        if (s.startsWith("#")) return null;

        return s.isEmpty() ? null : s;
    }

    // Resolve relative hrefs against a base URL; null for hrefs that cannot be resolved.
    public static String resolveAgainst(String baseUrl, String href) {
        try {
            URI base = new URI(baseUrl);
            // An authority with an empty path resolves as if the path were "/"
            if (base.getRawAuthority() != null && (base.getRawPath() == null || base.getRawPath().isEmpty())) {
                base = new URI(base.getScheme() + "://" + base.getRawAuthority() + "/"
                        + (base.getRawQuery() == null ? "" : "?" + base.getRawQuery()));
            }
            URI rel = new URI(href);
            return base.resolve(rel).toString();
        } catch (Exception e) {
            // Bad hrefs exist in the wild; just skip them
            return null;
        }
    }
}
