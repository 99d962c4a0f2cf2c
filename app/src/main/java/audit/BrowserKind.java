package audit;

import java.util.Locale;

// Which browser session fetches pages.
public enum BrowserKind {
    // Headless Chromium via Playwright
    CHROMIUM,
    // Plain HTTP with jsoup, no script execution
    STATIC;

    public static BrowserKind fromLabel(String label) {
        try {
            return valueOf(label.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Unknown browser: " + label + " (use chromium or static)");
        }
    }
}
