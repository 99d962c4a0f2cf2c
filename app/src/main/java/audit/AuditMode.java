package audit;

import checks.BuiltInChecks;
import checks.CheckSet;

import java.util.Locale;

// Selects crawl bounds and the check set.
public enum AuditMode {
    // Deep audit of a site the operator controls
    OWN(10, 200, BuiltInChecks.OWN),
    // Light, low-footprint scan of a third party's site
    COMPETITOR(1, 20, BuiltInChecks.COMPETITOR);

    private final int defaultDepth;
    private final int defaultMaxPages;
    private final CheckSet checkSet;

    AuditMode(int defaultDepth, int defaultMaxPages, CheckSet checkSet) {
        this.defaultDepth = defaultDepth;
        this.defaultMaxPages = defaultMaxPages;
        this.checkSet = checkSet;
    }

    public int defaultDepth() {
        return defaultDepth;
    }

    public int defaultMaxPages() {
        return defaultMaxPages;
    }

    public CheckSet checkSet() {
        return checkSet;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static AuditMode fromLabel(String label) {
        for (AuditMode mode : values()) {
            if (mode.label().equalsIgnoreCase(label == null ? "" : label.trim())) return mode;
        }
        throw new IllegalArgumentException("Unknown mode: " + label + " (use own or competitor)");
    }
}
