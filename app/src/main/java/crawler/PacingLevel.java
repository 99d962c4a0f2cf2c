package crawler;

import java.util.Locale;

// Delay range applied before every fetch after the first.
public enum PacingLevel {
    OFF(0, 0),
    LOW(500, 1500),
    MEDIUM(1000, 3000),
    HIGH(2000, 5000);

    private final long minMillis;
    private final long maxMillis;

    PacingLevel(long minMillis, long maxMillis) {
        this.minMillis = minMillis;
        this.maxMillis = maxMillis;
    }

    public long minMillis() {
        return minMillis;
    }

    public long maxMillis() {
        return maxMillis;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    // Case-insensitive lookup by label, e.g. "medium".
    public static PacingLevel fromLabel(String label) {
        for (PacingLevel level : values()) {
            if (level.label().equalsIgnoreCase(label == null ? "" : label.trim())) return level;
        }
        throw new IllegalArgumentException("Unknown pacing level: " + label + " (use off, low, medium, high)");
    }
}
