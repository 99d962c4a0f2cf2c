package checks;

import java.util.Locale;

// Declared in ascending order of importance.
public enum Severity {
    INFO,
    WARNING,
    CRITICAL;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
