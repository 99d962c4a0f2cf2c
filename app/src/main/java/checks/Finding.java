package checks;

import java.util.Objects;

// evidence is null when the message says it all
public record Finding(String checkId, String url, Severity severity, String message, String evidence) {

    public Finding {
        Objects.requireNonNull(checkId, "checkId");
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
    }

    public Finding(String checkId, String url, Severity severity, String message) {
        this(checkId, url, severity, message, null);
    }
}
