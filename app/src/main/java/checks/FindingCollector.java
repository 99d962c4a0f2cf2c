package checks;

import java.util.ArrayList;
import java.util.List;

// Collects the findings of one check for one page, stamping check id and URL.
public final class FindingCollector {

    private final String checkId;
    private final String url;
    private final List<Finding> findings = new ArrayList<>();

    FindingCollector(String checkId, String url) {
        this.checkId = checkId;
        this.url = url;
    }

    public void add(Severity severity, String message) {
        findings.add(new Finding(checkId, url, severity, message));
    }

    public void add(Severity severity, String message, String evidence) {
        findings.add(new Finding(checkId, url, severity, message, evidence));
    }

    List<Finding> findings() {
        return findings;
    }
}
