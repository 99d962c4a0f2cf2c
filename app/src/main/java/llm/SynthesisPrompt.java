package llm;

import checks.Finding;

import java.util.List;

// Prompt text shared by every provider.
final class SynthesisPrompt {

    static final String SYSTEM = """
            You are an experienced technical SEO and web quality auditor.
            You receive the deterministic findings of an automated crawl of one website.
            Write a concise narrative analysis in Markdown: an executive summary, the most important
            problems in priority order with concrete fixes, and quick wins.
            Only rely on the findings you are given; do not invent pages or measurements.
            Do not repeat the findings list verbatim and do not add a top-level heading.
            """;

    private SynthesisPrompt() {
    }

    static String user(String startUrl, List<Finding> findings, String planContent) {
        StringBuilder sb = new StringBuilder();
        sb.append("Site: ").append(startUrl).append("\n\n");

        sb.append("Findings (").append(findings.size()).append("), one per line as ")
                .append("severity | check | url | message | evidence:\n");
        if (findings.isEmpty()) {
            sb.append("(none)\n");
        }
        for (Finding f : findings) {
            sb.append("- ").append(f.severity().label())
                    .append(" | ").append(f.checkId())
                    .append(" | ").append(f.url())
                    .append(" | ").append(f.message())
                    .append(" | ").append(f.evidence() == null ? "" : f.evidence())
                    .append('\n');
        }

        if (planContent != null && !planContent.isBlank()) {
            sb.append("\nAudit plan. Address every item of this plan in your analysis, ")
                    .append("saying explicitly when the findings do not cover an item:\n\n")
                    .append(planContent);
            if (!planContent.endsWith("\n")) sb.append('\n');
        }
        return sb.toString();
    }
}
