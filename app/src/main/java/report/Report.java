package report;

// Rendered Markdown plus the fate of its narrative section.
public record Report(String text, NarrativeStatus narrative) { }
