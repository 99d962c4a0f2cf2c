package report;

// What happened to the narrative section of a report.
public enum NarrativeStatus {
    // No LLM client was supplied; the section is left out
    OMITTED,
    INCLUDED,
    // The request failed; the section holds a note instead
    UNAVAILABLE
}
