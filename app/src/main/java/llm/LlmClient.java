package llm;

import checks.Finding;

import java.util.List;

public interface LlmClient {

    // provider:model this client talks to, for report headers and logs
    String name();

    // Markdown narrative; planContent may be null.
    String synthesize(String startUrl, List<Finding> findings, String planContent) throws LlmException;
}
