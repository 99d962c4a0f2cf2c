package llm;

// No client can be built: unknown provider, malformed model id or missing credentials.
public class LlmUnavailableException extends Exception {

    public LlmUnavailableException(String message) {
        super(message);
    }
}
