package crawler;

// Outcome class of a single fetch attempt.
public enum FetchStatus {
    OK,
    // Server answered with a non-2xx status
    HTTP_ERROR,
    TIMEOUT,
    // Transport, navigation or render failure; no status available
    FAILED
}
