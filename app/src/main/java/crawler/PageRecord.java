package crawler;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

// A page carries either a document or an error, never both.
public sealed interface PageRecord permits PageRecord.Success, PageRecord.Failure {

    String url();

    int depth();

    // HTTP status, or null when the transport failed before any response
    Integer statusCode();

    Instant fetchedAt();

    long elapsedMs();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    record Success(
            String url,
            int depth,
            Integer statusCode,
            String html,
            List<String> links,
            PageContent content,
            Instant fetchedAt,
            long elapsedMs
    ) implements PageRecord {
        public Success {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(statusCode, "statusCode");
            Objects.requireNonNull(html, "html");
            Objects.requireNonNull(content, "content");
            Objects.requireNonNull(fetchedAt, "fetchedAt");
            if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
            links = List.copyOf(links);
        }

        public String title() {
            return content.title();
        }
    }

    record Failure(
            String url,
            int depth,
            Integer statusCode,
            FetchStatus kind,
            String error,
            Instant fetchedAt,
            long elapsedMs
    ) implements PageRecord {
        public Failure {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(error, "error");
            Objects.requireNonNull(fetchedAt, "fetchedAt");
            if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
            if (kind == FetchStatus.OK) throw new IllegalArgumentException("a failure cannot have kind OK");
        }
    }
}
