package crawler;

import java.time.Duration;

// One browser tab. Network and navigation errors come back as a failed Navigation.
public interface PageHandle extends AutoCloseable {

    Navigation navigate(String url, Duration timeout);

    @Override
    void close();
}
