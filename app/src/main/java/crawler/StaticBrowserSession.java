package crawler;

import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;

// Plain HTTP fetch through jsoup for hosts without Chromium. Runs no scripts.
public class StaticBrowserSession implements BrowserSession {

    @Override
    public PageHandle newPage() {
        return new StaticPageHandle();
    }

    @Override
    public void close() {
        // nothing held open
    }

    private static final class StaticPageHandle implements PageHandle {

        @Override
        public Navigation navigate(String url, Duration timeout) {
            try {
                Connection.Response response = Jsoup.connect(url)
                        .userAgent(PlaywrightBrowserSession.USER_AGENT)
                        .referrer("https://www.google.com/")
                        .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                        .header("Accept-Language", "en-US,en;q=0.9")
                        .header("Cache-Control", "no-cache")
                        .header("Pragma", "no-cache")
                        .timeout((int) timeout.toMillis())
                        .followRedirects(true)
                        .ignoreHttpErrors(true)
                        .execute();
                return Navigation.loaded(response.statusCode(), response.body(), response.url().toString());

            } catch (SocketTimeoutException e) {
                return Navigation.failed(FetchStatus.TIMEOUT, null,
                        "Timed out after " + timeout.toMillis() + " ms");

            } catch (IOException e) {
                String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                return Navigation.failed(FetchStatus.FAILED, null, message);
            }
        }

        @Override
        public void close() {
            // stateless
        }
    }
}
