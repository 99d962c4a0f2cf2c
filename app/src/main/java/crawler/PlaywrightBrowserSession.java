package crawler;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;

// Playwright objects are thread-confined: use a session from the thread that launched it.
public class PlaywrightBrowserSession implements BrowserSession {

    private static final Logger log = LoggerFactory.getLogger(PlaywrightBrowserSession.class);

    static final String USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/122.0.0.0 Safari/537.36";

    // Hide the most common headless tells before any page script runs.
    private static final String FINGERPRINT_SCRIPT = """
            Object.defineProperty(navigator, 'webdriver', { get: () => undefined });
            Object.defineProperty(navigator, 'languages', { get: () => ['en-US', 'en'] });
            Object.defineProperty(navigator, 'plugins', { get: () => [1, 2, 3, 4, 5] });
            window.chrome = window.chrome || { runtime: {} };
            """;

    private final Playwright playwright;
    private final Browser browser;
    private final BrowserContext context;

    private PlaywrightBrowserSession(Playwright playwright, Browser browser, BrowserContext context) {
        this.playwright = playwright;
        this.browser = browser;
        this.context = context;
    }

    // Launch Chromium; chromiumPath may be null to use the browser Playwright downloaded.
    public static PlaywrightBrowserSession launch(String chromiumPath, boolean headless) {
        Playwright playwright = Playwright.create();
        try {
            BrowserType.LaunchOptions options = new BrowserType.LaunchOptions()
                    .setHeadless(headless)
                    .setArgs(List.of("--disable-blink-features=AutomationControlled"));
            if (chromiumPath != null && !chromiumPath.isBlank()) {
                options.setExecutablePath(Paths.get(chromiumPath));
            }
            Browser browser = playwright.chromium().launch(options);

            BrowserContext context = browser.newContext(new Browser.NewContextOptions()
                    .setUserAgent(USER_AGENT)
                    .setLocale("en-US")
                    .setViewportSize(1366, 768)
                    .setExtraHTTPHeaders(Map.of("Accept-Language", "en-US,en;q=0.9")));
            context.addInitScript(FINGERPRINT_SCRIPT);

            log.debug("Launched Chromium (headless={}, executable={})", headless,
                    chromiumPath == null ? "<bundled>" : chromiumPath);
            return new PlaywrightBrowserSession(playwright, browser, context);
        } catch (RuntimeException e) {
            playwright.close();
            throw e;
        }
    }

    @Override
    public PageHandle newPage() {
        return new PlaywrightPageHandle(context.newPage());
    }

    @Override
    public void close() {
        try {
            context.close();
            browser.close();
        } finally {
            playwright.close();
        }
    }

    private static final class PlaywrightPageHandle implements PageHandle {

        private final Page page;

        private PlaywrightPageHandle(Page page) {
            this.page = page;
        }

        @Override
        public Navigation navigate(String url, Duration timeout) {
            try {
                Response response = page.navigate(url, new Page.NavigateOptions()
                        .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                        .setTimeout((double) timeout.toMillis()));
                if (response == null) {
                    return Navigation.failed(FetchStatus.FAILED, null, "No response for navigation");
                }
                return Navigation.loaded(response.status(), page.content(), page.url());
            } catch (TimeoutError e) {
                return Navigation.failed(FetchStatus.TIMEOUT, null,
                        "Timed out after " + timeout.toMillis() + " ms");
            } catch (PlaywrightException e) {
                return Navigation.failed(FetchStatus.FAILED, null, firstLine(e.getMessage()));
            }
        }

        @Override
        public void close() {
            page.close();
        }

        // Playwright messages carry a multi-line call log; the first line names the cause.
        private static String firstLine(String message) {
            if (message == null || message.isBlank()) return "Navigation failed";
            int nl = message.indexOf('\n');
            return (nl < 0 ? message : message.substring(0, nl)).trim();
        }
    }
}
