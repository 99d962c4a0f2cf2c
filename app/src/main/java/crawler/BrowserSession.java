package crawler;

public interface BrowserSession extends AutoCloseable {

    PageHandle newPage();

    @Override
    void close();
}
