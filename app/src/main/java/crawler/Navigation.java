package crawler;

// Raw result of one page load, before it is turned into a PageRecord.
// finalUrl is where the document was served from after redirects; null when unknown.
public record Navigation(Integer status, String html, String finalUrl, FetchStatus kind, String error) {

    public static Navigation loaded(int status, String html) {
        return loaded(status, html, null);
    }

    public static Navigation loaded(int status, String html, String finalUrl) {
        return new Navigation(status, html, finalUrl, FetchStatus.OK, null);
    }

    public static Navigation failed(FetchStatus kind, Integer status, String error) {
        return new Navigation(status, null, null, kind, error);
    }

    public boolean isLoaded() {
        return kind == FetchStatus.OK;
    }
}
