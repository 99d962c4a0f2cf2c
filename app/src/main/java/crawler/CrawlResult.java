package crawler;

import java.util.ArrayList;
import java.util.List;

// Pages in fetch order. A cancelled crawl still holds a valid prefix.
public record CrawlResult(String startUrl, List<PageRecord> pages, boolean cancelled) {

    public CrawlResult {
        pages = List.copyOf(pages);
    }

    public List<PageRecord.Success> successes() {
        List<PageRecord.Success> out = new ArrayList<>();
        for (PageRecord page : pages) {
            if (page instanceof PageRecord.Success s) out.add(s);
        }
        return out;
    }

    public List<PageRecord.Failure> failures() {
        List<PageRecord.Failure> out = new ArrayList<>();
        for (PageRecord page : pages) {
            if (page instanceof PageRecord.Failure f) out.add(f);
        }
        return out;
    }

    public boolean hasSuccess() {
        for (PageRecord page : pages) {
            if (page.isSuccess()) return true;
        }
        return false;
    }
}
