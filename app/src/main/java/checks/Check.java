package checks;

import crawler.PageRecord;

// Stateless rule over one successful page. Cross-page rules read the SiteIndex.
@FunctionalInterface
public interface Check {

    void evaluate(PageRecord.Success page, SiteIndex site, FindingCollector out);
}
