package com.bountyscope.tools;

import java.util.List;

/**
 * Same-origin page discovery starting from a live URL.
 */
public interface CrawlAdapter {

    List<String> crawl(String startUrl);
}
