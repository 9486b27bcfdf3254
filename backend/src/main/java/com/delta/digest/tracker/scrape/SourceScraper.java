package com.delta.digest.tracker.scrape;

import com.delta.digest.tracker.model.DiscoveredItem;

import java.io.IOException;
import java.util.List;

public interface SourceScraper {
    List<DiscoveredItem> listItems(String sourceUrl) throws IOException;

    String fetchContent(String itemUrl) throws IOException;
}
