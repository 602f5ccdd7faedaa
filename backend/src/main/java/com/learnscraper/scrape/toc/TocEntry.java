package com.learnscraper.scrape.toc;

import java.util.List;

/**
 * Node of the discovered table of contents. Chapters carry their articles as children and may
 * have no URL of their own; articles are identified by their absolute URL.
 */
public record TocEntry(String title, String url, List<TocEntry> children) {
    public TocEntry {
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static TocEntry article(String title, String url) {
        return new TocEntry(title, url, List.of());
    }
}
