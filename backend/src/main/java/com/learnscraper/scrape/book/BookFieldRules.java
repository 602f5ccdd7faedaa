package com.learnscraper.scrape.book;

import com.learnscraper.scrape.extract.FieldRule;

import java.util.List;

import static com.learnscraper.scrape.extract.FieldRule.classMatching;
import static com.learnscraper.scrape.extract.FieldRule.idMatching;
import static com.learnscraper.scrape.extract.FieldRule.metaContent;
import static com.learnscraper.scrape.extract.FieldRule.tag;

public final class BookFieldRules {

    public static final List<FieldRule> TITLE = List.of(
        classMatching("h1", "book.*title|title"),
        tag("h1"),
        tag("title"),
        metaContent("property", "og:title")
    );

    public static final List<FieldRule> DESCRIPTION = List.of(
        metaContent("name", "description"),
        metaContent("property", "og:description"),
        classMatching("div", "description|summary"),
        classMatching("p", "description|summary")
    );

    public static final List<FieldRule> TOC_CONTAINER = List.of(
        classMatching("div", "toc|table.*of.*contents|sidebar|navigation"),
        classMatching("nav", "toc|navigation|sidebar"),
        classMatching("aside", "toc|navigation|sidebar"),
        classMatching("ul", "chapter|article.*list")
    );

    public static final List<FieldRule> ARTICLE_CONTENT = List.of(
        tag("article"),
        classMatching("div", "content|article|main|body"),
        tag("main"),
        idMatching("div", "content|article|main"),
        classMatching("section", "content|article")
    );

    private BookFieldRules() {
    }
}
