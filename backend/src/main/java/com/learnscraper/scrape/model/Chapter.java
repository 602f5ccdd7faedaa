package com.learnscraper.scrape.model;

import java.util.List;

public record Chapter(int number, String title, List<Article> articles) {
    public Chapter {
        articles = articles == null ? List.of() : List.copyOf(articles);
    }
}
