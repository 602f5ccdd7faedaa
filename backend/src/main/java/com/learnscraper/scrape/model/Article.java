package com.learnscraper.scrape.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.learnscraper.scrape.content.StructuredDocument;

import java.util.List;

/**
 * One crawled article. A failed article keeps its position and identity and carries {@code error}
 * instead of content, images and metadata.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Article(
    int number,
    String title,
    String url,
    StructuredDocument content,
    List<Image> images,
    ArticleMetadata metadata,
    String error
) {
    public static Article extracted(
        int number,
        String title,
        String url,
        StructuredDocument content,
        List<Image> images,
        ArticleMetadata metadata
    ) {
        return new Article(number, title, url, content, List.copyOf(images), metadata, null);
    }

    public static Article failed(int number, String title, String url, String error) {
        return new Article(number, title, url, null, null, null, error);
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
