package com.learnscraper.scrape.units;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.learnscraper.scrape.content.ContentBlock;
import com.learnscraper.scrape.model.ArticleMetadata;
import com.learnscraper.scrape.model.Image;

import java.util.List;

/**
 * One article flattened together with its chapter identity.
 *
 * @param id {@code ch<chapter>_art<article>}
 * @param content blocks rendered into a single display string
 * @param error why the article could not be scraped; null for extracted articles
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LearningUnit(
    String id,
    String chapter,
    int chapterNumber,
    String title,
    String content,
    List<ContentBlock> structuredContent,
    List<Image> images,
    ArticleMetadata metadata,
    LearningUnitContext context,
    String error
) {
    public LearningUnit {
        structuredContent = structuredContent == null ? List.of() : List.copyOf(structuredContent);
        images = images == null ? List.of() : List.copyOf(images);
    }
}
