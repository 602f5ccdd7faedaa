package com.learnscraper.scrape.meta;

import com.learnscraper.scrape.content.StructuredDocument;
import com.learnscraper.scrape.model.ArticleMetadata;
import com.learnscraper.scrape.model.Difficulty;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MetadataComputer {
    static final int WORDS_PER_MINUTE = 200;
    static final int EASY_BELOW_WORDS = 300;
    static final int HARD_ABOVE_WORDS = 1000;
    public static final List<Integer> REVIEW_INTERVALS_DAYS = List.of(1, 3, 7, 14, 30, 60, 120);
    static final String CONTENT_TYPE = "educational_article";

    public ArticleMetadata compute(int chapterNumber, StructuredDocument content) {
        int wordCount = countWords(content == null ? null : content.rawText());
        return forWordCount(chapterNumber, wordCount);
    }

    public ArticleMetadata forWordCount(int chapterNumber, int wordCount) {
        return new ArticleMetadata(
            chapterNumber,
            wordCount,
            readingTimeMinutes(wordCount),
            difficulty(wordCount),
            REVIEW_INTERVALS_DAYS,
            CONTENT_TYPE
        );
    }

    public int countWords(String text) {
        if (text == null) {
            return 0;
        }
        String trimmed = text.strip();
        if (trimmed.isEmpty()) {
            return 0;
        }
        return trimmed.split("\\s+").length;
    }

    public int readingTimeMinutes(int wordCount) {
        return Math.max(1, wordCount / WORDS_PER_MINUTE);
    }

    public Difficulty difficulty(int wordCount) {
        if (wordCount < EASY_BELOW_WORDS) {
            return Difficulty.EASY;
        }
        if (wordCount > HARD_ABOVE_WORDS) {
            return Difficulty.HARD;
        }
        return Difficulty.MEDIUM;
    }
}
