package com.learnscraper.scrape.meta;

import com.learnscraper.scrape.content.StructuredDocument;
import com.learnscraper.scrape.model.ArticleMetadata;
import com.learnscraper.scrape.model.Difficulty;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class MetadataComputerTest {
    private final MetadataComputer computer = new MetadataComputer();

    @ParameterizedTest
    @CsvSource({"50,1", "250,1", "950,4", "1500,7"})
    void readingTimeIsWholeMinutesWithFloorOfOne(int wordCount, int expectedMinutes) {
        assertEquals(expectedMinutes, computer.readingTimeMinutes(wordCount));
    }

    @ParameterizedTest
    @CsvSource({"250,EASY", "299,EASY", "300,MEDIUM", "500,MEDIUM", "1000,MEDIUM", "1200,HARD"})
    void difficultyFollowsWordCountBands(int wordCount, Difficulty expected) {
        assertEquals(expected, computer.difficulty(wordCount));
    }

    @Test
    void computesFromRawTextWhitespaceTokens() {
        StructuredDocument content = new StructuredDocument(List.of(), "  one two\tthree\nfour  ");

        ArticleMetadata metadata = computer.compute(3, content);

        assertThat(metadata.chapterNumber()).isEqualTo(3);
        assertThat(metadata.wordCount()).isEqualTo(4);
        assertThat(metadata.readingTimeMinutes()).isEqualTo(1);
        assertThat(metadata.difficulty()).isEqualTo(Difficulty.EASY);
        assertThat(metadata.reviewIntervalsDays()).containsExactly(1, 3, 7, 14, 30, 60, 120);
        assertThat(metadata.contentType()).isEqualTo("educational_article");
    }

    @Test
    void emptyTextCountsZeroWords() {
        assertEquals(0, computer.countWords("   "));
        assertEquals(0, computer.countWords(null));
    }
}
