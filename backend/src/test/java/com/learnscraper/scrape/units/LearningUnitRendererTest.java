package com.learnscraper.scrape.units;

import com.learnscraper.scrape.content.ContentBlock;
import com.learnscraper.scrape.content.StructuredDocument;
import com.learnscraper.scrape.meta.MetadataComputer;
import com.learnscraper.scrape.model.Article;
import com.learnscraper.scrape.model.Book;
import com.learnscraper.scrape.model.BookTotals;
import com.learnscraper.scrape.model.Chapter;
import com.learnscraper.scrape.model.Image;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class LearningUnitRendererTest {
    private final LearningUnitRenderer renderer = new LearningUnitRenderer();
    private final MetadataComputer metadataComputer = new MetadataComputer();

    @Test
    void rendersBlocksIntoDisplayText() {
        String content = renderer.renderContent(List.of(
            new ContentBlock.Heading(2, "Setup"),
            new ContentBlock.Paragraph("Install it."),
            new ContentBlock.ListBlock(false, List.of("fast", "safe")),
            new ContentBlock.ListBlock(true, List.of("download", "run")),
            new ContentBlock.Code("mvn test", null),
            new ContentBlock.Quote("Done is better than perfect."),
            new ContentBlock.Table("<table></table>", "ignored")
        ));

        assertEquals(
            "\n## Setup\n\nInstall it.\n• fast\n• safe\n1. download\n1. run\n\n```\nmvn test\n```\n\n\n> Done is better than perfect.\n",
            content
        );
    }

    @Test
    void flattensArticlesIntoUnitsWithSummary() {
        Instant scrapedAt = Instant.parse("2025-03-01T10:00:00Z");
        Article intro = article(1, "Welcome", 250, List.of(new Image("https://x/img.png", "images/a.png", null, null, null)));
        Article broken = Article.failed(2, "Broken", "https://learn.example.com/a/2", "Failed to fetch");
        Article policies = article(1, "Leave", 950, List.of());
        Book book = new Book(
            "Handbook",
            "For new joiners",
            "https://learn.example.com/book",
            scrapedAt,
            List.of(
                new Chapter(1, "Onboarding", List.of(intro, broken)),
                new Chapter(2, "Policies", List.of(policies))
            ),
            new BookTotals(2, 3, 1),
            false
        );

        LearningUnitsView view = renderer.render(book);

        assertThat(view.bookTitle()).isEqualTo("Handbook");
        assertThat(view.bookDescription()).isEqualTo("For new joiners");
        assertThat(view.scrapedAt()).isEqualTo(scrapedAt);
        assertThat(view.learningUnits()).extracting(LearningUnit::id).containsExactly("ch1_art1", "ch1_art2", "ch2_art1");

        LearningUnit first = view.learningUnits().get(0);
        assertThat(first.chapter()).isEqualTo("Onboarding");
        assertThat(first.chapterNumber()).isEqualTo(1);
        assertThat(first.images()).hasSize(1);
        assertNull(first.context().previousChapter());
        assertThat(first.context().sourceUrl()).isEqualTo("https://learn.example.com/a/Welcome");

        assertNull(first.error());

        LearningUnit failed = view.learningUnits().get(1);
        assertThat(failed.title()).isEqualTo("Broken");
        assertThat(failed.chapter()).isEqualTo("Onboarding");
        assertThat(failed.error()).isEqualTo("Failed to fetch");
        assertThat(failed.content()).isEmpty();
        assertThat(failed.structuredContent()).isEmpty();
        assertThat(failed.images()).isEmpty();
        assertNull(failed.metadata());
        assertThat(failed.context().sourceUrl()).isEqualTo("https://learn.example.com/a/2");

        LearningUnit third = view.learningUnits().get(2);
        assertThat(third.context().previousChapter()).isEqualTo("Onboarding");

        assertThat(view.summary().totalLearningUnits()).isEqualTo(3);
        assertThat(view.summary().totalChapters()).isEqualTo(2);
        assertThat(view.summary().totalImages()).isEqualTo(1);
        assertThat(view.summary().totalWords()).isEqualTo(1200);
        assertThat(view.summary().estimatedTotalReadingTimeMinutes()).isEqualTo(5);
    }

    private Article article(int number, String title, int wordCount, List<Image> images) {
        StructuredDocument content = new StructuredDocument(List.of(new ContentBlock.Paragraph(title)), title);
        return Article.extracted(
            number,
            title,
            "https://learn.example.com/a/" + title,
            content,
            images,
            metadataComputer.forWordCount(1, wordCount)
        );
    }
}
