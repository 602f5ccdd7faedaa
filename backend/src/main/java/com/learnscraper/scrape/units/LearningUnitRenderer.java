package com.learnscraper.scrape.units;

import com.learnscraper.scrape.content.ContentBlock;
import com.learnscraper.scrape.model.Article;
import com.learnscraper.scrape.model.Book;
import com.learnscraper.scrape.model.Chapter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a crawled book into a flat list of learning units ready for prompt filling.
 * Failed articles stay in place as units with empty content and their error; the summary keeps
 * the book's own chapter and image totals.
 */
@Component
public class LearningUnitRenderer {

    public LearningUnitsView render(Book book) {
        List<LearningUnit> units = new ArrayList<>();
        String previousChapter = null;
        for (Chapter chapter : book.chapters()) {
            for (Article article : chapter.articles()) {
                String id = "ch" + chapter.number() + "_art" + article.number();
                LearningUnitContext context = new LearningUnitContext(previousChapter, article.url());
                if (article.isFailed()) {
                    units.add(new LearningUnit(
                        id, chapter.title(), chapter.number(), article.title(),
                        "", List.of(), List.of(), null, context, article.error()
                    ));
                    continue;
                }
                units.add(new LearningUnit(
                    id,
                    chapter.title(),
                    chapter.number(),
                    article.title(),
                    renderContent(article.content().blocks()),
                    article.content().blocks(),
                    article.images(),
                    article.metadata(),
                    context,
                    null
                ));
            }
            previousChapter = chapter.title();
        }

        int totalWords = 0;
        int totalMinutes = 0;
        for (LearningUnit unit : units) {
            if (unit.metadata() == null) {
                continue;
            }
            totalWords += unit.metadata().wordCount();
            totalMinutes += unit.metadata().readingTimeMinutes();
        }
        LearningUnitsSummary summary = new LearningUnitsSummary(
            units.size(),
            book.totals().chapterCount(),
            book.totals().imageCount(),
            totalWords,
            totalMinutes
        );
        return new LearningUnitsView(book.title(), book.description(), book.scrapedAt(), units, summary);
    }

    String renderContent(List<ContentBlock> blocks) {
        List<String> parts = new ArrayList<>();
        for (ContentBlock block : blocks) {
            if (block instanceof ContentBlock.Heading heading) {
                parts.add("\n" + "#".repeat(heading.level()) + " " + heading.text() + "\n");
            } else if (block instanceof ContentBlock.Paragraph paragraph) {
                parts.add(paragraph.text());
            } else if (block instanceof ContentBlock.ListBlock list) {
                String prefix = list.ordered() ? "1." : "•";
                for (String item : list.items()) {
                    parts.add(prefix + " " + item);
                }
            } else if (block instanceof ContentBlock.Code code) {
                parts.add("\n```\n" + code.text() + "\n```\n");
            } else if (block instanceof ContentBlock.Quote quote) {
                parts.add("\n> " + quote.text() + "\n");
            }
            // tables stay in structuredContent only
        }
        return String.join("\n", parts);
    }
}
