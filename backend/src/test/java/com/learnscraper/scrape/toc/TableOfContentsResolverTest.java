package com.learnscraper.scrape.toc;

import com.learnscraper.scrape.extract.FieldExtractor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TableOfContentsResolverTest {
    private static final String BOOK_URL = "https://learn.example.com/portal/acme/book/handbook";

    private final TableOfContentsResolver resolver = new TableOfContentsResolver(new FieldExtractor());

    @Test
    void chapterHeadingsTakeTheirSiblingListsAndDedupeByUrl() {
        Document document = Jsoup.parse(
            """
                <div class="toc">
                  <h3 class="chapter-title">Chapter One</h3>
                  <ul>
                    <li><a href="/article/intro">Intro</a></li>
                    <li><a href="/article/setup">Setup</a></li>
                    <li><a href="/article/intro">Intro again</a></li>
                  </ul>
                  <h3 class="chapter-title">Chapter Two</h3>
                  <ul><li><a href="/article/next">Next steps</a></li></ul>
                  <h3 class="chapter-title">Empty Chapter</h3>
                  <p>Coming soon</p>
                </div>
                """,
            BOOK_URL
        );

        List<TocEntry> chapters = resolver.resolve(document, BOOK_URL);

        assertThat(chapters).extracting(TocEntry::title).containsExactly("Chapter One", "Chapter Two");
        assertThat(chapters.get(0).children()).containsExactly(
            TocEntry.article("Intro", "https://learn.example.com/article/intro"),
            TocEntry.article("Setup", "https://learn.example.com/article/setup")
        );
        assertThat(chapters.get(1).children()).extracting(TocEntry::url)
            .containsExactly("https://learn.example.com/article/next");
    }

    @Test
    void chapterElementWrappingItsListUsesOwnTextAsTitle() {
        Document document = Jsoup.parse(
            """
                <nav class="sidebar">
                  <div class="section">
                    <h4 class="section-heading">Basics</h4>
                    <ul><li><a href="/b/1">Lesson 1</a></li></ul>
                  </div>
                </nav>
                """,
            BOOK_URL
        );

        List<TocEntry> chapters = resolver.resolve(document, BOOK_URL);

        assertThat(chapters).hasSize(1);
        assertThat(chapters.get(0).title()).isEqualTo("Basics");
        assertThat(chapters.get(0).children()).extracting(TocEntry::title).containsExactly("Lesson 1");
    }

    @Test
    void chapterWrapperKeepsEveryNestedChapter() {
        Document document = Jsoup.parse(
            """
                <div class="toc">
                  <div class="chapters">
                    <div class="chapter">
                      <h3>Ch1</h3>
                      <ul><li><a href="/a/1">A1</a></li></ul>
                    </div>
                    <div class="chapter">
                      <h3>Ch2</h3>
                      <ul>
                        <li><a href="/a/2">A2</a></li>
                        <li><a href="/a/3">A3</a></li>
                      </ul>
                    </div>
                  </div>
                </div>
                """,
            BOOK_URL
        );

        List<TocEntry> chapters = resolver.resolve(document, BOOK_URL);

        assertThat(chapters).extracting(TocEntry::title).containsExactly("Ch1", "Ch2");
        assertThat(chapters.get(0).children()).extracting(TocEntry::url)
            .containsExactly("https://learn.example.com/a/1");
        assertThat(chapters.get(1).children()).extracting(TocEntry::url)
            .containsExactly("https://learn.example.com/a/2", "https://learn.example.com/a/3");
    }

    @Test
    void flattensSameOriginLinksWhenNoChaptersFound() {
        Document document = Jsoup.parse(
            """
                <nav>
                  <a href="#top">Top</a>
                  <a href="/guide/one">One</a>
                  <a href="https://elsewhere.example.org/x">Elsewhere</a>
                  <a href="/guide/two">Two</a>
                  <a href="/guide/one">One again</a>
                  <a href="/guide/empty"></a>
                </nav>
                """,
            BOOK_URL
        );

        List<TocEntry> chapters = resolver.resolve(document, BOOK_URL);

        assertThat(chapters).hasSize(1);
        assertThat(chapters.get(0).title()).isEqualTo(TableOfContentsResolver.FALLBACK_CHAPTER_TITLE);
        assertThat(chapters.get(0).children()).extracting(TocEntry::url).containsExactly(
            "https://learn.example.com/guide/one",
            "https://learn.example.com/guide/two"
        );
    }

    @Test
    void pageWithoutLinksYieldsNoChapters() {
        Document document = Jsoup.parse("<html><body><p>Welcome</p></body></html>", BOOK_URL);

        assertThat(resolver.resolve(document, BOOK_URL)).isEmpty();
    }
}
