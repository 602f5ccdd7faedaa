package com.learnscraper.scrape.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.learnscraper.scrape.extract.FieldRule.classMatching;
import static com.learnscraper.scrape.extract.FieldRule.exact;
import static com.learnscraper.scrape.extract.FieldRule.metaContent;
import static com.learnscraper.scrape.extract.FieldRule.tag;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class FieldExtractorTest {
    private static final List<FieldRule> TITLE_CHAIN = List.of(
        classMatching("h1", "job.*title"),
        classMatching("h1", "title"),
        tag("h1")
    );

    private final FieldExtractor extractor = new FieldExtractor();

    @Test
    void fallsBackToTheOnlyHeadingWhenNoClassRuleMatches() {
        Document document = Jsoup.parse("<html><body><h1>Senior Engineer</h1></body></html>");

        assertEquals("Senior Engineer", extractor.extract(document, TITLE_CHAIN));
    }

    @Test
    void returnsNullWhenNothingMatches() {
        Document document = Jsoup.parse("<html><body><p>No headings here</p></body></html>");

        assertNull(extractor.extract(document, TITLE_CHAIN));
    }

    @Test
    void earlierRuleWinsOverDocumentOrder() {
        Document document = Jsoup.parse(
            "<h1>Generic</h1><h1 class=\"page-title\">Page</h1><h1 class=\"job-title\">Job</h1>"
        );

        assertEquals("Job", extractor.extract(document, TITLE_CHAIN));
    }

    @Test
    void blankMatchFallsThroughToNextRule() {
        Document document = Jsoup.parse("<h1 class=\"job-title\">   </h1><h2>Backend Developer</h2>");

        assertEquals("Backend Developer", extractor.extract(document, List.of(classMatching("h1", "job.*title"), tag("h2"))));
    }

    @Test
    void classPatternMatchesOneClassNameAtATime() {
        Document document = Jsoup.parse(
            "<h1 class=\"job-header main-title\">Header</h1><h1 class=\"job-title\">Platform Engineer</h1>"
        );

        assertEquals("Platform Engineer", extractor.extract(document, List.of(classMatching("h1", "job.*title"))));
    }

    @Test
    void exactAttributeRuleDoesNotMatchPartialValue() {
        Document document = Jsoup.parse(
            "<span data-automation=\"advertiser-name-extra\">Wrong</span><span data-automation=\"advertiser-name\">Acme</span>"
        );

        assertEquals("Acme", extractor.extract(document, List.of(exact("span", "data-automation", "advertiser-name"))));
    }

    @Test
    void metaRuleReadsContentAttribute() {
        Document document = Jsoup.parse(
            "<html><head><meta property=\"og:title\" content=\" Data Analyst \"></head><body></body></html>"
        );

        assertEquals("Data Analyst", extractor.extract(document, List.of(metaContent("property", "og:title"))));
    }

    @Test
    void preferringAttributeFallsBackToText() {
        Document document = Jsoup.parse("<time>Posted 3 days ago</time>");

        assertEquals("Posted 3 days ago", extractor.extract(document, List.of(tag("time").preferringAttribute("datetime"))));
    }

    @Test
    void locateReturnsElementOfFirstMatchingRule() {
        Document document = Jsoup.parse("<main id=\"m\">x</main><article id=\"a\">y</article>");

        Element located = extractor.locate(document, List.of(tag("article"), tag("main")));

        assertThat(located).isNotNull();
        assertThat(located.id()).isEqualTo("a");
        assertThat(extractor.locate(document, List.of(tag("section")))).isNull();
    }
}
