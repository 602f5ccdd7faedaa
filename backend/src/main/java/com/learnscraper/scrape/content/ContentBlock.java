package com.learnscraper.scrape.content;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * One typed block of article or description content, in document order.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ContentBlock.Heading.class, name = "heading"),
    @JsonSubTypes.Type(value = ContentBlock.Paragraph.class, name = "paragraph"),
    @JsonSubTypes.Type(value = ContentBlock.ListBlock.class, name = "list"),
    @JsonSubTypes.Type(value = ContentBlock.Code.class, name = "code"),
    @JsonSubTypes.Type(value = ContentBlock.Quote.class, name = "quote"),
    @JsonSubTypes.Type(value = ContentBlock.Table.class, name = "table")
})
public interface ContentBlock {

    record Heading(int level, String text) implements ContentBlock {
    }

    record Paragraph(String text) implements ContentBlock {
    }

    record ListBlock(boolean ordered, List<String> items) implements ContentBlock {
        public ListBlock {
            items = items == null ? List.of() : List.copyOf(items);
        }
    }

    record Code(String text, String language) implements ContentBlock {
    }

    record Quote(String text) implements ContentBlock {
    }

    record Table(String rawMarkup, String text) implements ContentBlock {
    }
}
