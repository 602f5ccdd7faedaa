package com.learnscraper.scrape.content;

import java.util.List;

public record StructuredDocument(List<ContentBlock> blocks, String rawText) {
    public StructuredDocument {
        blocks = blocks == null ? List.of() : List.copyOf(blocks);
        rawText = rawText == null ? "" : rawText;
    }

    public static StructuredDocument empty() {
        return new StructuredDocument(List.of(), "");
    }
}
