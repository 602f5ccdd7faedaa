package com.learnscraper.scrape.content;

import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns a content subtree into typed blocks. Every matching element yields its own block, so
 * a paragraph nested in a list item appears both inside the list and on its own.
 */
@Component
public class ContentStructurer {
    private static final String BLOCK_QUERY = "h1, h2, h3, h4, h5, h6, p, ul, ol, pre, code, blockquote, table";

    public StructuredDocument structure(Element root) {
        if (root == null) {
            return StructuredDocument.empty();
        }
        List<ContentBlock> blocks = new ArrayList<>();
        for (Element element : root.select(BLOCK_QUERY)) {
            if (element == root) {
                continue;
            }
            String text = element.text();
            if (text.isEmpty()) {
                continue;
            }
            ContentBlock block = toBlock(element, text);
            if (block != null) {
                blocks.add(block);
            }
        }
        return new StructuredDocument(blocks, root.text());
    }

    private ContentBlock toBlock(Element element, String text) {
        String tag = element.normalName().toLowerCase(Locale.ROOT);
        switch (tag) {
            case "h1", "h2", "h3", "h4", "h5", "h6":
                return new ContentBlock.Heading(tag.charAt(1) - '0', text);
            case "p":
                return new ContentBlock.Paragraph(text);
            case "ul", "ol":
                List<String> items = new ArrayList<>();
                for (Element child : element.children()) {
                    if ("li".equals(child.normalName())) {
                        items.add(child.text());
                    }
                }
                return new ContentBlock.ListBlock("ol".equals(tag), items);
            case "pre", "code":
                String language = element.classNames().isEmpty() ? null : element.classNames().iterator().next();
                return new ContentBlock.Code(element.wholeText(), language);
            case "blockquote":
                return new ContentBlock.Quote(text);
            case "table":
                return new ContentBlock.Table(element.outerHtml(), text);
            default:
                return null;
        }
    }
}
