package com.learnscraper.scrape.extract;

import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Collects list-like job sections (requirements, benefits, ...) by finding keyword headers and
 * reading the block that follows each one. Every qualifying header contributes, so a section
 * announced twice is harvested twice.
 */
@Component
public class KeywordHarvester {
    private static final Set<String> HEADER_TAGS = Set.of("h2", "h3", "h4", "strong", "b", "p");
    private static final Set<String> SECTION_TAGS = Set.of("ul", "ol", "div", "p");
    private static final Set<String> LIST_TAGS = Set.of("ul", "ol");

    public List<String> harvest(Element root, HarvestField field) {
        List<String> results = new ArrayList<>();
        if (root == null) {
            return results;
        }
        Elements all = root.getAllElements();
        for (int i = 0; i < all.size(); i++) {
            Element header = all.get(i);
            if (!HEADER_TAGS.contains(header.normalName())) {
                continue;
            }
            String headerText = header.text().toLowerCase(Locale.ROOT);
            if (!field.matchesHeader(headerText)) {
                continue;
            }
            Element section = nextSection(all, i, header);
            if (section == null) {
                continue;
            }
            if (LIST_TAGS.contains(section.normalName())) {
                for (Element item : section.children()) {
                    if (!"li".equals(item.normalName())) {
                        continue;
                    }
                    String text = item.text();
                    if (!text.isEmpty()) {
                        results.add(text);
                    }
                }
            } else {
                String text = section.text();
                if (!text.isEmpty() && !headerText.contains(text.toLowerCase(Locale.ROOT))) {
                    results.add(text);
                }
            }
        }
        return results;
    }

    // Nearest section element after the header in document order, skipping the header's own subtree.
    private Element nextSection(Elements all, int headerIndex, Element header) {
        int start = headerIndex + header.getAllElements().size();
        for (int j = start; j < all.size(); j++) {
            Element candidate = all.get(j);
            if (SECTION_TAGS.contains(candidate.normalName())) {
                return candidate;
            }
        }
        return null;
    }
}
