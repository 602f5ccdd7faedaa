package com.learnscraper.scrape.extract;

import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Evaluates rule chains in priority order. Each rule looks at its first matching element only;
 * when that element yields nothing the next rule is tried.
 */
@Component
public class FieldExtractor {

    /**
     * @return the first non-blank value produced by the chain, trimmed, or null when no rule yields one
     */
    public String extract(Element node, List<FieldRule> rules) {
        if (node == null || rules == null) {
            return null;
        }
        for (FieldRule rule : rules) {
            Element element = firstMatch(node, rule);
            if (element == null) {
                continue;
            }
            String value = rule.reader().apply(element);
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    /**
     * @return the first element matched by any rule of the chain, in rule order, or null
     */
    public Element locate(Element node, List<FieldRule> rules) {
        if (node == null || rules == null) {
            return null;
        }
        for (FieldRule rule : rules) {
            Element element = firstMatch(node, rule);
            if (element != null) {
                return element;
            }
        }
        return null;
    }

    private Element firstMatch(Element node, FieldRule rule) {
        for (Element candidate : node.getElementsByTag(rule.tag())) {
            if (rule.matches(candidate)) {
                return candidate;
            }
        }
        return null;
    }
}
