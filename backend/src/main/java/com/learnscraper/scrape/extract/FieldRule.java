package com.learnscraper.scrape.extract;

import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * One entry of a heuristic rule chain: which element to look at and how to read a value from it.
 * An element matches when its tag equals {@code tag} and, if {@code attribute} is set, the attribute
 * either equals {@code exactValue} or contains a match for {@code valuePattern}. Patterns on
 * {@code class} are tried against each class name on its own.
 */
public record FieldRule(
    String tag,
    String attribute,
    String exactValue,
    Pattern valuePattern,
    Function<Element, String> reader
) {
    public static final Function<Element, String> TEXT = Element::text;

    public static FieldRule tag(String tag) {
        return new FieldRule(tag, null, null, null, TEXT);
    }

    public static FieldRule exact(String tag, String attribute, String value) {
        return new FieldRule(tag, attribute, value, null, TEXT);
    }

    public static FieldRule classMatching(String tag, String regex) {
        return matching(tag, "class", regex);
    }

    public static FieldRule idMatching(String tag, String regex) {
        return matching(tag, "id", regex);
    }

    public static FieldRule matching(String tag, String attribute, String regex) {
        return new FieldRule(tag, attribute, null, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), TEXT);
    }

    public static FieldRule metaContent(String attribute, String value) {
        return new FieldRule("meta", attribute, value, null, attributeReader("content"));
    }

    public FieldRule readingAttribute(String name) {
        return new FieldRule(tag, attribute, exactValue, valuePattern, attributeReader(name));
    }

    /**
     * Reads the attribute when present, otherwise falls back to the element text.
     */
    public FieldRule preferringAttribute(String name) {
        return new FieldRule(tag, attribute, exactValue, valuePattern, element -> {
            String value = element.attr(name);
            return value.isBlank() ? element.text() : value;
        });
    }

    public boolean matches(Element element) {
        if (!element.normalName().equals(tag.toLowerCase(Locale.ROOT))) {
            return false;
        }
        if (attribute == null) {
            return true;
        }
        if (!element.hasAttr(attribute)) {
            return false;
        }
        String actual = element.attr(attribute);
        if (exactValue != null) {
            return exactValue.equals(actual);
        }
        if (valuePattern == null) {
            return true;
        }
        if ("class".equals(attribute)) {
            for (String className : element.classNames()) {
                if (valuePattern.matcher(className).find()) {
                    return true;
                }
            }
            return false;
        }
        return valuePattern.matcher(actual).find();
    }

    private static Function<Element, String> attributeReader(String name) {
        return element -> element.attr(name);
    }
}
