package com.learnscraper.scrape.extract;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-pass regex and keyword lookups over the text of a whole page.
 */
@Component
public class TextPatternExtractor {
    static final Pattern SALARY_PATTERN = Pattern.compile(
        "\\$[\\d,]+(?:\\s*-\\s*\\$[\\d,]+)?(?:\\s*(?:per|/|\\+)\\s*(?:year|hour|month|annum))?",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern DEADLINE_PATTERN = Pattern.compile(
        "(?:deadline|apply by|closes on)[:\\s]+([^\\n]+)",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern EDUCATION_PATTERN = Pattern.compile(
        "\\b(?:bachelor|master|phd|mba|associate|diploma|degree)(?:'s)?\\s+(?:degree|in|of)?\\s+[^\\n.]+",
        Pattern.CASE_INSENSITIVE
    );
    private static final Pattern EMAIL_PATTERN = Pattern.compile(
        "\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Z|a-z]{2,}\\b"
    );
    // Australian numbers: +61 or a leading 0, area digit, eight more digits.
    private static final Pattern PHONE_PATTERN = Pattern.compile(
        "\\b(?:\\+?61|0)[2-478](?:[ -]?[0-9]){8}\\b"
    );
    private static final Map<String, Pattern> EXPERIENCE_LEVELS = new LinkedHashMap<>();
    private static final List<String> JOB_TYPES = List.of(
        "full-time", "part-time", "contract", "temporary", "internship", "freelance", "casual", "permanent"
    );
    private static final List<String> REMOTE_KEYWORDS = List.of(
        "remote", "work from home", "wfh", "telecommute", "virtual", "hybrid", "flexible location"
    );

    static {
        EXPERIENCE_LEVELS.put("Entry Level", Pattern.compile(
            "\\b(?:entry[- ]level|junior|graduate|0-2 years|early career)\\b", Pattern.CASE_INSENSITIVE));
        EXPERIENCE_LEVELS.put("Mid Level", Pattern.compile(
            "\\b(?:mid[- ]level|intermediate|2-5 years)\\b", Pattern.CASE_INSENSITIVE));
        EXPERIENCE_LEVELS.put("Senior Level", Pattern.compile(
            "\\b(?:senior|lead|5\\+ years|experienced)\\b", Pattern.CASE_INSENSITIVE));
        EXPERIENCE_LEVELS.put("Executive", Pattern.compile(
            "\\b(?:executive|director|c-level|vp)\\b", Pattern.CASE_INSENSITIVE));
    }

    /**
     * Text of the subtree with a line break after every block element, so line-bounded
     * patterns stop at element boundaries. Script and style bodies are not text nodes and drop out.
     */
    public String pageText(Element root) {
        if (root == null) {
            return "";
        }
        StringBuilder out = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode textNode) {
                    out.append(textNode.getWholeText());
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && (element.isBlock() || "br".equals(element.normalName()))) {
                    out.append('\n');
                }
            }
        }, root);
        return out.toString();
    }

    public String salary(String pageText) {
        return firstMatch(SALARY_PATTERN, pageText, 0);
    }

    public String deadline(String pageText) {
        String value = firstMatch(DEADLINE_PATTERN, pageText, 1);
        return value == null ? null : value.trim();
    }

    public String education(String pageText) {
        String value = firstMatch(EDUCATION_PATTERN, pageText, 0);
        return value == null ? null : value.trim();
    }

    public String experienceLevel(String pageText) {
        if (pageText == null) {
            return null;
        }
        for (Map.Entry<String, Pattern> level : EXPERIENCE_LEVELS.entrySet()) {
            if (level.getValue().matcher(pageText).find()) {
                return level.getKey();
            }
        }
        return null;
    }

    /**
     * @return the first known job type mentioned in {@code text}, title-cased ("Full-Time"), or null
     */
    public String jobType(String text) {
        if (text == null) {
            return null;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (String jobType : JOB_TYPES) {
            if (lower.contains(jobType)) {
                return titleCase(jobType);
            }
        }
        return null;
    }

    public boolean mentionsRemoteWork(String pageText) {
        if (pageText == null) {
            return false;
        }
        String lower = pageText.toLowerCase(Locale.ROOT);
        for (String keyword : REMOTE_KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return email and phone keys for whichever were found, or null when neither was
     */
    public Map<String, String> contactInfo(String pageText) {
        Map<String, String> contact = new LinkedHashMap<>();
        String email = firstMatch(EMAIL_PATTERN, pageText, 0);
        if (email != null) {
            contact.put("email", email);
        }
        String phone = firstMatch(PHONE_PATTERN, pageText, 0);
        if (phone != null) {
            contact.put("phone", phone);
        }
        return contact.isEmpty() ? null : contact;
    }

    private String firstMatch(Pattern pattern, String text, int group) {
        if (text == null || text.isEmpty()) {
            return null;
        }
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(group) : null;
    }

    private String titleCase(String value) {
        StringBuilder out = new StringBuilder(value.length());
        boolean capitalizeNext = true;
        for (char c : value.toCharArray()) {
            out.append(capitalizeNext ? Character.toUpperCase(c) : c);
            capitalizeNext = !Character.isLetter(c);
        }
        return out.toString();
    }
}
