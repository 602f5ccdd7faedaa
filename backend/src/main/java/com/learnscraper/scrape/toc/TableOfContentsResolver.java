package com.learnscraper.scrape.toc;

import com.learnscraper.scrape.book.BookFieldRules;
import com.learnscraper.scrape.extract.FieldExtractor;
import com.learnscraper.scrape.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Discovers the chapter/article hierarchy of a book landing page.
 *
 * <p>Chapter-like elements with an adjacent or nested list of links become chapters. When none
 * are found, every same-origin link of the TOC container is gathered into one "Main Content"
 * chapter. Articles are then de-duplicated per chapter by absolute URL, first occurrence wins,
 * and chapters left without articles are dropped.
 */
@Component
public class TableOfContentsResolver {
    private static final Logger log = LoggerFactory.getLogger(TableOfContentsResolver.class);
    static final String FALLBACK_CHAPTER_TITLE = "Main Content";
    private static final Set<String> CHAPTER_TAGS = Set.of("h2", "h3", "h4", "div", "li");
    private static final Pattern CHAPTER_CLASS = Pattern.compile("chapter|section|heading", Pattern.CASE_INSENSITIVE);

    private final FieldExtractor fieldExtractor;

    public TableOfContentsResolver(FieldExtractor fieldExtractor) {
        this.fieldExtractor = fieldExtractor;
    }

    public List<TocEntry> resolve(Document document, String pageUrl) {
        if (document == null) {
            return List.of();
        }
        Element container = locateContainer(document);
        List<TocEntry> chapters = chaptersFromHeadings(container);
        if (chapters.isEmpty()) {
            chapters = flattenedChapter(container, pageUrl);
        }
        List<TocEntry> resolved = new ArrayList<>();
        for (TocEntry chapter : chapters) {
            List<TocEntry> articles = dedupeByUrl(chapter.children());
            if (!articles.isEmpty()) {
                resolved.add(new TocEntry(chapter.title(), chapter.url(), articles));
            }
        }
        log.debug("Resolved {} chapters from {}", resolved.size(), pageUrl);
        return resolved;
    }

    Element locateContainer(Document document) {
        Element container = fieldExtractor.locate(document, BookFieldRules.TOC_CONTAINER);
        if (container != null) {
            return container;
        }
        Element nav = document.selectFirst("nav");
        if (nav != null) {
            return nav;
        }
        Element aside = document.selectFirst("aside");
        return aside != null ? aside : document;
    }

    private List<TocEntry> chaptersFromHeadings(Element container) {
        List<ChapterCandidate> candidates = new ArrayList<>();
        for (Element element : container.getAllElements()) {
            if (element == container || !isChapterLike(element)) {
                continue;
            }
            ChapterCandidate candidate = candidate(element);
            if (candidate != null) {
                candidates.add(candidate);
            }
        }

        // Innermost first, so a wrapper never swallows the chapters it contains.
        Deque<ChapterCandidate> accepted = new ArrayDeque<>();
        for (int i = candidates.size() - 1; i >= 0; i--) {
            ChapterCandidate candidate = candidates.get(i);
            if (!listClaimed(candidate, accepted)) {
                accepted.addFirst(candidate);
            }
        }

        List<TocEntry> chapters = new ArrayList<>();
        for (ChapterCandidate candidate : accepted) {
            chapters.add(new TocEntry(candidate.title(), null, candidate.articles()));
        }
        return chapters;
    }

    private ChapterCandidate candidate(Element element) {
        String title = chapterTitle(element);
        if (title.isEmpty()) {
            return null;
        }
        Element list = articleList(element);
        if (list == null) {
            return null;
        }
        List<TocEntry> articles = new ArrayList<>();
        for (Element link : list.select("a[href]")) {
            String url = link.absUrl("href");
            String linkTitle = link.text();
            if (!linkTitle.isEmpty() && !url.isEmpty()) {
                articles.add(TocEntry.article(linkTitle, url));
            }
        }
        return articles.isEmpty() ? null : new ChapterCandidate(element, title, list, articles);
    }

    // A wrapper's list is claimed when it is a nested chapter's list or sits inside a nested chapter.
    private boolean listClaimed(ChapterCandidate candidate, Deque<ChapterCandidate> accepted) {
        for (ChapterCandidate inner : accepted) {
            if (!inner.element().parents().contains(candidate.element())) {
                continue;
            }
            if (inner.list() == candidate.list() || candidate.list().parents().contains(inner.element())) {
                return true;
            }
        }
        return false;
    }

    private List<TocEntry> flattenedChapter(Element container, String pageUrl) {
        List<TocEntry> articles = new ArrayList<>();
        for (Element link : container.select("a[href]")) {
            String href = link.attr("href");
            String title = link.text();
            String url = link.absUrl("href");
            if (title.isEmpty() || url.isEmpty() || UrlUtils.isFragmentOnly(href)) {
                continue;
            }
            if (!UrlUtils.sameOrigin(url, pageUrl)) {
                continue;
            }
            articles.add(TocEntry.article(title, url));
        }
        if (articles.isEmpty()) {
            return List.of();
        }
        return List.of(new TocEntry(FALLBACK_CHAPTER_TITLE, null, articles));
    }

    private boolean isChapterLike(Element element) {
        if (!CHAPTER_TAGS.contains(element.normalName())) {
            return false;
        }
        for (String className : element.classNames()) {
            if (CHAPTER_CLASS.matcher(className).find()) {
                return true;
            }
        }
        return false;
    }

    // Title text without the article list a chapter element may wrap.
    private String chapterTitle(Element chapter) {
        Element copy = chapter.clone();
        copy.select("ul, ol").remove();
        return copy.text();
    }

    private Element articleList(Element chapter) {
        Element next = chapter.nextElementSibling();
        if (next != null && ("ul".equals(next.normalName()) || "ol".equals(next.normalName()))) {
            return next;
        }
        return chapter.selectFirst("ul, ol");
    }

    private List<TocEntry> dedupeByUrl(List<TocEntry> articles) {
        Map<String, TocEntry> unique = new LinkedHashMap<>();
        for (TocEntry article : articles) {
            unique.putIfAbsent(article.url(), article);
        }
        return new ArrayList<>(unique.values());
    }

    private record ChapterCandidate(Element element, String title, Element list, List<TocEntry> articles) {
    }
}
