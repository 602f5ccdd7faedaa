package com.learnscraper.scrape.book;

import com.learnscraper.scrape.asset.AssetDeduplicator;
import com.learnscraper.scrape.model.Image;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

@Component
public class ImageCollector {
    private static final int MAX_CAPTION_LENGTH = 200;
    private static final Set<String> CAPTION_SIBLING_TAGS = Set.of("p", "div", "span");

    /**
     * Images are numbered by position among all {@code img} elements of the content, so skipping
     * one without a source does not shift the numbers of the rest.
     */
    public List<Image> collect(
        Element contentRoot,
        int chapterNumber,
        int articleNumber,
        AssetDeduplicator assets
    ) {
        List<Image> images = new ArrayList<>();
        if (contentRoot == null) {
            return images;
        }
        int imageNumber = 0;
        for (Element img : contentRoot.select("img")) {
            imageNumber++;
            String sourceUrl = sourceUrl(img);
            if (sourceUrl == null) {
                continue;
            }
            String localPath = assets.resolve(sourceUrl, chapterNumber, articleNumber, imageNumber);
            images.add(new Image(
                sourceUrl,
                localPath,
                blankToNull(img.attr("alt")),
                blankToNull(img.attr("title")),
                caption(img)
            ));
        }
        return images;
    }

    /**
     * Downloads every image source of the content without naming or storing anything yet.
     */
    public void prefetch(Element contentRoot, AssetDeduplicator assets) {
        if (contentRoot == null) {
            return;
        }
        for (Element img : contentRoot.select("img")) {
            String sourceUrl = sourceUrl(img);
            if (sourceUrl != null) {
                assets.prefetch(sourceUrl);
            }
        }
    }

    private String sourceUrl(Element img) {
        String attribute = !img.attr("src").isBlank() ? "src" : "data-src";
        String raw = img.attr(attribute).trim();
        if (raw.isEmpty()) {
            return null;
        }
        String absolute = img.absUrl(attribute);
        return absolute.isEmpty() ? raw : absolute;
    }

    String caption(Element img) {
        Element parent = img.parent();
        if (parent != null && "figure".equals(parent.normalName())) {
            Element figcaption = parent.selectFirst("figcaption");
            if (figcaption != null) {
                return blankToNull(figcaption.text());
            }
        }
        Element next = img.nextElementSibling();
        if (next != null && CAPTION_SIBLING_TAGS.contains(next.normalName())) {
            String text = next.text();
            if (text.length() < MAX_CAPTION_LENGTH) {
                return blankToNull(text);
            }
        }
        return null;
    }

    private String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
