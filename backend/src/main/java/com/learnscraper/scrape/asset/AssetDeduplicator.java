package com.learnscraper.scrape.asset;

import com.learnscraper.scrape.http.PoliteHttpClient;
import com.learnscraper.scrape.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session-scoped image cache. Each distinct URL is fetched at most once; later lookups, including
 * lookups of URLs whose download failed, are answered from the cache.
 *
 * <p>Downloading and storing are separate steps. {@link #prefetch} only downloads, so concurrent
 * article tasks can fetch bytes in any order while the stored file name is chosen by the first
 * {@link #resolve} call, which the crawl issues in table-of-contents order.
 */
public class AssetDeduplicator {
    private static final Logger log = LoggerFactory.getLogger(AssetDeduplicator.class);
    private static final String IMAGE_ACCEPT = "image/avif,image/webp,image/*,*/*;q=0.8";
    static final String DEFAULT_EXTENSION = ".jpg";

    private final PoliteHttpClient httpClient;
    private final AssetStore assetStore;
    private final Map<String, AssetSlot> slots = new ConcurrentHashMap<>();

    public AssetDeduplicator(PoliteHttpClient httpClient, AssetStore assetStore) {
        this.httpClient = httpClient;
        this.assetStore = assetStore;
    }

    /**
     * Downloads the asset unless this session already tried. Never stores it.
     */
    public void prefetch(String url) {
        if (url == null || url.isBlank()) {
            return;
        }
        AssetSlot slot = slots.computeIfAbsent(url, ignored -> new AssetSlot());
        synchronized (slot) {
            ensureDownloaded(url, slot);
        }
    }

    /**
     * @return local path of the stored asset, or null when it could not be fetched or stored
     */
    public String resolve(String url, int chapterNumber, int articleNumber, int imageNumber) {
        if (url == null || url.isBlank()) {
            return null;
        }
        AssetSlot slot = slots.computeIfAbsent(url, ignored -> new AssetSlot());
        synchronized (slot) {
            ensureDownloaded(url, slot);
            if (!slot.stored) {
                slot.localPath = store(url, slot.download, chapterNumber, articleNumber, imageNumber);
                slot.stored = true;
                slot.download = null;
            }
            return slot.localPath;
        }
    }

    public int storedCount() {
        int count = 0;
        for (AssetSlot slot : slots.values()) {
            synchronized (slot) {
                if (slot.localPath != null) {
                    count++;
                }
            }
        }
        return count;
    }

    public void clear() {
        slots.clear();
    }

    private void ensureDownloaded(String url, AssetSlot slot) {
        if (slot.downloaded) {
            return;
        }
        HttpFetchResult result = httpClient.get(url, IMAGE_ACCEPT);
        slot.downloaded = true;
        if (result == null || !result.isSuccessful() || result.bodyBytes() == null) {
            log.warn("Image download failed for {}: {}", url, result == null ? "no response" : result.failureReason());
            return;
        }
        slot.download = result;
    }

    private String store(String url, HttpFetchResult download, int chapterNumber, int articleNumber, int imageNumber) {
        if (download == null) {
            return null;
        }
        String fileName = String.format(
            "ch%d_art%d_img%d%s",
            chapterNumber,
            articleNumber,
            imageNumber,
            extensionFor(download.contentType())
        );
        try {
            Path stored = assetStore.save(download.bodyBytes(), fileName);
            return stored.toString();
        } catch (IOException e) {
            log.warn("Could not store image {} as {}", url, fileName, e);
            return null;
        }
    }

    static String extensionFor(String contentType) {
        if (contentType == null) {
            return DEFAULT_EXTENSION;
        }
        String type = contentType.toLowerCase(Locale.ROOT);
        if (type.contains("png")) {
            return ".png";
        }
        if (type.contains("gif")) {
            return ".gif";
        }
        if (type.contains("svg")) {
            return ".svg";
        }
        if (type.contains("webp")) {
            return ".webp";
        }
        return DEFAULT_EXTENSION;
    }

    private static final class AssetSlot {
        private boolean downloaded;
        private HttpFetchResult download;
        private boolean stored;
        private String localPath;
    }
}
