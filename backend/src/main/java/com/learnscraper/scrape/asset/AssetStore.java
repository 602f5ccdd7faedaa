package com.learnscraper.scrape.asset;

import java.io.IOException;
import java.nio.file.Path;

public interface AssetStore {
    Path save(byte[] bytes, String suggestedName) throws IOException;
}
