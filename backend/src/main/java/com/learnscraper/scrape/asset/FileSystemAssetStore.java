package com.learnscraper.scrape.asset;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileSystemAssetStore implements AssetStore {
    private final Path directory;

    public FileSystemAssetStore(Path directory) {
        this.directory = directory;
    }

    @Override
    public Path save(byte[] bytes, String suggestedName) throws IOException {
        Files.createDirectories(directory);
        Path target = directory.resolve(suggestedName);
        Files.write(target, bytes);
        return target;
    }
}
