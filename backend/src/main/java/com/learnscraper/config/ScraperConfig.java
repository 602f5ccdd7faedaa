package com.learnscraper.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.learnscraper.scrape.asset.AssetStore;
import com.learnscraper.scrape.asset.FileSystemAssetStore;
import com.learnscraper.scrape.http.DocumentFetcher;
import com.learnscraper.scrape.http.HttpDocumentFetcher;
import com.learnscraper.scrape.http.PoliteHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class ScraperConfig {

    @Bean(name = "httpExecutor", destroyMethod = "shutdown")
    public ExecutorService httpExecutor(ScraperProperties properties) {
        int size = Math.max(2, properties.getCrawl().getArticleConcurrency() * 2);
        return Executors.newFixedThreadPool(size);
    }

    @Bean(name = "articleExecutor", destroyMethod = "shutdown")
    public ExecutorService articleExecutor(ScraperProperties properties) {
        return Executors.newFixedThreadPool(properties.getCrawl().getArticleConcurrency());
    }

    @Bean
    public DocumentFetcher documentFetcher(ScraperProperties properties, PoliteHttpClient httpClient) {
        if (properties.getFetch().isRequireJavascript()) {
            throw new ScraperConfigurationException(
                "scraper.fetch.require-javascript is enabled but no JavaScript-rendering fetcher is available"
            );
        }
        return new HttpDocumentFetcher(httpClient);
    }

    @Bean
    public AssetStore assetStore(ScraperProperties properties) {
        return new FileSystemAssetStore(Path.of(properties.getOutput().getImagesDir()));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
