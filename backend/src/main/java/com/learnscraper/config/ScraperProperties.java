package com.learnscraper.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "scraper")
public class ScraperProperties {
    private static final String DEFAULT_USER_AGENT = "learn-scraper/0.1 (+contact)";

    private String userAgent;
    private int requestTimeoutSeconds = 30;
    private int requestMaxRetries = 1;
    private int requestRetryBaseDelayMs = 500;
    private int requestRetryMaxDelayMs = 5000;
    private Fetch fetch = new Fetch();
    private Crawl crawl = new Crawl();
    private Output output = new Output();
    private Cli cli = new Cli();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getRequestTimeoutSeconds() {
        return Math.max(1, requestTimeoutSeconds);
    }

    public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
        this.requestTimeoutSeconds = Math.max(1, requestTimeoutSeconds);
    }

    public int getRequestMaxRetries() {
        return Math.max(0, requestMaxRetries);
    }

    public void setRequestMaxRetries(int requestMaxRetries) {
        this.requestMaxRetries = Math.max(0, requestMaxRetries);
    }

    public int getRequestRetryBaseDelayMs() {
        return Math.max(0, requestRetryBaseDelayMs);
    }

    public void setRequestRetryBaseDelayMs(int requestRetryBaseDelayMs) {
        this.requestRetryBaseDelayMs = Math.max(0, requestRetryBaseDelayMs);
    }

    public int getRequestRetryMaxDelayMs() {
        return Math.max(0, requestRetryMaxDelayMs);
    }

    public void setRequestRetryMaxDelayMs(int requestRetryMaxDelayMs) {
        this.requestRetryMaxDelayMs = Math.max(0, requestRetryMaxDelayMs);
    }

    public Fetch getFetch() {
        return fetch;
    }

    public void setFetch(Fetch fetch) {
        this.fetch = fetch;
    }

    public Crawl getCrawl() {
        return crawl;
    }

    public void setCrawl(Crawl crawl) {
        this.crawl = crawl;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Cli getCli() {
        return cli;
    }

    public void setCli(Cli cli) {
        this.cli = cli;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Fetch {
        private int waitHintSeconds = 5;
        private boolean requireJavascript = false;

        public int getWaitHintSeconds() {
            return Math.max(0, waitHintSeconds);
        }

        public void setWaitHintSeconds(int waitHintSeconds) {
            this.waitHintSeconds = Math.max(0, waitHintSeconds);
        }

        public boolean isRequireJavascript() {
            return requireJavascript;
        }

        public void setRequireJavascript(boolean requireJavascript) {
            this.requireJavascript = requireJavascript;
        }
    }

    public static class Crawl {
        private int politenessDelayMs = 1000;
        private int articleConcurrency = 1;

        public int getPolitenessDelayMs() {
            return Math.max(0, politenessDelayMs);
        }

        public void setPolitenessDelayMs(int politenessDelayMs) {
            this.politenessDelayMs = Math.max(0, politenessDelayMs);
        }

        public int getArticleConcurrency() {
            return Math.max(1, articleConcurrency);
        }

        public void setArticleConcurrency(int articleConcurrency) {
            this.articleConcurrency = Math.max(1, articleConcurrency);
        }
    }

    public static class Output {
        private String dir = "learn_scraper_output";
        private String imagesDir = "learn_scraper_output/images";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }

        public String getImagesDir() {
            return imagesDir;
        }

        public void setImagesDir(String imagesDir) {
            this.imagesDir = imagesDir;
        }
    }

    public static class Cli {
        private boolean run;
        private String jobUrl = "";
        private String bookUrl = "";
        private String batchFile = "";
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public String getJobUrl() {
            return jobUrl;
        }

        public void setJobUrl(String jobUrl) {
            this.jobUrl = jobUrl;
        }

        public String getBookUrl() {
            return bookUrl;
        }

        public void setBookUrl(String bookUrl) {
            this.bookUrl = bookUrl;
        }

        public String getBatchFile() {
            return batchFile;
        }

        public void setBatchFile(String batchFile) {
            this.batchFile = batchFile;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }
}
