package com.okazje.scanner.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "scanner")
public class ScannerProperties {
    private static final String DEFAULT_USER_AGENT =
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";
    private static final String DEFAULT_ACCEPT_LANGUAGE = "pl-PL,pl;q=0.9,en-US;q=0.8,en;q=0.7";

    private Http http = new Http();
    private Extraction extraction = new Extraction();
    private Discovery discovery = new Discovery();
    private Scan scan = new Scan();
    private Storage storage = new Storage();
    private Classifier classifier = new Classifier();
    private Notify notify = new Notify();
    private Cli cli = new Cli();

    public Http getHttp() {
        return http;
    }

    public void setHttp(Http http) {
        this.http = http;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Discovery getDiscovery() {
        return discovery;
    }

    public void setDiscovery(Discovery discovery) {
        this.discovery = discovery;
    }

    public Scan getScan() {
        return scan;
    }

    public void setScan(Scan scan) {
        this.scan = scan;
    }

    public Storage getStorage() {
        return storage;
    }

    public void setStorage(Storage storage) {
        this.storage = storage;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public void setClassifier(Classifier classifier) {
        this.classifier = classifier;
    }

    public Notify getNotify() {
        return notify;
    }

    public void setNotify(Notify notify) {
        this.notify = notify;
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

    public static class Http {
        private String userAgent;
        private String acceptLanguage;
        private int requestTimeoutSeconds = 15;
        private int requestMaxRetries = 1;
        private int requestRetryBaseDelayMs = 500;
        private int requestRetryMaxDelayMs = 4000;
        private int perHostDelayMs = 250;

        public String getUserAgent() {
            return normalizeUserAgent(userAgent);
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = normalizeUserAgent(userAgent);
        }

        public String getAcceptLanguage() {
            if (acceptLanguage == null || acceptLanguage.isBlank()) {
                return DEFAULT_ACCEPT_LANGUAGE;
            }
            return acceptLanguage.trim();
        }

        public void setAcceptLanguage(String acceptLanguage) {
            this.acceptLanguage = acceptLanguage;
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

        public int getPerHostDelayMs() {
            return Math.max(1, perHostDelayMs);
        }

        public void setPerHostDelayMs(int perHostDelayMs) {
            this.perHostDelayMs = Math.max(1, perHostDelayMs);
        }
    }

    public static class Extraction {
        private int maxDescriptionLength = 1000;
        private int rawDescriptionLength = 500;
        private int maxImages = 5;
        private List<String> descriptionMarkers = new ArrayList<>(
            List.of("Polecam", "Sprzedam", "Oferuję", "Zapraszam", "Stan:")
        );

        public int getMaxDescriptionLength() {
            return Math.max(1, maxDescriptionLength);
        }

        public void setMaxDescriptionLength(int maxDescriptionLength) {
            this.maxDescriptionLength = Math.max(1, maxDescriptionLength);
        }

        public int getRawDescriptionLength() {
            return Math.max(1, rawDescriptionLength);
        }

        public void setRawDescriptionLength(int rawDescriptionLength) {
            this.rawDescriptionLength = Math.max(1, rawDescriptionLength);
        }

        public int getMaxImages() {
            return Math.max(0, maxImages);
        }

        public void setMaxImages(int maxImages) {
            this.maxImages = Math.max(0, maxImages);
        }

        public List<String> getDescriptionMarkers() {
            return descriptionMarkers == null ? List.of() : descriptionMarkers;
        }

        public void setDescriptionMarkers(List<String> descriptionMarkers) {
            this.descriptionMarkers = descriptionMarkers;
        }
    }

    public static class Discovery {
        private int maxResults = 20;
        private int maxTitleLength = 100;
        private String sprzedajemyBaseUrl = "https://sprzedajemy.pl";
        private String gratkaBaseUrl = "https://gratka.pl";

        public int getMaxResults() {
            return Math.max(1, maxResults);
        }

        public void setMaxResults(int maxResults) {
            this.maxResults = Math.max(1, maxResults);
        }

        public int getMaxTitleLength() {
            return Math.max(3, maxTitleLength);
        }

        public void setMaxTitleLength(int maxTitleLength) {
            this.maxTitleLength = Math.max(3, maxTitleLength);
        }

        public String getSprzedajemyBaseUrl() {
            return trimTrailingSlash(sprzedajemyBaseUrl);
        }

        public void setSprzedajemyBaseUrl(String sprzedajemyBaseUrl) {
            this.sprzedajemyBaseUrl = sprzedajemyBaseUrl;
        }

        public String getGratkaBaseUrl() {
            return trimTrailingSlash(gratkaBaseUrl);
        }

        public void setGratkaBaseUrl(String gratkaBaseUrl) {
            this.gratkaBaseUrl = gratkaBaseUrl;
        }
    }

    public static class Scan {
        private boolean enabled = true;
        private String destination = "";
        private Duration interval = Duration.ofMinutes(30);
        private long keywordDelayMs = 2000;
        private BigDecimal maxPrice = BigDecimal.valueOf(550);
        private int minMarginPercent = 200;
        private int topK = 10;
        private List<String> defaultKeywords = new ArrayList<>(List.of(
            "komiks PRL",
            "Relax komiks",
            "Kapitan Żbik",
            "figurka Ćmielów",
            "porcelana PRL",
            "zegarek Błonie",
            "zegarek Rakieta",
            "zegarek Wostok",
            "obraz olejny",
            "szabla",
            "bagnet",
            "Lem pierwsze wydanie",
            "Sapkowski wydanie",
            "ikona prawosławna",
            "sztućce srebrne",
            "kordelas"
        ));

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getDestination() {
            return destination == null ? "" : destination.trim();
        }

        public void setDestination(String destination) {
            this.destination = destination;
        }

        public Duration getInterval() {
            return interval == null || interval.isNegative() || interval.isZero() ? Duration.ofMinutes(30) : interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public long getKeywordDelayMs() {
            return Math.max(0, keywordDelayMs);
        }

        public void setKeywordDelayMs(long keywordDelayMs) {
            this.keywordDelayMs = Math.max(0, keywordDelayMs);
        }

        public BigDecimal getMaxPrice() {
            if (maxPrice == null || maxPrice.signum() < 0) {
                return BigDecimal.ZERO;
            }
            return maxPrice;
        }

        public void setMaxPrice(BigDecimal maxPrice) {
            this.maxPrice = maxPrice;
        }

        public int getMinMarginPercent() {
            return Math.max(0, minMarginPercent);
        }

        public void setMinMarginPercent(int minMarginPercent) {
            this.minMarginPercent = Math.max(0, minMarginPercent);
        }

        public int getTopK() {
            return Math.max(1, topK);
        }

        public void setTopK(int topK) {
            this.topK = Math.max(1, topK);
        }

        public List<String> getDefaultKeywords() {
            return defaultKeywords == null ? List.of() : defaultKeywords;
        }

        public void setDefaultKeywords(List<String> defaultKeywords) {
            this.defaultKeywords = defaultKeywords;
        }
    }

    public static class Storage {
        private String seenFile = "data/okazje_data.json";
        private String keywordsFile = "data/keywords.json";
        private int seenHighWaterMark = 5000;
        private int seenPruneTarget = 3000;

        public String getSeenFile() {
            return seenFile;
        }

        public void setSeenFile(String seenFile) {
            this.seenFile = seenFile;
        }

        public String getKeywordsFile() {
            return keywordsFile;
        }

        public void setKeywordsFile(String keywordsFile) {
            this.keywordsFile = keywordsFile;
        }

        public int getSeenHighWaterMark() {
            return Math.max(1, seenHighWaterMark);
        }

        public void setSeenHighWaterMark(int seenHighWaterMark) {
            this.seenHighWaterMark = Math.max(1, seenHighWaterMark);
        }

        public int getSeenPruneTarget() {
            return Math.max(0, Math.min(seenPruneTarget, getSeenHighWaterMark()));
        }

        public void setSeenPruneTarget(int seenPruneTarget) {
            this.seenPruneTarget = Math.max(0, seenPruneTarget);
        }
    }

    public static class Classifier {
        private String apiKey = "";
        private String model = "claude-sonnet-4-20250514";
        private int maxTokens = 600;
        private int timeoutSeconds = 60;

        public String getApiKey() {
            return apiKey == null ? "" : apiKey.trim();
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public int getMaxTokens() {
            return Math.max(1, maxTokens);
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = Math.max(1, maxTokens);
        }

        public int getTimeoutSeconds() {
            return Math.max(1, timeoutSeconds);
        }

        public void setTimeoutSeconds(int timeoutSeconds) {
            this.timeoutSeconds = Math.max(1, timeoutSeconds);
        }
    }

    public static class Notify {
        private Telegram telegram = new Telegram();

        public Telegram getTelegram() {
            return telegram;
        }

        public void setTelegram(Telegram telegram) {
            this.telegram = telegram;
        }
    }

    public static class Telegram {
        private boolean enabled;
        private String botToken = "";
        private String apiBaseUrl = "https://api.telegram.org";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getBotToken() {
            return botToken == null ? "" : botToken.trim();
        }

        public void setBotToken(String botToken) {
            this.botToken = botToken;
        }

        public String getApiBaseUrl() {
            return trimTrailingSlash(apiBaseUrl);
        }

        public void setApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
        }
    }

    public static class Cli {
        private boolean run;
        private boolean exitAfterRun = true;

        public boolean isRun() {
            return run;
        }

        public void setRun(boolean run) {
            this.run = run;
        }

        public boolean isExitAfterRun() {
            return exitAfterRun;
        }

        public void setExitAfterRun(boolean exitAfterRun) {
            this.exitAfterRun = exitAfterRun;
        }
    }

    private static String trimTrailingSlash(String value) {
        if (value == null) {
            return "";
        }
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
