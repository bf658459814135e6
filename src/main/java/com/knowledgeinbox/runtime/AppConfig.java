package com.knowledgeinbox.runtime;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private StoreConfig store = new StoreConfig();
    private ChunkingConfig chunking = new ChunkingConfig();
    private IngestionConfig ingestion = new IngestionConfig();
    private ExtractionConfig extraction = new ExtractionConfig();
    private EmbeddingConfig embedding = new EmbeddingConfig();
    private GenerationConfig generation = new GenerationConfig();
    private QueryConfig query = new QueryConfig();

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public ChunkingConfig getChunking() {
        return chunking;
    }

    public void setChunking(ChunkingConfig chunking) {
        this.chunking = chunking == null ? new ChunkingConfig() : chunking;
    }

    public IngestionConfig getIngestion() {
        return ingestion;
    }

    public void setIngestion(IngestionConfig ingestion) {
        this.ingestion = ingestion == null ? new IngestionConfig() : ingestion;
    }

    public ExtractionConfig getExtraction() {
        return extraction;
    }

    public void setExtraction(ExtractionConfig extraction) {
        this.extraction = extraction == null ? new ExtractionConfig() : extraction;
    }

    public EmbeddingConfig getEmbedding() {
        return embedding;
    }

    public void setEmbedding(EmbeddingConfig embedding) {
        this.embedding = embedding == null ? new EmbeddingConfig() : embedding;
    }

    public GenerationConfig getGeneration() {
        return generation;
    }

    public void setGeneration(GenerationConfig generation) {
        this.generation = generation == null ? new GenerationConfig() : generation;
    }

    public QueryConfig getQuery() {
        return query;
    }

    public void setQuery(QueryConfig query) {
        this.query = query == null ? new QueryConfig() : query;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String path = ".knowledge-inbox/items.json";

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ChunkingConfig {
        private int windowSize = 500;
        private int overlap = 50;

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public int getOverlap() {
            return overlap;
        }

        public void setOverlap(int overlap) {
            this.overlap = overlap;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestionConfig {
        private int maxNoteLength = 50_000;

        public int getMaxNoteLength() {
            return maxNoteLength;
        }

        public void setMaxNoteLength(int maxNoteLength) {
            this.maxNoteLength = maxNoteLength;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ExtractionConfig {
        private int timeoutMs = 10_000;
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }

        public String getUserAgent() {
            return userAgent;
        }

        public void setUserAgent(String userAgent) {
            this.userAgent = userAgent;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EmbeddingConfig {
        private String provider = "local";
        private String endpoint = "";
        private String apiKey = "";
        private String model = "text-embedding-ada-002";
        private int dimension = 384;
        private int timeoutMs = 30_000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
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

        public int getDimension() {
            return dimension;
        }

        public void setDimension(int dimension) {
            this.dimension = dimension;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GenerationConfig {
        private String provider = "local";
        private String endpoint = "";
        private String apiKey = "";
        private String model = "gpt-35-turbo";
        private double temperature = 0.7;
        private int maxTokens = 800;
        private int timeoutMs = 60_000;

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getApiKey() {
            return apiKey;
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

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public int getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(int timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class QueryConfig {
        private int defaultMaxResults = 5;
        private int maxResultsLimit = 10;

        public int getDefaultMaxResults() {
            return defaultMaxResults;
        }

        public void setDefaultMaxResults(int defaultMaxResults) {
            this.defaultMaxResults = defaultMaxResults;
        }

        public int getMaxResultsLimit() {
            return maxResultsLimit;
        }

        public void setMaxResultsLimit(int maxResultsLimit) {
            this.maxResultsLimit = maxResultsLimit;
        }
    }
}
