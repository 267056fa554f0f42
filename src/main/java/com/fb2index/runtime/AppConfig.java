package com.fb2index.runtime;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private IngestConfig ingest = new IngestConfig();
    private StoreConfig store = new StoreConfig();
    private CacheConfig cache = new CacheConfig();

    public IngestConfig getIngest() {
        return ingest;
    }

    public void setIngest(IngestConfig ingest) {
        this.ingest = ingest == null ? new IngestConfig() : ingest;
    }

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store == null ? new StoreConfig() : store;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache == null ? new CacheConfig() : cache;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class IngestConfig {
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private int queueCapacity = 0;
        private int channelCapacity = 0;
        private List<String> languages = new ArrayList<>();
        private boolean recursive = false;
        private int headerLimitBytes = 16 * 1024;

        public int getParallelism() {
            return parallelism;
        }

        public void setParallelism(int parallelism) {
            this.parallelism = parallelism;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getChannelCapacity() {
            return channelCapacity;
        }

        public void setChannelCapacity(int channelCapacity) {
            this.channelCapacity = channelCapacity;
        }

        public List<String> getLanguages() {
            return languages;
        }

        public void setLanguages(List<String> languages) {
            this.languages = languages == null ? new ArrayList<>() : languages;
        }

        public boolean isRecursive() {
            return recursive;
        }

        public void setRecursive(boolean recursive) {
            this.recursive = recursive;
        }

        public int getHeaderLimitBytes() {
            return headerLimitBytes;
        }

        public void setHeaderLimitBytes(int headerLimitBytes) {
            this.headerLimitBytes = headerLimitBytes;
        }

        public int effectiveQueueCapacity() {
            return queueCapacity > 0 ? queueCapacity : Math.max(1, parallelism);
        }

        public int effectiveChannelCapacity() {
            return channelCapacity > 0 ? channelCapacity : Math.max(1, parallelism);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class StoreConfig {
        private String sqlitePath;

        public String getSqlitePath() {
            return sqlitePath;
        }

        public void setSqlitePath(String sqlitePath) {
            this.sqlitePath = sqlitePath;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CacheConfig {
        private long ttlMs = 60_000;
        private long sweepIntervalMs = 10_000;

        public long getTtlMs() {
            return ttlMs;
        }

        public void setTtlMs(long ttlMs) {
            this.ttlMs = ttlMs;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }
    }
}
