package com.hydralog.backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * application.yml:
 * app.logging.cache.*
 */
@ConfigurationProperties(prefix = "app.logging.cache")
public class SummaryCacheProperties {

    public enum StoreType { FILE, MEMORY }

    /** file = survives restarts, memory = Caffeine only */
    private StoreType store = StoreType.FILE;

    /** base directory of the file store */
    private String baseDir = "./data/kv";

    /** upper bound on entries held by the memory store */
    private long memoryMaxEntries = 10_000;

    /** per-medication ring size for recent/completed timestamps */
    private int ringSize = 8;

    // ===== getters/setters =====
    public StoreType getStore() { return store; }
    public void setStore(StoreType store) { this.store = store; }

    public String getBaseDir() { return baseDir; }
    public void setBaseDir(String baseDir) { this.baseDir = baseDir; }

    public long getMemoryMaxEntries() { return memoryMaxEntries; }
    public void setMemoryMaxEntries(long memoryMaxEntries) { this.memoryMaxEntries = memoryMaxEntries; }

    public int getRingSize() { return ringSize; }
    public void setRingSize(int ringSize) { this.ringSize = ringSize; }
}
