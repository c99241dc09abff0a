package com.smurthy.ai.insights.service.address;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks lookup outcomes per address provider.
 */
public class ProviderHealthTracker {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthTracker.class);

    // Provider name -> Usage stats
    private final Map<String, ProviderStats> usageStats = new ConcurrentHashMap<>();

    /**
     * Records a lookup that produced an address.
     */
    public void recordSuccess(String providerName) {
        ProviderStats stats = getOrCreateStats(providerName);
        stats.recordSuccess();
        log.debug("Recorded success for {}: {}", providerName, stats.getSummary());
    }

    /**
     * Records a lookup that completed but found nothing.
     */
    public void recordMiss(String providerName) {
        ProviderStats stats = getOrCreateStats(providerName);
        stats.recordMiss();
        log.debug("Recorded miss for {}: {}", providerName, stats.getSummary());
    }

    /**
     * Records a lookup that threw.
     */
    public void recordFailure(String providerName, String reason) {
        ProviderStats stats = getOrCreateStats(providerName);
        stats.recordFailure(reason);
        log.debug("Recorded failure for {}: {}", providerName, stats.getSummary());
    }

    public ProviderStats getStats(String providerName) {
        return getOrCreateStats(providerName);
    }

    private ProviderStats getOrCreateStats(String providerName) {
        return usageStats.computeIfAbsent(providerName, ProviderStats::new);
    }

    /**
     * Outcome counters for a single provider.
     */
    public static class ProviderStats {
        private final String providerName;
        private final AtomicInteger successCount = new AtomicInteger(0);
        private final AtomicInteger missCount = new AtomicInteger(0);
        private final AtomicInteger failureCount = new AtomicInteger(0);
        private LocalDateTime lastSuccess;
        private LocalDateTime lastFailure;
        private String lastFailureReason;

        public ProviderStats(String providerName) {
            this.providerName = providerName;
        }

        public synchronized void recordSuccess() {
            successCount.incrementAndGet();
            lastSuccess = LocalDateTime.now();
        }

        public synchronized void recordMiss() {
            missCount.incrementAndGet();
        }

        public synchronized void recordFailure(String reason) {
            failureCount.incrementAndGet();
            lastFailure = LocalDateTime.now();
            lastFailureReason = reason;
        }

        public int getSuccessCount() {
            return successCount.get();
        }

        public int getMissCount() {
            return missCount.get();
        }

        public int getFailureCount() {
            return failureCount.get();
        }

        public synchronized String getLastFailureReason() {
            return lastFailureReason;
        }

        public synchronized String getSummary() {
            return String.format("%s - success: %d, miss: %d, failure: %d, last success: %s, last failure: %s (%s)",
                    providerName, successCount.get(), missCount.get(), failureCount.get(),
                    lastSuccess != null ? lastSuccess : "never",
                    lastFailure != null ? lastFailure : "never",
                    lastFailureReason != null ? lastFailureReason : "n/a");
        }
    }
}
