package io.specqueue.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public final class QueueStatistics {
    @JsonProperty("totalQueued")
    @JsonAlias("total_queued")
    private long totalQueued;
    @JsonProperty("totalCompleted")
    @JsonAlias("total_completed")
    private long totalCompleted;
    @JsonProperty("totalFailed")
    @JsonAlias("total_failed")
    private long totalFailed;
    @JsonProperty("lastProcessedAt")
    @JsonAlias("last_processed_at")
    private Instant lastProcessedAt;
    @JsonProperty("lastLoadAt")
    @JsonAlias("last_load_at")
    private Instant lastLoadAt;

    public QueueStatistics() {
    }

    public QueueStatistics(long totalQueued, long totalCompleted, long totalFailed) {
        this.totalQueued = Math.max(0L, totalQueued);
        this.totalCompleted = Math.max(0L, totalCompleted);
        this.totalFailed = Math.max(0L, totalFailed);
    }

    public long totalQueued() {
        return totalQueued;
    }

    public long totalCompleted() {
        return totalCompleted;
    }

    public long totalFailed() {
        return totalFailed;
    }

    public Instant lastProcessedAt() {
        return lastProcessedAt;
    }

    public Instant lastLoadAt() {
        return lastLoadAt;
    }

    public void recordQueued(int count) {
        totalQueued += count;
    }

    public void recordUnloaded(int count) {
        totalQueued = Math.max(0L, totalQueued - count);
    }

    public void recordCompleted(Instant at) {
        totalCompleted++;
        lastProcessedAt = at;
    }

    public void recordFailed(Instant at) {
        totalFailed++;
        lastProcessedAt = at;
    }

    public void recordLoad(Instant at) {
        lastLoadAt = at;
    }
}
