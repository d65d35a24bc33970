package com.tradeexecutor.command;

/** Point-in-time pipeline counters for the status surface and execution snapshots. */
public record QueueStats(
        int queued,
        int capacity,
        int processing,
        long completed,
        long failed,
        long cancelled,
        int rateLimitPermitsAvailable) {}
