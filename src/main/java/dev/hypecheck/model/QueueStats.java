package dev.hypecheck.model;

public record QueueStats(
        int queued,
        int active,
        int completed,
        int failed,
        int delayed,
        boolean paused) {
}
