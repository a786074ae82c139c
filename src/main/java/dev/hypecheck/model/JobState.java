package dev.hypecheck.model;

public enum JobState {
    QUEUED,
    ACTIVE,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
