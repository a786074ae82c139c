package dev.hypecheck.store;

import dev.hypecheck.model.ScoreResult;

/**
 * Persists scores for a story. Throws on failure.
 */
public interface ResultWriteback {

    void save(String contentId, ScoreResult result);
}
