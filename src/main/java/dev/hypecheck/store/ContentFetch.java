package dev.hypecheck.store;

import dev.hypecheck.model.ContentItem;

import java.util.Optional;

/**
 * Read access to submitted stories.
 */
public interface ContentFetch {

    /**
     * @return the story, or empty when no story has this id
     * @throws RuntimeException when the store cannot be read
     */
    Optional<ContentItem> fetch(String contentId);
}
