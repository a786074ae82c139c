package dev.hypecheck.support;

import dev.hypecheck.model.ContentItem;
import dev.hypecheck.model.ScoreResult;
import dev.hypecheck.store.ContentFetch;
import dev.hypecheck.store.ResultWriteback;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Story store backed by maps. {@code onFetch} runs inside every fetch so tests
 * can block or fail a worker mid-job.
 */
public class InMemoryStoryStore implements ContentFetch, ResultWriteback {

    public final Map<String, ContentItem> items = new ConcurrentHashMap<>();
    public final Map<String, ScoreResult> saved = new ConcurrentHashMap<>();
    public final List<String> fetched = new CopyOnWriteArrayList<>();
    public volatile Consumer<String> onFetch = id -> {
    };
    public volatile boolean failWrites;

    public InMemoryStoryStore add(String id, String title, String body) {
        items.put(id, ContentItem.builder().id(id).title(title).body(body).build());
        return this;
    }

    @Override
    public Optional<ContentItem> fetch(String contentId) {
        fetched.add(contentId);
        onFetch.accept(contentId);
        return Optional.ofNullable(items.get(contentId));
    }

    @Override
    public void save(String contentId, ScoreResult result) {
        if (failWrites) {
            throw new IllegalStateException("database is locked");
        }
        saved.put(contentId, result);
    }
}
