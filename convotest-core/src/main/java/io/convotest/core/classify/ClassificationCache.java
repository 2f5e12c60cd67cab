package io.convotest.core.classify;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class ClassificationCache {
    private static final int KEY_PREFIX_LENGTH = 150;

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final long ttlMs;
    private final int maxEntries;
    private final Clock clock;

    public ClassificationCache(long ttlMs, int maxEntries, Clock clock) {
        this.ttlMs = ttlMs;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    public static String key(String utterance) {
        String text = utterance == null ? "" : utterance;
        String prefix = text.length() > KEY_PREFIX_LENGTH ? text.substring(0, KEY_PREFIX_LENGTH) : text;
        return prefix.toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    public Optional<Classification> get(String key) {
        if (ttlMs <= 0) {
            return Optional.empty();
        }
        Entry entry = entries.get(key);
        if (entry == null) {
            return Optional.empty();
        }
        if (clock.millis() - entry.storedAt() > ttlMs) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(entry.value());
    }

    public void put(String key, Classification value) {
        if (ttlMs <= 0) {
            return;
        }
        entries.put(key, new Entry(value, clock.millis()));
        if (entries.size() > maxEntries) {
            evictExpired();
        }
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
    }

    private void evictExpired() {
        long now = clock.millis();
        entries.entrySet().removeIf(e -> now - e.getValue().storedAt() > ttlMs);
    }

    private record Entry(Classification value, long storedAt) {
    }
}
