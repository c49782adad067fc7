package de.mirkosertic.nlpquery;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded result cache keyed by a fingerprint of query, language and user.
 *
 * <p>Entries are evicted in insertion order once the cache is full and expire by TTL, checked on
 * lookup. Concurrent misses on the same key both compute and both write; the last write wins.</p>
 */
public class ResultCache {

    private static final Logger logger = LoggerFactory.getLogger(ResultCache.class);

    private record Entry(NlpProcessingResult result, Instant insertedAt) {
    }

    private final Clock clock;
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong evictions = new AtomicLong();

    private Duration ttl;
    private int maxSize;

    public ResultCache(final Duration ttl, final int maxSize, final Clock clock) {
        this.ttl = ttl;
        this.maxSize = maxSize;
        this.clock = clock;
    }

    /**
     * SHA-256 over query, language code and user id, hex encoded.
     */
    public static String fingerprint(final String query, final Language language, final @Nullable String userId) {
        try {
            final MessageDigest digest = MessageDigest.getInstance("SHA-256");
            digest.update(query.getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update(language.code().getBytes(StandardCharsets.UTF_8));
            digest.update((byte) 0);
            digest.update((userId == null ? "" : userId).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest.digest());
        } catch (final NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public synchronized Optional<NlpProcessingResult> get(final String key) {
        final Entry entry = entries.get(key);
        if (entry == null) {
            misses.incrementAndGet();
            return Optional.empty();
        }
        if (isExpired(entry)) {
            entries.remove(key);
            misses.incrementAndGet();
            logger.debug("Cache entry {} expired", key);
            return Optional.empty();
        }
        hits.incrementAndGet();
        return Optional.of(entry.result());
    }

    public synchronized void put(final String key, final NlpProcessingResult result) {
        entries.put(key, new Entry(result, clock.instant()));
        trimToSize();
    }

    private boolean isExpired(final Entry entry) {
        return entry.insertedAt().plus(ttl).isBefore(clock.instant());
    }

    private void trimToSize() {
        final Iterator<Map.Entry<String, Entry>> iterator = entries.entrySet().iterator();
        while (entries.size() > maxSize && iterator.hasNext()) {
            iterator.next();
            iterator.remove();
            evictions.incrementAndGet();
        }
    }

    /**
     * Change the bounds. A smaller size evicts the oldest entries right away.
     */
    public synchronized void reconfigure(final Duration newTtl, final int newMaxSize) {
        this.ttl = newTtl;
        this.maxSize = newMaxSize;
        trimToSize();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
        hits.set(0);
        misses.set(0);
        evictions.set(0);
    }

    public synchronized CacheStatistics getStatistics() {
        final long hitCount = hits.get();
        final long lookups = hitCount + misses.get();
        return new CacheStatistics(entries.size(), maxSize, hitCount, misses.get(), evictions.get(),
                lookups == 0 ? 0.0 : (double) hitCount / lookups);
    }
}
