package ai.sessionkeeper.tokens;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Memoizes {@link #count(String)} of a delegate in a bounded, size-evicting Caffeine cache keyed by the SHA-256 of
 * the text, so large texts are not retained.
 */
public final class CachingTokenEstimator implements TokenEstimator {
    private static final Logger logger = LogManager.getLogger(CachingTokenEstimator.class);

    public static final int DEFAULT_CACHE_SIZE = 1000;

    public record CacheStats(long hits, long misses, long size, double hitRatePercent) {}

    private final TokenEstimator delegate;
    private final int maxSize;
    private volatile Cache<HashCode, Integer> cache;

    public CachingTokenEstimator(TokenEstimator delegate) {
        this(delegate, DEFAULT_CACHE_SIZE);
    }

    public CachingTokenEstimator(TokenEstimator delegate, int maxSize) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("cache size must be positive, got " + maxSize);
        }
        this.delegate = delegate;
        this.maxSize = maxSize;
        this.cache = newCache(maxSize);
    }

    private static Cache<HashCode, Integer> newCache(int maxSize) {
        return Caffeine.newBuilder().maximumSize(maxSize).recordStats().build();
    }

    @Override
    public int count(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        var key = Hashing.sha256().hashString(text, StandardCharsets.UTF_8);
        return cache.get(key, k -> delegate.count(text));
    }

    public TokenEstimator delegate() {
        return delegate;
    }

    public CacheStats stats() {
        var current = cache;
        current.cleanUp();
        var stats = current.stats();
        long requests = stats.requestCount();
        double rate = requests == 0 ? 0.0 : 100.0 * stats.hitCount() / requests;
        return new CacheStats(stats.hitCount(), stats.missCount(), current.estimatedSize(), rate);
    }

    /** Drops all cached counts and resets statistics. */
    public void clear() {
        logger.debug("Clearing token cache: {}", stats());
        cache = newCache(maxSize);
    }

    @Override
    public String toString() {
        return "CachingTokenEstimator[" + delegate + "]";
    }
}
