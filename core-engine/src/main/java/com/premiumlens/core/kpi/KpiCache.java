package com.premiumlens.core.kpi;

import com.premiumlens.core.model.FilterState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Bounded least-recently-used memo for KPI computations.
 *
 * <p>
 * Entries are keyed by {@code (recordSetVersion, filterState, scope, window)}.
 * The caller bumps {@code recordSetVersion} whenever the underlying records
 * change, so stale entries are never hit and age out of the LRU order.
 * {@code scope} names what was computed (e.g. a KPI key or
 * {@code "all"}) and {@code window} the week range or view it covers.
 * </p>
 *
 * <p>
 * Thread-safe: every access synchronizes on the cache. The supplier runs
 * while the lock is held.
 * </p>
 *
 * @param <V> cached value type
 * @since 1.0.0
 */
public class KpiCache<V> {

    private static final Logger LOG = LoggerFactory.getLogger(KpiCache.class);

    private final int maxEntries;
    private final Map<CacheKey, V> entries;
    private long hits;
    private long misses;

    /**
     * @param maxEntries capacity, at least 1
     * @throws IllegalArgumentException if {@code maxEntries < 1}
     */
    public KpiCache(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1, got: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<CacheKey, V> eldest) {
                return size() > KpiCache.this.maxEntries;
            }
        };
    }

    /**
     * Return the cached value for the key, computing and storing it on a miss.
     *
     * @param recordSetVersion version of the record set the value derives from
     * @param filterState      filter the value was computed under
     * @param scope            what was computed
     * @param window           period the value covers
     * @param supplier         computes the value on a miss; must not return
     *                         {@code null}
     * @return cached or freshly computed value
     */
    public synchronized V get(long recordSetVersion, FilterState filterState, String scope, String window,
            Supplier<? extends V> supplier) {
        Objects.requireNonNull(filterState, "FilterState must not be null");
        Objects.requireNonNull(scope, "Scope must not be null");
        Objects.requireNonNull(window, "Window must not be null");
        Objects.requireNonNull(supplier, "Supplier must not be null");

        CacheKey key = new CacheKey(recordSetVersion, filterState, scope, window);
        V cached = entries.get(key);
        if (cached != null) {
            hits++;
            return cached;
        }
        misses++;
        V value = Objects.requireNonNull(supplier.get(), "Cached value must not be null");
        entries.put(key, value);
        LOG.trace("Cache miss for {}, {} entr(y/ies) held", key, entries.size());
        return value;
    }

    public synchronized void clear() {
        entries.clear();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long getHits() {
        return hits;
    }

    public synchronized long getMisses() {
        return misses;
    }

    public int getMaxEntries() {
        return maxEntries;
    }

    @Override
    public synchronized String toString() {
        return "KpiCache{size=" + entries.size() + ", maxEntries=" + maxEntries + ", hits=" + hits
                + ", misses=" + misses + '}';
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static final class CacheKey {
        private final long recordSetVersion;
        private final FilterState filterState;
        private final String scope;
        private final String window;

        CacheKey(long recordSetVersion, FilterState filterState, String scope, String window) {
            this.recordSetVersion = recordSetVersion;
            this.filterState = filterState;
            this.scope = scope;
            this.window = window;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof CacheKey that))
                return false;
            return recordSetVersion == that.recordSetVersion
                    && filterState.equals(that.filterState)
                    && scope.equals(that.scope)
                    && window.equals(that.window);
        }

        @Override
        public int hashCode() {
            return Objects.hash(recordSetVersion, filterState, scope, window);
        }

        @Override
        public String toString() {
            return "(v" + recordSetVersion + ", " + scope + ", " + window + ")";
        }
    }
}
