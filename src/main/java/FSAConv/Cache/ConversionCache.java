package FSAConv.Cache;

import FSAConv.Exceptions.CacheException;
import it.unimi.dsi.fastutil.objects.Object2ObjectLinkedOpenHashMap;

/**
 * Bounded least-recently-used map from request fingerprints to conversion results.
 * <p>
 * Not thread-safe: the owning engine guards it together with its statistics.
 * Only successful results are ever stored.
 */
public class ConversionCache {

    private final int capacity;
    private final Object2ObjectLinkedOpenHashMap<Fingerprint, Object> entries = new Object2ObjectLinkedOpenHashMap<>();
    private long hits;
    private long misses;

    public ConversionCache(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("Negative cache capacity: " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * @return the cached result, or null on a miss
     * @throws CacheException if the entry is not of the expected type
     */
    public <T> T lookup(Fingerprint key, Class<T> type) {
        final Object value = entries.getAndMoveToLast(key);
        if (value == null) {
            misses++;
            return null;
        }
        if (!type.isInstance(value)) {
            entries.remove(key);
            misses++;
            throw new CacheException("Entry for " + key.operation() + " holds a "
                    + value.getClass().getSimpleName() + ", expected " + type.getSimpleName());
        }
        hits++;
        return type.cast(value);
    }

    public void store(Fingerprint key, Object value) {
        if (capacity == 0) {
            return;
        }
        entries.putAndMoveToLast(key, value);
        while (entries.size() > capacity) {
            entries.removeFirst();
        }
    }

    public boolean contains(Fingerprint key) {
        return entries.containsKey(key);
    }

    public int size() {
        return entries.size();
    }

    public void clear() {
        entries.clear();
        hits = 0;
        misses = 0;
    }

    public CacheStatistics statistics() {
        return new CacheStatistics(entries.size(), capacity, hits, misses);
    }
}
