package FSAConv.Cache;

/**
 * Snapshot of the cache counters.
 */
public record CacheStatistics(int size, int capacity, long hits, long misses) {

    public long lookups() {
        return hits + misses;
    }

    /**
     * @return hits / lookups, 0 before the first lookup
     */
    public double hitRate() {
        return lookups() == 0 ? 0.0 : (double) hits / lookups();
    }
}
