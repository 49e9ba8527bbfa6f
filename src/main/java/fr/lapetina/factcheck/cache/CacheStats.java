package fr.lapetina.factcheck.cache;

/**
 * Point-in-time cache counters.
 *
 * @param hitRate hits / (hits + misses) as a percentage, 0 when nothing was looked up
 */
public record CacheStats(int size, long hits, long misses, long evictions, double hitRate) {

    public static CacheStats of(int size, long hits, long misses, long evictions) {
        long lookups = hits + misses;
        double rate = lookups > 0 ? (hits * 100.0) / lookups : 0.0;
        return new CacheStats(size, hits, misses, evictions, rate);
    }
}
