package at.sv.milkyway.time;

import at.sv.milkyway.Location;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.ZoneId;

/**
 * Memoizes zone lookups per location, rounded to two decimals. The cache is owned by the caller.
 */
public final class CachingTimezoneResolver implements TimezoneResolver {

    private static final int DEFAULT_MAXIMUM_SIZE = 1_000;

    private final TimezoneResolver delegate;
    private final Cache<String, ZoneId> cache;

    public CachingTimezoneResolver(TimezoneResolver delegate, Cache<String, ZoneId> cache) {
        this.delegate = delegate;
        this.cache = cache;
    }

    public static CachingTimezoneResolver withDefaultCache(TimezoneResolver delegate) {
        return new CachingTimezoneResolver(delegate, Caffeine.newBuilder()
                                                             .maximumSize(DEFAULT_MAXIMUM_SIZE)
                                                             .build());
    }

    @Override
    public ZoneId resolve(Location location) {
        return cache.get(location.toKey(), key -> delegate.resolve(location));
    }

    public void clearCache() {
        cache.invalidateAll();
    }
}
