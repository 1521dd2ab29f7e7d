package com.dnssentinel.core.analytics;

import com.dnssentinel.core.model.QueryRecord;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Fixed-granularity time bucketing shared by the detector and the trend
 * analyzer.
 */
final class TimeBuckets {

    static final Duration HOUR = Duration.ofHours(1);

    private TimeBuckets() {
        // utility class - not instantiable
    }

    /**
     * Start of the bucket containing {@code timestamp}, aligned to the epoch.
     */
    static Instant truncate(Instant timestamp, Duration bucketSize) {
        long size = bucketSize.toMillis();
        return Instant.ofEpochMilli(Math.floorDiv(timestamp.toEpochMilli(), size) * size);
    }

    /**
     * Count records per bucket. Only buckets with at least one record are
     * present; keys are in chronological order.
     */
    static NavigableMap<Instant, Long> counts(Collection<QueryRecord> records, Duration bucketSize) {
        NavigableMap<Instant, Long> buckets = new TreeMap<>();
        for (QueryRecord record : records) {
            buckets.merge(truncate(record.getTimestamp(), bucketSize), 1L, Long::sum);
        }
        return buckets;
    }

    static int hourOfDay(Instant instant, ZoneId zone) {
        return instant.atZone(zone).getHour();
    }

    /**
     * Count records per key.
     */
    static <K> Map<K, Long> countBy(Collection<QueryRecord> records, Function<QueryRecord, K> key) {
        Map<K, Long> counts = new HashMap<>();
        for (QueryRecord record : records) {
            counts.merge(key.apply(record), 1L, Long::sum);
        }
        return counts;
    }

    /**
     * Convert counts into fractions of {@code total}.
     */
    static <K> Map<K, Double> shares(Map<K, Long> counts, long total) {
        Map<K, Double> shares = new HashMap<>();
        if (total == 0) {
            return shares;
        }
        counts.forEach((k, v) -> shares.put(k, (double) v / total));
        return shares;
    }
}
