package io.meetflow.retry;

import io.meetflow.model.FailureStatus;
import io.meetflow.model.Platform;
import io.meetflow.spi.WebhookFailureStore;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of webhook failure counts, in total and per platform, keyed by status.
 * Statuses without rows are reported as zero.
 */
public record FailureMetrics(Map<FailureStatus, Long> totals,
                             Map<Platform, Map<FailureStatus, Long>> byPlatform) {

    public FailureMetrics {
        totals = copyOf(totals);
        Map<Platform, Map<FailureStatus, Long>> copy = new EnumMap<>(Platform.class);
        byPlatform.forEach((platform, counts) -> copy.put(platform, copyOf(counts)));
        byPlatform = Collections.unmodifiableMap(copy);
    }

    static FailureMetrics from(List<WebhookFailureStore.StatusCount> counts) {
        Map<FailureStatus, Long> totals = zeroed();
        Map<Platform, Map<FailureStatus, Long>> byPlatform = new EnumMap<>(Platform.class);
        for (Platform platform : Platform.values()) {
            byPlatform.put(platform, zeroed());
        }
        for (WebhookFailureStore.StatusCount count : counts) {
            totals.merge(count.status(), count.count(), Long::sum);
            byPlatform.get(count.platform()).merge(count.status(), count.count(), Long::sum);
        }
        return new FailureMetrics(totals, byPlatform);
    }

    public long count(FailureStatus status) {
        return totals.getOrDefault(status, 0L);
    }

    public long count(Platform platform, FailureStatus status) {
        Map<FailureStatus, Long> counts = byPlatform.get(platform);
        return counts == null ? 0L : counts.getOrDefault(status, 0L);
    }

    /**
     * Failures still waiting for a retry ({@code pending} plus {@code retrying}).
     */
    public long queueDepth() {
        return count(FailureStatus.PENDING) + count(FailureStatus.RETRYING);
    }

    private static Map<FailureStatus, Long> copyOf(Map<FailureStatus, Long> counts) {
        Map<FailureStatus, Long> copy = new EnumMap<>(FailureStatus.class);
        copy.putAll(counts);
        return Collections.unmodifiableMap(copy);
    }

    private static Map<FailureStatus, Long> zeroed() {
        Map<FailureStatus, Long> counts = new EnumMap<>(FailureStatus.class);
        for (FailureStatus status : FailureStatus.values()) {
            counts.put(status, 0L);
        }
        return counts;
    }
}
