package io.meetflow.ingest.platform;

import io.meetflow.model.Platform;
import io.meetflow.spi.PlatformEventAdapter;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lookup of one {@link PlatformEventAdapter} per platform.
 */
public final class PlatformEventAdapters {
    private final Map<Platform, PlatformEventAdapter> adapters;

    private PlatformEventAdapters(Map<Platform, PlatformEventAdapter> adapters) {
        this.adapters = adapters;
    }

    /**
     * Returns the built-in adapters for Zoom, Google Meet and Microsoft Teams.
     */
    public static PlatformEventAdapters defaults() {
        return of(List.of(new ZoomEventAdapter(), new GoogleMeetEventAdapter(), new TeamsEventAdapter()));
    }

    /**
     * Builds a lookup from the given adapters; a later adapter replaces an earlier one for the
     * same platform.
     */
    public static PlatformEventAdapters of(Collection<? extends PlatformEventAdapter> adapters) {
        Map<Platform, PlatformEventAdapter> byPlatform = new EnumMap<>(Platform.class);
        for (PlatformEventAdapter adapter : adapters) {
            byPlatform.put(Objects.requireNonNull(adapter.platform(), "platform"), adapter);
        }
        return new PlatformEventAdapters(byPlatform);
    }

    /**
     * @throws IllegalArgumentException if no adapter is registered for {@code platform}
     */
    public PlatformEventAdapter forPlatform(Platform platform) {
        PlatformEventAdapter adapter = adapters.get(platform);
        if (adapter == null) {
            throw new IllegalArgumentException("No event adapter for platform: " + platform.code());
        }
        return adapter;
    }
}
