package com.media.lifecycle.reconcile;

import com.media.lifecycle.core.model.MediaItem;
import com.media.lifecycle.core.model.MediaType;
import com.media.lifecycle.core.model.ProviderId;
import com.media.lifecycle.core.model.WatchMatchStatus;
import com.media.lifecycle.source.PlaybackEvent;
import com.media.lifecycle.source.WatchedItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Copies watch data from the watch-history sources onto library items.
 *
 * <p>Items are matched by the provider id of their type. When that fails, a title
 * lookup is used only to flag a metadata mismatch; it never copies watch data.</p>
 */
class WatchHistoryMatcher {
    private static final Logger log = LoggerFactory.getLogger(WatchHistoryMatcher.class);

    private final MediaLibrary library;

    WatchHistoryMatcher(MediaLibrary library) {
        this.library = library;
    }

    /**
     * Matches all library items of one type against the watched items the source reported for it.
     */
    WatchMatchStats match(MediaType type, List<WatchedItem> watched, String sourceName) {
        ProviderId provider = type.matchingProvider();
        Map<String, WatchedItem> byProviderId = new HashMap<>();
        Map<String, WatchedItem> byTitle = new HashMap<>();
        for (WatchedItem item : watched) {
            String id = item.providerId(provider);
            if (id != null) {
                byProviderId.put(id, item);
            }
            if (item.name() != null) {
                byTitle.put(normalizeTitle(item.name()), item);
            }
        }

        WatchMatchStats stats = library.write(items -> {
            int matched = 0;
            int notFound = 0;
            int mismatched = 0;
            for (MediaItem item : items.values()) {
                if (item.getType() != type) {
                    continue;
                }
                Integer ownId = item.getProviderId(provider);
                WatchedItem hit = ownId != null ? byProviderId.get(ownId.toString()) : null;
                if (hit != null) {
                    item.setWatchServerId(hit.id());
                    item.setWatchCount(Math.max(0, hit.playCount()));
                    if (hit.lastPlayed() != null) {
                        item.setLastWatched(hit.lastPlayed());
                    }
                    item.setMatch(WatchMatchStatus.MATCHED, null);
                    matched++;
                    continue;
                }
                WatchedItem sameTitle = item.getTitle() != null ? byTitle.get(normalizeTitle(item.getTitle())) : null;
                if (sameTitle != null) {
                    String info = String.format("%s has wrong metadata (%s %s instead of %s)",
                            sourceName, provider.name(), sameTitle.providerId(provider), ownId);
                    item.setMatch(WatchMatchStatus.METADATA_MISMATCH, info);
                    mismatched++;
                    log.warn("watch.metadataMismatch title='{}' type={} catalogId={} watchServerId={}",
                            item.getTitle(), type, ownId, sameTitle.providerId(provider));
                } else {
                    item.setMatch(WatchMatchStatus.NOT_FOUND, "Item not found in " + sourceName + " library");
                    notFound++;
                }
            }
            return new WatchMatchStats(matched, notFound, mismatched);
        });

        log.info("watch.matched source={} type={} matched={} notFound={} mismatched={}",
                sourceName, type, stats.matched(), stats.notFound(), stats.mismatched());
        return stats;
    }

    /**
     * Applies playback activity. For each media-server item the latest activity wins
     * for last-watched and the number of activity rows replaces the play count.
     *
     * @return number of library items updated
     */
    int mergePlaybackHistory(List<PlaybackEvent> history, String sourceName) {
        Map<String, Instant> lastWatched = new HashMap<>();
        Map<String, Integer> counts = new HashMap<>();
        for (PlaybackEvent event : history) {
            lastWatched.merge(event.itemId(), event.watchedAt(), (a, b) -> b.isAfter(a) ? b : a);
            counts.merge(event.itemId(), 1, Integer::sum);
        }

        int updated = library.write(items -> {
            int changed = 0;
            for (MediaItem item : items.values()) {
                String serverId = item.getWatchServerId();
                if (serverId == null || serverId.isEmpty()) {
                    continue;
                }
                Instant latest = lastWatched.get(serverId);
                if (latest == null) {
                    continue;
                }
                if (item.getLastWatched() == null || latest.isAfter(item.getLastWatched())) {
                    item.setLastWatched(latest);
                }
                item.setWatchCount(counts.getOrDefault(serverId, 0));
                changed++;
            }
            return changed;
        });

        log.info("watch.playbackMerged source={} events={} updated={}", sourceName, history.size(), updated);
        return updated;
    }

    private static String normalizeTitle(String title) {
        return title.trim().toLowerCase(Locale.ROOT);
    }
}
