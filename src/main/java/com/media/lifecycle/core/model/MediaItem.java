package com.media.lifecycle.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A movie or TV show held by one of the catalogs, merged with what the
 * watch-history and request sources know about it.
 *
 * <p>Identity and catalog attributes are set at ingest time. Watch, request and
 * schedule attributes are refreshed on every reconciliation pass. The schedule
 * (delete-after, days until due, reason) can only be written through
 * {@link #applySchedule} and {@link #clearSchedule}.</p>
 */
public class MediaItem {
    private final String id;
    private final MediaType type;
    private final String title;
    private final int year;
    private final Set<String> tags;
    private final String qualityProfile;
    private final Integer tmdbId;
    private final Integer tvdbId;
    private final int movieCatalogId;
    private final int seriesCatalogId;
    private final Instant addedAt;
    private final String filePath;
    private final long fileSize;

    private String watchServerId;
    private Instant lastWatched;
    private int watchCount;
    private boolean requested;
    private Requester requester;

    private boolean excluded;
    private Instant deleteAfter;
    private int daysUntilDue;
    private String deletionReason;
    private WatchMatchStatus matchStatus;
    private String matchInfo;

    private MediaItem(Builder builder) {
        this.id = builder.id;
        this.type = builder.type;
        this.title = builder.title;
        this.year = builder.year;
        this.tags = Collections.unmodifiableSet(new LinkedHashSet<>(builder.tags));
        this.qualityProfile = builder.qualityProfile;
        this.tmdbId = builder.tmdbId;
        this.tvdbId = builder.tvdbId;
        this.movieCatalogId = builder.movieCatalogId;
        this.seriesCatalogId = builder.seriesCatalogId;
        this.addedAt = builder.addedAt;
        this.filePath = builder.filePath;
        this.fileSize = builder.fileSize;
        this.watchServerId = builder.watchServerId;
        this.lastWatched = builder.lastWatched;
        this.watchCount = builder.watchCount;
        this.requested = builder.requested;
        this.requester = builder.requester != null ? builder.requester : Requester.none();
        this.excluded = builder.excluded;
        this.deleteAfter = builder.deleteAfter;
        this.daysUntilDue = builder.daysUntilDue;
        this.deletionReason = builder.deletionReason;
        this.matchStatus = builder.matchStatus != null ? builder.matchStatus : WatchMatchStatus.UNKNOWN;
        this.matchInfo = builder.matchInfo;
    }

    public String getId() {
        return id;
    }

    public MediaType getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public int getYear() {
        return year;
    }

    public Set<String> getTags() {
        return tags;
    }

    public String getQualityProfile() {
        return qualityProfile;
    }

    public Integer getTmdbId() {
        return tmdbId;
    }

    public Integer getTvdbId() {
        return tvdbId;
    }

    /**
     * Returns the id this item carries for the given provider, or null.
     */
    public Integer getProviderId(ProviderId provider) {
        return switch (provider) {
            case TMDB -> tmdbId;
            case TVDB -> tvdbId;
        };
    }

    /**
     * Returns the id used to match this item against watch-history and request records.
     */
    public Integer getMatchingId() {
        return getProviderId(type.matchingProvider());
    }

    /** Native id in the movie catalog, 0 when the movie catalog does not hold it. */
    public int getMovieCatalogId() {
        return movieCatalogId;
    }

    /** Native id in the series catalog, 0 when the series catalog does not hold it. */
    public int getSeriesCatalogId() {
        return seriesCatalogId;
    }

    public Instant getAddedAt() {
        return addedAt;
    }

    public String getFilePath() {
        return filePath;
    }

    public long getFileSize() {
        return fileSize;
    }

    public String getWatchServerId() {
        return watchServerId;
    }

    /**
     * Last time the item was played, or null if never watched.
     */
    public Instant getLastWatched() {
        return lastWatched;
    }

    public int getWatchCount() {
        return watchCount;
    }

    public boolean isRequested() {
        return requested;
    }

    public Requester getRequester() {
        return requester;
    }

    public boolean isExcluded() {
        return excluded;
    }

    /**
     * Scheduled deletion time, or null when no deletion is scheduled.
     */
    public Instant getDeleteAfter() {
        return deleteAfter;
    }

    public int getDaysUntilDue() {
        return daysUntilDue;
    }

    public String getDeletionReason() {
        return deletionReason;
    }

    public WatchMatchStatus getMatchStatus() {
        return matchStatus;
    }

    public String getMatchInfo() {
        return matchInfo;
    }

    /**
     * The time retention is measured from: last watched when known, otherwise added.
     */
    public Instant retentionBase() {
        return lastWatched != null ? lastWatched : addedAt;
    }

    public void setWatchServerId(String watchServerId) {
        this.watchServerId = watchServerId;
    }

    public void setLastWatched(Instant lastWatched) {
        this.lastWatched = lastWatched;
    }

    public void setWatchCount(int watchCount) {
        if (watchCount < 0) {
            throw new IllegalArgumentException("watchCount must be >= 0");
        }
        this.watchCount = watchCount;
    }

    public void markRequested(Requester requester) {
        this.requested = true;
        this.requester = requester != null ? requester : Requester.none();
    }

    public void setExcluded(boolean excluded) {
        this.excluded = excluded;
    }

    public void setMatch(WatchMatchStatus status, String info) {
        this.matchStatus = Objects.requireNonNull(status, "status");
        this.matchInfo = info;
    }

    /**
     * Records a scheduled deletion computed by the retention policy.
     */
    public void applySchedule(Instant deleteAfter, int daysUntilDue, String reason) {
        this.deleteAfter = Objects.requireNonNull(deleteAfter, "deleteAfter");
        this.daysUntilDue = daysUntilDue;
        this.deletionReason = reason;
    }

    public void clearSchedule() {
        this.deleteAfter = null;
        this.daysUntilDue = 0;
        this.deletionReason = null;
    }

    public boolean hasScheduledDeletion() {
        return deleteAfter != null;
    }

    /**
     * Returns an independent copy, safe to hand out to readers.
     */
    public MediaItem copy() {
        return builder(this).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MediaItem that = (MediaItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "MediaItem{" +
                "id='" + id + '\'' +
                ", type=" + type +
                ", title='" + title + '\'' +
                ", year=" + year +
                ", excluded=" + excluded +
                ", deleteAfter=" + deleteAfter +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(MediaItem item) {
        return new Builder()
                .id(item.id)
                .type(item.type)
                .title(item.title)
                .year(item.year)
                .tags(item.tags)
                .qualityProfile(item.qualityProfile)
                .tmdbId(item.tmdbId)
                .tvdbId(item.tvdbId)
                .movieCatalogId(item.movieCatalogId)
                .seriesCatalogId(item.seriesCatalogId)
                .addedAt(item.addedAt)
                .filePath(item.filePath)
                .fileSize(item.fileSize)
                .watchServerId(item.watchServerId)
                .lastWatched(item.lastWatched)
                .watchCount(item.watchCount)
                .requested(item.requested)
                .requester(item.requester)
                .excluded(item.excluded)
                .deleteAfter(item.deleteAfter)
                .daysUntilDue(item.daysUntilDue)
                .deletionReason(item.deletionReason)
                .matchStatus(item.matchStatus)
                .matchInfo(item.matchInfo);
    }

    public static class Builder {
        private String id;
        private MediaType type;
        private String title;
        private int year;
        private Set<String> tags = Set.of();
        private String qualityProfile;
        private Integer tmdbId;
        private Integer tvdbId;
        private int movieCatalogId;
        private int seriesCatalogId;
        private Instant addedAt;
        private String filePath;
        private long fileSize;
        private String watchServerId;
        private Instant lastWatched;
        private int watchCount;
        private boolean requested;
        private Requester requester;
        private boolean excluded;
        private Instant deleteAfter;
        private int daysUntilDue;
        private String deletionReason;
        private WatchMatchStatus matchStatus;
        private String matchInfo;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(MediaType type) {
            this.type = type;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder year(int year) {
            this.year = year;
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags = tags != null ? tags : Set.of();
            return this;
        }

        public Builder qualityProfile(String qualityProfile) {
            this.qualityProfile = qualityProfile;
            return this;
        }

        public Builder tmdbId(Integer tmdbId) {
            this.tmdbId = tmdbId;
            return this;
        }

        public Builder tvdbId(Integer tvdbId) {
            this.tvdbId = tvdbId;
            return this;
        }

        public Builder movieCatalogId(int movieCatalogId) {
            this.movieCatalogId = movieCatalogId;
            return this;
        }

        public Builder seriesCatalogId(int seriesCatalogId) {
            this.seriesCatalogId = seriesCatalogId;
            return this;
        }

        public Builder addedAt(Instant addedAt) {
            this.addedAt = addedAt;
            return this;
        }

        public Builder filePath(String filePath) {
            this.filePath = filePath;
            return this;
        }

        public Builder fileSize(long fileSize) {
            this.fileSize = fileSize;
            return this;
        }

        public Builder watchServerId(String watchServerId) {
            this.watchServerId = watchServerId;
            return this;
        }

        public Builder lastWatched(Instant lastWatched) {
            this.lastWatched = lastWatched;
            return this;
        }

        public Builder watchCount(int watchCount) {
            this.watchCount = watchCount;
            return this;
        }

        public Builder requested(boolean requested) {
            this.requested = requested;
            return this;
        }

        public Builder requester(Requester requester) {
            this.requester = requester;
            return this;
        }

        public Builder excluded(boolean excluded) {
            this.excluded = excluded;
            return this;
        }

        Builder deleteAfter(Instant deleteAfter) {
            this.deleteAfter = deleteAfter;
            return this;
        }

        Builder daysUntilDue(int daysUntilDue) {
            this.daysUntilDue = daysUntilDue;
            return this;
        }

        Builder deletionReason(String deletionReason) {
            this.deletionReason = deletionReason;
            return this;
        }

        public Builder matchStatus(WatchMatchStatus matchStatus) {
            this.matchStatus = matchStatus;
            return this;
        }

        public Builder matchInfo(String matchInfo) {
            this.matchInfo = matchInfo;
            return this;
        }

        public MediaItem build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(addedAt, "addedAt is required");
            if (watchCount < 0) {
                throw new IllegalArgumentException("watchCount must be >= 0");
            }
            return new MediaItem(this);
        }
    }
}
