package com.media.lifecycle.core.model;

/**
 * Kind of media item. Each kind is matched across systems through a single provider id.
 */
public enum MediaType {
    MOVIE("movie", "movie", ProviderId.TMDB),
    TV_SHOW("tv", "TV show", ProviderId.TVDB);

    private final String code;
    private final String displayName;
    private final ProviderId matchingProvider;

    MediaType(String code, String displayName, ProviderId matchingProvider) {
        this.code = code;
        this.displayName = displayName;
        this.matchingProvider = matchingProvider;
    }

    /**
     * Short code used in persisted records and summaries.
     */
    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * The provider whose id is used to match this kind of item against
     * watch-history and request records.
     */
    public ProviderId matchingProvider() {
        return matchingProvider;
    }

    public static MediaType fromCode(String code) {
        for (MediaType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown media type: " + code);
    }
}
