package com.media.lifecycle.config;

import com.media.lifecycle.core.model.MediaType;

import java.util.Objects;

/**
 * Default retention per media type, as duration strings ({@code 90d}, {@code 12h}, {@code never}).
 * The strings are parsed at evaluation time so a bad value only disables deletion.
 */
public record StandardRetention(String movieRetention, String tvRetention) {

    public StandardRetention {
        Objects.requireNonNull(movieRetention, "movieRetention is required");
        Objects.requireNonNull(tvRetention, "tvRetention is required");
    }

    /**
     * Movies 90 days, TV shows 120 days.
     */
    public static StandardRetention defaults() {
        return new StandardRetention("90d", "120d");
    }

    public String forType(MediaType type) {
        return type == MediaType.MOVIE ? movieRetention : tvRetention;
    }
}
