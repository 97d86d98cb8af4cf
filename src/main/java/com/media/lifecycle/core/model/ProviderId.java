package com.media.lifecycle.core.model;

/**
 * External metadata provider whose identifiers are shared between catalogs,
 * watch-history sources and request sources.
 */
public enum ProviderId {
    TMDB("Tmdb"),
    TVDB("Tvdb");

    private final String key;

    ProviderId(String key) {
        this.key = key;
    }

    /**
     * Key used by media servers in their provider-id maps.
     */
    public String key() {
        return key;
    }
}
