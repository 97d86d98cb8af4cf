package com.media.lifecycle.source;

import com.media.lifecycle.core.model.ProviderId;

import java.util.Objects;

/**
 * A user request for a movie or show.
 *
 * @param id          request id
 * @param status      request status
 * @param tmdbId      TMDB id of the requested media, or null
 * @param tvdbId      TVDB id of the requested media, or null
 * @param requestedBy requesting user, or null
 */
public record MediaRequest(int id, RequestStatus status, Integer tmdbId, Integer tvdbId, RequestUser requestedBy) {

    public MediaRequest {
        Objects.requireNonNull(status, "status is required");
    }

    public Integer providerId(ProviderId provider) {
        return provider == ProviderId.TMDB ? tmdbId : tvdbId;
    }
}
