package com.media.lifecycle.exclusion;

import com.media.lifecycle.core.model.MediaType;

import java.time.Instant;
import java.util.Objects;

/**
 * A media item permanently protected from deletion.
 *
 * @param externalId   catalog-qualified id, e.g. {@code movie-42}
 * @param sourceSystem catalog that owns the item
 * @param mediaType    media type
 * @param title        title at the time of exclusion, for display
 * @param excludedAt   when the exclusion was created
 * @param excludedBy   actor that created it
 * @param reason       free-text reason, may be empty
 */
public record ExclusionRecord(
        String externalId,
        String sourceSystem,
        MediaType mediaType,
        String title,
        Instant excludedAt,
        String excludedBy,
        String reason
) {

    public ExclusionRecord {
        Objects.requireNonNull(externalId, "externalId is required");
        if (externalId.isBlank()) {
            throw new IllegalArgumentException("externalId must not be blank");
        }
        Objects.requireNonNull(excludedAt, "excludedAt is required");
        reason = reason != null ? reason : "";
    }
}
