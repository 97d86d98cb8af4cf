package com.media.lifecycle.reconcile;

import com.media.lifecycle.core.model.MediaItem;
import com.media.lifecycle.source.MediaRequest;
import com.media.lifecycle.source.RequestUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Marks library items as requested from approved or available requests.
 * Items are matched by the provider id of their type; each request marks at most one item.
 */
class RequestMatcher {
    private static final Logger log = LoggerFactory.getLogger(RequestMatcher.class);

    private final MediaLibrary library;

    RequestMatcher(MediaLibrary library) {
        this.library = library;
    }

    /**
     * @return number of requests matched to a library item
     */
    int match(List<MediaRequest> requests, String sourceName) {
        int matched = library.write(items -> {
            int count = 0;
            for (MediaRequest request : requests) {
                if (!request.status().countsAsRequested()) {
                    continue;
                }
                for (MediaItem item : items.values()) {
                    Integer ownId = item.getMatchingId();
                    if (ownId == null || !ownId.equals(request.providerId(item.getType().matchingProvider()))) {
                        continue;
                    }
                    RequestUser user = request.requestedBy();
                    item.markRequested(user != null ? user.toRequester() : null);
                    log.debug("request.matched title='{}' requestId={} requester={}",
                            item.getTitle(), request.id(), item.getRequester().username());
                    count++;
                    break;
                }
            }
            return count;
        });
        log.info("request.synced source={} requests={} matched={}", sourceName, requests.size(), matched);
        return matched;
    }
}
