package com.media.lifecycle.source;

import com.media.lifecycle.core.SyncContext;

import java.util.List;

/**
 * System where users request media.
 */
public interface RequestSource extends MediaSource {

    List<MediaRequest> listRequests(SyncContext ctx);
}
