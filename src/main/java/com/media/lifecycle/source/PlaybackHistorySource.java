package com.media.lifecycle.source;

import com.media.lifecycle.core.SyncContext;

import java.util.List;

/**
 * Playback activity tracker. Authoritative for play counts and last-watched times
 * of items already matched to the media server.
 */
public interface PlaybackHistorySource extends MediaSource {

    List<PlaybackEvent> listPlaybackHistory(SyncContext ctx);
}
