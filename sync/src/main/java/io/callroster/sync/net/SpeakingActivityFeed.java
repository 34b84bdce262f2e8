package io.callroster.sync.net;

import io.callroster.core.Cancellable;
import io.callroster.core.PeerId;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Audio activity detected for a call: every delivery is the complete current
 * set of speaking peers with their speaking timestamp (seconds).
 */
public interface SpeakingActivityFeed {

    Cancellable subscribe(long callId, Consumer<Map<PeerId, Integer>> listener);
}
