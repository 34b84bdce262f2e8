// file: src/main/java/io/callroster/server/dto/RosterResponse.java
package io.callroster.server.dto;

import java.util.List;

/**
 * JSON response for GET /calls/{callId}/participants: the viewer's effective roster.
 * Example:
 *   {
 *     "callId": 42,
 *     "version": 17,
 *     "totalCount": 250,
 *     "nextFetchOffset": "abc",
 *     "title": "standup",
 *     "terminated": false,
 *     "participants": [
 *       { "peerId": 7, "displayName": "Ann", "ssrc": 70, "activityRank": 0, "muted": false, ... }
 *     ]
 *   }
 */
public class RosterResponse {
    public long callId;
    public int version;
    public int totalCount;
    public String nextFetchOffset;
    public String title;
    public Integer recordingStartTimestamp;
    public boolean defaultMuted;
    public boolean terminated;
    public List<Entry> participants;

    public static class Entry {
        public long peerId;
        public String displayName;    // null when the peer is not in the directory
        public Long ssrc;
        public int joinTimestamp;
        public Double activityTimestamp;
        public Integer activityRank;
        public Long raiseHandRating;
        public boolean muted;
        public boolean canSelfUnmute;
        public boolean mutedByYou;
        public Integer volume;
        public String about;
    }
}
