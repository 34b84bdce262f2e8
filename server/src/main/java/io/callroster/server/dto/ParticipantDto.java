// file: src/main/java/io/callroster/server/dto/ParticipantDto.java
package io.callroster.server.dto;

/**
 * One participant as the gateway sends it, in fetched pages and in pushed updates.
 * Example:
 *   {
 *     "peerId": 7,
 *     "displayName": "Ann",
 *     "ssrc": 70,
 *     "joinTimestamp": 1700000000,
 *     "activityTimestamp": 1700000042.5,
 *     "raiseHandRating": 3,
 *     "muted": true,
 *     "canSelfUnmute": true,
 *     "mutedByYou": false,
 *     "left": false,
 *     "justJoined": true,
 *     "min": false
 *   }
 */
public class ParticipantDto {
    public Long peerId;               // required
    public String displayName;
    public Long ssrc;
    public String jsonParams;
    public int joinTimestamp;
    public Double activityTimestamp;
    public Long raiseHandRating;      // present iff the hand is raised
    public boolean muted;
    public boolean canSelfUnmute;
    public boolean mutedByYou;
    public boolean left;              // update only
    public boolean justJoined;        // update only
    public boolean min;               // reduced projection, see ParticipantUpdate.isMin
    public Integer volume;
    public String about;
}
