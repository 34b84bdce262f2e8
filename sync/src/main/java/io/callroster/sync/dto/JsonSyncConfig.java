package io.callroster.sync.dto;

/**
 * JSON shape of a sync config file. Every field is optional; missing ones fall
 * back to {@link io.callroster.sync.SyncConfig#defaults()}.
 * Example:
 *   {
 *     "decayPeriodSeconds": 10,
 *     "activityRankTtlSeconds": 60,
 *     "pageLimit": 100,
 *     "missingFetchLimit": 100,
 *     "strictPeerResolution": false
 *   }
 */
public class JsonSyncConfig {
    public Long decayPeriodSeconds;
    public Long activityRankTtlSeconds;
    public Integer pageLimit;
    public Integer missingFetchLimit;
    public Boolean strictPeerResolution;
}
