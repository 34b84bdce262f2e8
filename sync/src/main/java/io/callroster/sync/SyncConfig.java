// file: src/main/java/io/callroster/sync/SyncConfig.java
package io.callroster.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.callroster.sync.dto.JsonSyncConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Tunables of the participant sync engine.
 *
 * @param decayPeriod          how often stale activity ranks are swept
 * @param activityRankTtl      a rank is cleared once the participant has been silent this long
 * @param pageLimit            page size for pagination and resync fetches
 * @param missingFetchLimit    page size for missing-participant backfill
 * @param strictPeerResolution deltas naming unknown peers fail loudly instead of being skipped;
 *                             meant for development and tests
 */
public record SyncConfig(
        Duration decayPeriod,
        Duration activityRankTtl,
        int pageLimit,
        int missingFetchLimit,
        boolean strictPeerResolution
) {
    public SyncConfig {
        Objects.requireNonNull(decayPeriod, "decayPeriod");
        Objects.requireNonNull(activityRankTtl, "activityRankTtl");
        if (decayPeriod.isZero() || decayPeriod.isNegative()) throw new IllegalArgumentException("decayPeriod must be > 0");
        if (activityRankTtl.isNegative()) throw new IllegalArgumentException("activityRankTtl must be >= 0");
        if (pageLimit <= 0) throw new IllegalArgumentException("pageLimit must be > 0");
        if (missingFetchLimit <= 0) throw new IllegalArgumentException("missingFetchLimit must be > 0");
    }

    public static SyncConfig defaults() {
        return new SyncConfig(Duration.ofSeconds(10), Duration.ofSeconds(60), 100, 100, false);
    }

    public SyncConfig withStrictPeerResolution(boolean strict) {
        return new SyncConfig(decayPeriod, activityRankTtl, pageLimit, missingFetchLimit, strict);
    }

    public static SyncConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonSyncConfig cfg = mapper.readValue(path.toFile(), JsonSyncConfig.class);
            SyncConfig d = defaults();
            return new SyncConfig(
                    cfg.decayPeriodSeconds != null ? Duration.ofSeconds(cfg.decayPeriodSeconds) : d.decayPeriod(),
                    cfg.activityRankTtlSeconds != null ? Duration.ofSeconds(cfg.activityRankTtlSeconds) : d.activityRankTtl(),
                    cfg.pageLimit != null ? cfg.pageLimit : d.pageLimit(),
                    cfg.missingFetchLimit != null ? cfg.missingFetchLimit : d.missingFetchLimit(),
                    cfg.strictPeerResolution != null ? cfg.strictPeerResolution : d.strictPeerResolution()
            );
        } catch (IOException e) {
            throw new RuntimeException("Failed to load SyncConfig from " + path, e);
        }
    }
}
