package io.callroster.server.gateway;

import io.callroster.core.DefaultParticipantsAreMuted;
import io.callroster.core.update.CallSettingsUpdate;
import io.callroster.sync.net.ScopedUpdate;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PushUpdateFeedTest {

    private static final ScopedUpdate ENDED =
            new ScopedUpdate(42L, new CallSettingsUpdate(true, DefaultParticipantsAreMuted.off(), null, null));

    @Test
    void batch_reaches_every_subscriber_until_cancelled() {
        var feed = new PushUpdateFeed();
        List<List<ScopedUpdate>> a = new ArrayList<>();
        List<List<ScopedUpdate>> b = new ArrayList<>();
        var subA = feed.subscribe(a::add);
        feed.subscribe(b::add);

        feed.publish(List.of(ENDED));
        subA.cancel();
        feed.publish(List.of(ENDED));

        assertEquals(1, a.size());
        assertEquals(2, b.size());
        assertEquals(1, feed.subscriberCount());
    }

    @Test
    void failing_listener_does_not_starve_the_others() {
        var feed = new PushUpdateFeed();
        List<List<ScopedUpdate>> seen = new ArrayList<>();
        feed.subscribe(batch -> { throw new IllegalStateException("boom"); });
        feed.subscribe(seen::add);

        feed.publish(List.of(ENDED));

        assertEquals(1, seen.size());
    }
}
