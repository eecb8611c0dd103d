package com.attest.authservice.maintenance;

import com.attest.security.store.RevocationStore;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops revocation records whose tokens have expired anyway.
 */
@Component
public class RevocationPurgeJob {

    private static final Logger log = LoggerFactory.getLogger(RevocationPurgeJob.class);

    private final RevocationStore revocationStore;
    private final Clock clock;

    public RevocationPurgeJob(RevocationStore revocationStore, Clock clock) {
        this.revocationStore = revocationStore;
        this.clock = clock;
    }

    @Scheduled(
            initialDelayString = "${attest.auth.revocation-purge-interval:PT10M}",
            fixedDelayString = "${attest.auth.revocation-purge-interval:PT10M}")
    public int purge() {
        int removed = revocationStore.purgeExpired(clock.instant());
        if (removed > 0) {
            log.info("Purged {} expired revocation records", removed);
        }
        return removed;
    }
}
