package com.signalhub.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Single-process {@link PresenceStore}: key -> expiry instant.
 * Expired keys are invisible to {@link #scan} and purged once a minute.
 */
@Component
public class InMemoryPresenceStore implements PresenceStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPresenceStore.class);

    private final Map<String, Instant> expiries = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryPresenceStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void set(String key, Duration ttl) {
        expiries.put(key, clock.instant().plus(ttl));
    }

    @Override
    public void delete(String key) {
        expiries.remove(key);
    }

    @Override
    public Set<String> scan(String prefix) {
        Instant now = clock.instant();
        Set<String> live = new TreeSet<>();
        expiries.forEach((key, expiry) -> {
            if (key.startsWith(prefix) && expiry.isAfter(now)) {
                live.add(key);
            }
        });
        return live;
    }

    @Scheduled(fixedRate = 60000) // Every minute
    public void purgeExpired() {
        Instant now = clock.instant();
        int before = expiries.size();
        expiries.entrySet().removeIf(entry -> !entry.getValue().isAfter(now));
        int purged = before - expiries.size();
        if (purged > 0) {
            logger.debug("Purged {} expired presence keys ({} remaining)", purged, expiries.size());
        }
    }

    public int size() {
        return expiries.size();
    }
}
