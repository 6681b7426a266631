package com.signalhub.service;

import java.time.Duration;
import java.util.Set;

/**
 * Ephemeral key store with per-key expiry, used for presence markers (typing)
 * that other hub processes may want to see. Best-effort: routing never
 * depends on it.
 */
public interface PresenceStore {

    void set(String key, Duration ttl);

    void delete(String key);

    /**
     * Live (unexpired) keys starting with the prefix.
     */
    Set<String> scan(String prefix);
}
