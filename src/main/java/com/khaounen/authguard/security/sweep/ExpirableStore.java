package com.khaounen.authguard.security.sweep;

/**
 * A store whose entries carry their own expiry and can be pruned in place.
 */
public interface ExpirableStore {

    /**
     * Removes every entry that has expired at the store's current time.
     * Each removal re-checks expiry atomically for its key, so entries
     * refreshed during the pass survive.
     *
     * @return number of entries removed
     */
    int evictExpired();

    long size();
}
