package io.kairos.core.engine;

import java.time.Instant;

/**
 * How the dispatcher advances a job whose claimed occurrence was already in the past.
 */
public enum MissedRunPolicy {
    /**
     * Skip every occurrence that fell between the claimed one and now; the backlog fires once.
     */
    COALESCE,
    /**
     * Advance from the claimed occurrence so every missed occurrence fires on a later tick.
     */
    FIRE_ALL;

    public Instant referenceFor(Instant claimed, Instant now) {
        if (this == FIRE_ALL || claimed.isAfter(now)) {
            return claimed;
        }
        return now;
    }
}
