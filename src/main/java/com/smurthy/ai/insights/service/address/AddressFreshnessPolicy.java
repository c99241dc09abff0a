package com.smurthy.ai.insights.service.address;

import com.smurthy.ai.insights.model.OrganizationRecord;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a cached organization address can be used without a new lookup.
 *
 * An address is fresh when the record carries address data and it was updated strictly less
 * than {@code cacheDays} ago. A record updated exactly {@code cacheDays} ago is stale.
 */
public class AddressFreshnessPolicy {

    private final Clock clock;
    private final Duration maxAge;

    public AddressFreshnessPolicy(Clock clock, int cacheDays) {
        this.clock = clock;
        this.maxAge = Duration.ofDays(cacheDays);
    }

    public boolean isFresh(OrganizationRecord hco) {
        Instant lastUpdated = hco.addressLastUpdated();
        if (!hco.hasAddress() || lastUpdated == null) {
            return false;
        }
        Instant cutoff = clock.instant().minus(maxAge);
        return lastUpdated.isAfter(cutoff);
    }
}
