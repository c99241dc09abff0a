package com.smurthy.ai.insights.service.address;

/**
 * Where the address shown for an organization came from.
 */
public enum AddressSource {
    /** Cached address still within the freshness window. */
    CACHE,
    /** Newly resolved by a lookup provider and written back. */
    PROVIDER,
    /** Cached address past its freshness window; no provider could refresh it. */
    STALE_CACHE,
    /** No address available. */
    NONE
}
