package com.rico.insurance.enrichment;

public enum EnrichmentOutcome {
    /** Records fetched and materialized. */
    ENRICHED,
    /** Provider has no filings for the carrier. */
    NO_DATA,
    /** Carrier is not in the store. */
    CARRIER_NOT_FOUND,
    /** Provider unavailable or unexpected error. */
    FAILED
}
