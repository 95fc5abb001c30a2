package com.example.careplan.adjudication.model;

/**
 * Why the adjudicator chose the final tier it did.
 */
public enum ReasonCode {
    /** Advisory tier was a known tier inside the allowed set. */
    ADVISORY_VALID,
    /** No advisory opinion; the deterministic tier stands. */
    ADVISORY_UNAVAILABLE,
    /** Advisory tier was unknown or gated out; the deterministic tier stands. */
    ADVISORY_TIER_NOT_ALLOWED,
    /** Neither source produced a usable tier; the safe default was used. */
    DOUBLE_MISSING_DEFAULT
}
