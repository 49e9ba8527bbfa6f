package fr.lapetina.factcheck.domain.model;

/**
 * Provider-independent model quality/cost level, ordered from cheapest to most capable.
 */
public enum ModelTier {
    EXTRACTION,
    FAST,
    STANDARD,
    PREMIUM
}
