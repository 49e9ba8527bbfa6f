package fr.lapetina.factcheck.domain.model;

/**
 * Kind of work a model call performs. Extraction-style tasks always run on the cheapest tier.
 */
public enum TaskType {
    FACT_CHECK,
    CLAIM_EXTRACTION,
    SEARCH_QUERY
}
