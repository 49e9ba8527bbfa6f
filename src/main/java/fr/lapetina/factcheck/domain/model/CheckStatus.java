package fr.lapetina.factcheck.domain.model;

/**
 * How a check was resolved.
 */
public enum CheckStatus {
    /** Primary pipeline completed */
    COMPLETE,

    /** Primary pipeline failed, simplified fallback check succeeded */
    EMERGENCY,

    /** Nothing succeeded; the result carries an explanatory message and no rating */
    FAILED
}
