package fr.lapetina.factcheck.domain.model;

/**
 * Agreement level between independent model ratings.
 */
public enum Confidence {
    HIGH("High"),
    MODERATE("Moderate"),
    LOW("Low");

    private final String label;

    Confidence(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
