package fr.lapetina.factcheck.orchestrator;

import fr.lapetina.factcheck.domain.model.ModelTier;

/**
 * Progress of one check attempt, read by the recovery path after a failure.
 */
final class CheckContext {

    private final String text;
    private volatile ModelTier tier;
    private volatile String queryText;

    CheckContext(String text) {
        this.text = text;
    }

    String text() {
        return text;
    }

    ModelTier tier() {
        return tier;
    }

    void tier(ModelTier tier) {
        this.tier = tier;
    }

    /**
     * Extracted query, or the head of the input when extraction has not happened yet.
     */
    String queryText() {
        String query = queryText;
        if (query != null) {
            return query;
        }
        return text.length() > 100 ? text.substring(0, 100) : text;
    }

    void queryText(String queryText) {
        this.queryText = queryText;
    }
}
