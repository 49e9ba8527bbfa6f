package fr.lapetina.factcheck.orchestrator;

import fr.lapetina.factcheck.domain.model.SearchResult;

import java.util.List;

/**
 * Search evidence for one check.
 *
 * @param context        text block handed to the model, empty when there is no evidence
 * @param references     ranked, de-duplicated results
 * @param referencesText reference section appended to the result text
 */
record Evidence(String context, List<SearchResult> references, String referencesText) {

    static final String REFERENCES_HEADER = "\n\nReferences:\n";

    Evidence {
        references = List.copyOf(references);
    }

    static Evidence none(String reason) {
        return new Evidence("", List.of(), REFERENCES_HEADER + reason);
    }
}
