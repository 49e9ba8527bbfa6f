package fr.lapetina.factcheck.orchestrator;

/**
 * Prompt text sent to the models. Every evaluation prompt asks for a {@code Rating:} line.
 */
final class PromptTemplates {

    static final String EVIDENCE_ANALYSIS = "Evidence Analysis";
    static final String LOGICAL_CONSISTENCY = "Logical Consistency";

    private static final String RATING_FORMAT =
            "FORMAT YOUR RESPONSE WITH THESE HEADERS:\n"
            + "\"Rating: [numerical score]\"\n"
            + "\"Explanation: [your concise explanation]\"\n";

    private PromptTemplates() {
    }

    static String claimExtraction(String text) {
        return "Extract the 2-3 most important factual claims from this text.\n"
                + "Focus on specific, verifiable statements rather than opinions.\n"
                + "Return ONLY the claims, separated by semicolons, with no additional text:\n"
                + "\n"
                + "\"" + text + "\"\n";
    }

    static String singleCheck(String text, String searchContext, String today) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("I need your help to fact-check the following statement. ")
                .append("Please carefully analyze this for accuracy:\n\n")
                .append("STATEMENT TO VERIFY: \"").append(text).append("\"\n\n");
        if (searchContext != null && !searchContext.isBlank()) {
            prompt.append("REFERENCE INFORMATION:\n").append(searchContext).append("\n\n");
        }
        prompt.append("TODAY'S DATE: ").append(today).append("\n\n")
                .append("Please follow this specific evaluation framework:\n\n")
                .append("1. KEY CLAIMS IDENTIFICATION:\n")
                .append("   - Identify the 2-3 main factual claims in the statement\n")
                .append("   - For each claim, note if it's verifiable with available information\n\n")
                .append("2. EVIDENCE EVALUATION:\n")
                .append("   - Rate the strength of supporting evidence from references (Strong/Moderate/Weak/None)\n")
                .append("   - Note contradictory evidence where applicable\n")
                .append("   - Consider source credibility and recency\n")
                .append("   - Identify information gaps\n\n")
                .append("3. CONTEXTUAL ANALYSIS:\n")
                .append("   - Note any missing context that affects interpretation\n")
                .append("   - Identify if the statement misleads through selective presentation\n\n")
                .append("4. VERDICT:\n")
                .append("   - Assign a numerical accuracy score (0-100):\n")
                .append("     * 90-100: Completely or almost completely accurate\n")
                .append("     * 70-89: Mostly accurate with minor issues\n")
                .append("     * 50-69: Mixed accuracy with significant issues\n")
                .append("     * 30-49: Mostly inaccurate with some truth\n")
                .append("     * 0-29: Completely or almost completely false\n")
                .append("   - Provide a concise explanation for your rating\n\n")
                .append("5. LIMITATIONS:\n")
                .append("   - Note any limitations in your assessment due to incomplete information\n\n")
                .append("FORMAT YOUR RESPONSE WITH THESE HEADERS:\n")
                .append("\"Rating: [numerical score]\"\n")
                .append("\"Explanation: [your concise explanation with specific references]\"\n");
        return prompt.toString();
    }

    static String evidenceAnalysis(String text, String searchContext) {
        if (searchContext == null || searchContext.isBlank()) {
            return "Analyze the factual claims in: \"" + text + "\".\n"
                    + "Based on your knowledge, evaluate how accurate these claims are likely to be.\n"
                    + "Provide a numeric accuracy rating from 0-100 and brief explanation.\n\n"
                    + RATING_FORMAT;
        }
        return "Based strictly on the provided search context, evaluate the factual claims in: \"" + text + "\".\n"
                + "List each claim and assess whether the search results support, contradict, "
                + "or are silent on each claim.\n"
                + "Provide a numeric accuracy rating from 0-100 and brief explanation.\n\n"
                + "SEARCH CONTEXT:\n" + searchContext + "\n\n"
                + RATING_FORMAT;
    }

    static String logicalConsistency(String text) {
        return "Analyze the internal logical consistency of the following statement: \"" + text + "\".\n"
                + "Identify if there are any contradictions or logical fallacies.\n"
                + "Provide a numeric consistency rating from 0-100 and brief explanation.\n\n"
                + RATING_FORMAT;
    }

    static String emergencyCheck(String text) {
        return "Please fact-check the following statement and rate its accuracy from 0-100:\n"
                + "\"" + text + "\"\n\n"
                + "Format your response with:\n"
                + "\"Rating: [numerical score]\"\n"
                + "\"Explanation: [your brief explanation]\"\n";
    }
}
