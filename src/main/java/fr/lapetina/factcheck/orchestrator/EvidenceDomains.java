package fr.lapetina.factcheck.orchestrator;

import fr.lapetina.factcheck.domain.model.SearchResult;

import java.util.List;
import java.util.Locale;

/**
 * Known fact-checking and credible sources.
 *
 * Entries may include a path ("reuters.com/fact-check"), so matching runs against the
 * result URL without its scheme, not just the host.
 */
final class EvidenceDomains {

    static final List<String> FACT_CHECK = List.of(
            "factcheck.org", "politifact.com", "snopes.com", "fullfact.org",
            "reuters.com/fact-check", "apnews.com/hub/ap-fact-check",
            "factchecker.washingtonpost.com", "checkyourfact.com", "truthorfiction.com",
            "factcheck.afp.com", "leadstories.com", "mediabiasfactcheck.com", "poynter.org/ifcn",
            "bbc.com/news/reality_check", "channel4.com/news/factcheck", "vox.com/pages/facts-matter",
            "factcrescendo.com", "hoax-slayer.net", "verafiles.org", "africacheck.org"
    );

    static final List<String> CREDIBLE = List.of(
            "reuters.com", "apnews.com", "bbc.com", "npr.org", "washingtonpost.com", "nytimes.com",
            "wsj.com", "economist.com", "science.org", "nature.com", "scientificamerican.com",
            "theguardian.com", "bloomberg.com", "ft.com", "theatlantic.com", "newyorker.com",
            "time.com", "pbs.org", "cnn.com", "cbsnews.com", "abcnews.go.com", "nbcnews.com",
            "thehill.com", "politico.com", "pnas.org", "sciencedirect.com", "nih.gov", "cdc.gov",
            "who.int", "un.org", "worldbank.org", "imf.org"
    );

    private EvidenceDomains() {
    }

    static boolean isFactCheck(SearchResult result) {
        return matchesAny(result, FACT_CHECK);
    }

    static boolean isCredible(SearchResult result) {
        return matchesAny(result, CREDIBLE);
    }

    private static boolean matchesAny(SearchResult result, List<String> entries) {
        String location = stripScheme(result.url()).toLowerCase(Locale.ROOT);
        String domain = result.domain().toLowerCase(Locale.ROOT);
        for (String entry : entries) {
            if (domain.contains(entry) || location.contains(entry)) {
                return true;
            }
        }
        return false;
    }

    private static String stripScheme(String url) {
        int index = url.indexOf("://");
        return index >= 0 ? url.substring(index + 3) : url;
    }
}
