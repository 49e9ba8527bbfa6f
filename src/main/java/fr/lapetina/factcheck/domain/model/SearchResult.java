package fr.lapetina.factcheck.domain.model;

import java.util.Objects;

/**
 * One evidence item returned by a search provider.
 *
 * @param date publication date as reported by the provider, empty when unknown
 */
public record SearchResult(
        String title,
        String description,
        String url,
        String domain,
        String date
) {
    public SearchResult {
        Objects.requireNonNull(url, "URL is required");
        title = title != null && !title.isBlank() ? title : "No title";
        description = description != null ? description : "";
        domain = domain != null ? domain : "";
        date = date != null ? date : "";
    }

    public boolean hasDate() {
        return !date.isEmpty();
    }
}
