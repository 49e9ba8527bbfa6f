package fr.lapetina.factcheck.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.factcheck.domain.model.CheckResult;
import fr.lapetina.factcheck.domain.model.SearchResult;

import java.time.Instant;
import java.util.List;

/**
 * JSON view of a {@link CheckResult}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CheckResponseDto {

    @JsonProperty("check_id")
    private String checkId;

    private String result;

    @JsonProperty("query_text")
    private String queryText;

    private Integer rating;
    private String confidence;
    private String status;
    private String model;
    private List<Reference> references;

    @JsonProperty("error_category")
    private String errorCategory;

    @JsonProperty("completed_at")
    private Instant completedAt;

    // Getters and setters
    public String getCheckId() { return checkId; }
    public void setCheckId(String checkId) { this.checkId = checkId; }

    public String getResult() { return result; }
    public void setResult(String result) { this.result = result; }

    public String getQueryText() { return queryText; }
    public void setQueryText(String queryText) { this.queryText = queryText; }

    public Integer getRating() { return rating; }
    public void setRating(Integer rating) { this.rating = rating; }

    public String getConfidence() { return confidence; }
    public void setConfidence(String confidence) { this.confidence = confidence; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getModel() { return model; }
    public void setModel(String model) { this.model = model; }

    public List<Reference> getReferences() { return references; }
    public void setReferences(List<Reference> references) { this.references = references; }

    public String getErrorCategory() { return errorCategory; }
    public void setErrorCategory(String errorCategory) { this.errorCategory = errorCategory; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public static CheckResponseDto fromCheckResult(String checkId, CheckResult result) {
        CheckResponseDto dto = new CheckResponseDto();
        dto.setCheckId(checkId);
        dto.setResult(result.result());
        dto.setQueryText(result.queryText());
        dto.setRating(result.rating());
        if (result.confidence() != null) {
            dto.setConfidence(result.confidence().getLabel());
        }
        dto.setStatus(result.status().name());
        dto.setModel(result.model());
        dto.setReferences(result.references().stream().map(Reference::of).toList());
        if (result.errorCategory() != null) {
            dto.setErrorCategory(result.errorCategory().name());
        }
        dto.setCompletedAt(result.completedAt());
        return dto;
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Reference(String title, String url, String domain, String date) {
        static Reference of(SearchResult result) {
            return new Reference(result.title(), result.url(), result.domain(), result.date());
        }
    }
}
