package fr.lapetina.factcheck.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/check}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class CheckRequestDto {

    private String text;

    @JsonProperty("check_id")
    private String checkId;

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public String getCheckId() { return checkId; }
    public void setCheckId(String checkId) { this.checkId = checkId; }
}
