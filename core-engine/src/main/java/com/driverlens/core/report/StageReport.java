package com.driverlens.core.report;

import com.driverlens.core.error.ErrorEnvelope;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Common shape of a persisted stage result.
 *
 * <p>
 * A successful report carries only its data. A failed report carries its
 * type's empty collection plus the {@link ErrorEnvelope} fields
 * ({@code error_state}, {@code error_message}, {@code user_message},
 * {@code stage}, {@code suggestions} and, when known, {@code technical_details})
 * at the top level, so a consumer can test
 * {@code error_state} before reading the data.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class StageReport {

    private Boolean errorState;
    private String errorMessage;
    private String userMessage;
    private String stage;
    private List<String> suggestions;
    private String technicalDetails;

    /**
     * Copy the envelope's fields onto this report.
     *
     * @param envelope the failure description
     */
    protected void applyEnvelope(ErrorEnvelope envelope) {
        Objects.requireNonNull(envelope, "envelope must not be null");
        this.errorState = Boolean.TRUE;
        this.errorMessage = envelope.getErrorMessage();
        this.userMessage = envelope.getUserMessage();
        this.stage = envelope.getStage();
        this.suggestions = envelope.getSuggestions();
        this.technicalDetails = envelope.getTechnicalDetails();
    }

    /**
     * @return {@code true} if this report stands in for a failed stage
     */
    @JsonIgnore
    public boolean isFailed() {
        return Boolean.TRUE.equals(errorState);
    }

    /**
     * @return the envelope carried by a failed report
     */
    @JsonIgnore
    public Optional<ErrorEnvelope> getEnvelope() {
        if (!isFailed()) {
            return Optional.empty();
        }
        return Optional.of(new ErrorEnvelope(
                errorMessage != null ? errorMessage : "",
                userMessage != null ? userMessage : "",
                stage != null ? stage : "",
                suggestions,
                technicalDetails));
    }

    // ---------------------------------------------------------------
    // Envelope fields
    // ---------------------------------------------------------------

    @JsonProperty("error_state")
    public Boolean getErrorState() {
        return errorState;
    }

    @JsonProperty("error_state")
    public void setErrorState(Boolean errorState) {
        this.errorState = errorState;
    }

    @JsonProperty("error_message")
    public String getErrorMessage() {
        return errorMessage;
    }

    @JsonProperty("error_message")
    public void setErrorMessage(String errorMessage) {
        this.errorMessage = errorMessage;
    }

    @JsonProperty("user_message")
    public String getUserMessage() {
        return userMessage;
    }

    @JsonProperty("user_message")
    public void setUserMessage(String userMessage) {
        this.userMessage = userMessage;
    }

    @JsonProperty("stage")
    public String getStage() {
        return stage;
    }

    @JsonProperty("stage")
    public void setStage(String stage) {
        this.stage = stage;
    }

    @JsonProperty("suggestions")
    public List<String> getSuggestions() {
        return suggestions;
    }

    @JsonProperty("suggestions")
    public void setSuggestions(List<String> suggestions) {
        this.suggestions = suggestions;
    }

    @JsonProperty("technical_details")
    public String getTechnicalDetails() {
        return technicalDetails;
    }

    @JsonProperty("technical_details")
    public void setTechnicalDetails(String technicalDetails) {
        this.technicalDetails = technicalDetails;
    }
}
