package com.driverlens.core.error;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * User-presentable description of a failed stage.
 *
 * <p>
 * Merged into a stage report in place of its data so that downstream
 * consumers can check {@code error_state} rather than crash. An envelope
 * built from an exception also carries its stack trace as
 * {@code technical_details}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(value = "error_state", allowGetters = true)
public final class ErrorEnvelope {

    /** Generic remediation hints attached to every envelope. */
    public static final List<String> DEFAULT_SUGGESTIONS = List.of(
            "Check that the input data is in the expected format",
            "Make sure all required files and columns are present",
            "Check the logs for more specific technical details");

    private final String errorMessage;
    private final String userMessage;
    private final String stage;
    private final List<String> suggestions;
    private final String technicalDetails;

    public ErrorEnvelope(String errorMessage, String userMessage, String stage, List<String> suggestions) {
        this(errorMessage, userMessage, stage, suggestions, null);
    }

    @JsonCreator
    public ErrorEnvelope(@JsonProperty("error_message") String errorMessage,
            @JsonProperty("user_message") String userMessage,
            @JsonProperty("stage") String stage,
            @JsonProperty("suggestions") List<String> suggestions,
            @JsonProperty("technical_details") String technicalDetails) {
        this.errorMessage = Objects.requireNonNull(errorMessage, "errorMessage must not be null");
        this.userMessage = Objects.requireNonNull(userMessage, "userMessage must not be null");
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
        this.suggestions = suggestions != null ? List.copyOf(suggestions) : DEFAULT_SUGGESTIONS;
        this.technicalDetails = technicalDetails;
    }

    /**
     * Translate an {@link AnalysisError} into its envelope.
     *
     * @param error the failure
     * @return envelope with the category's user message, default suggestions
     *         and the stack trace of the originating exception, if any
     */
    public static ErrorEnvelope from(AnalysisError error) {
        Objects.requireNonNull(error, "error must not be null");
        return new ErrorEnvelope(error.getMessage(),
                error.getCategory().getUserMessage(),
                error.getStage().getStageName(),
                DEFAULT_SUGGESTIONS,
                error.getTechnicalDetails());
    }

    @JsonProperty("error_state")
    public boolean isErrorState() {
        return true;
    }

    @JsonProperty("error_message")
    public String getErrorMessage() {
        return errorMessage;
    }

    @JsonProperty("user_message")
    public String getUserMessage() {
        return userMessage;
    }

    @JsonProperty("stage")
    public String getStage() {
        return stage;
    }

    @JsonProperty("suggestions")
    public List<String> getSuggestions() {
        return suggestions;
    }

    @JsonProperty("technical_details")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public String getTechnicalDetails() {
        return technicalDetails;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ErrorEnvelope that))
            return false;
        return errorMessage.equals(that.errorMessage)
                && userMessage.equals(that.userMessage)
                && stage.equals(that.stage)
                && suggestions.equals(that.suggestions)
                && Objects.equals(technicalDetails, that.technicalDetails);
    }

    @Override
    public int hashCode() {
        return Objects.hash(errorMessage, userMessage, stage, suggestions, technicalDetails);
    }

    @Override
    public String toString() {
        return "ErrorEnvelope{stage='" + stage + "', errorMessage='" + errorMessage + "'}";
    }
}
