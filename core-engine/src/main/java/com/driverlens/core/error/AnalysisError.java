package com.driverlens.core.error;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * A batch-level failure of one statistical stage.
 *
 * <p>
 * Produced at the operation boundary by
 * {@link AnalysisResult#capture(AnalysisStage, java.util.function.Supplier)}
 * and translated for presentation by {@link ErrorEnvelope#from(AnalysisError)}.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisError {

    private final AnalysisStage stage;
    private final ErrorCategory category;
    private final String message;
    private final Throwable cause;

    private AnalysisError(AnalysisStage stage, ErrorCategory category, String message, Throwable cause) {
        this.stage = Objects.requireNonNull(stage, "stage must not be null");
        this.category = Objects.requireNonNull(category, "category must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.cause = cause;
    }

    /**
     * Build an error from a caught exception.
     *
     * @param stage   the failing stage
     * @param failure the exception
     * @return error categorised by {@link ErrorCategory#classify(Throwable)}
     */
    public static AnalysisError of(AnalysisStage stage, Throwable failure) {
        Objects.requireNonNull(failure, "failure must not be null");
        String message = failure.getMessage() != null
                ? failure.getMessage()
                : failure.getClass().getName();
        return new AnalysisError(stage, ErrorCategory.classify(failure), message, failure);
    }

    /**
     * Build an error that was detected without an exception.
     */
    public static AnalysisError of(AnalysisStage stage, ErrorCategory category, String message) {
        return new AnalysisError(stage, category, message, null);
    }

    public AnalysisStage getStage() {
        return stage;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    /**
     * @return machine-oriented error text
     */
    public String getMessage() {
        return message;
    }

    /**
     * @return the originating exception, or {@code null}
     */
    public Throwable getCause() {
        return cause;
    }

    /**
     * @return the originating exception's stack trace, or {@code null} when
     *         the error was not raised by an exception
     */
    public String getTechnicalDetails() {
        if (cause == null) {
            return null;
        }
        StringWriter trace = new StringWriter();
        cause.printStackTrace(new PrintWriter(trace));
        return trace.toString();
    }

    @Override
    public String toString() {
        return "AnalysisError{stage=" + stage + ", category=" + category + ", message='" + message + "'}";
    }
}
