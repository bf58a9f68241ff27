package com.driverlens.core.error;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Outcome of a statistical stage: either a value or an {@link AnalysisError}.
 *
 * <p>
 * Stages return this type instead of throwing so that a batch-level failure
 * can always be turned into a renderable, envelope-carrying result.
 * {@link #capture(AnalysisStage, Supplier)} is the operation boundary where
 * runtime exceptions are converted.
 * </p>
 *
 * @param <T> success value type
 * @since 1.0.0
 */
public final class AnalysisResult<T> {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisResult.class);

    private final T value;
    private final AnalysisError error;

    private AnalysisResult(T value, AnalysisError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> AnalysisResult<T> success(T value) {
        return new AnalysisResult<>(Objects.requireNonNull(value, "value must not be null"), null);
    }

    public static <T> AnalysisResult<T> failure(AnalysisError error) {
        return new AnalysisResult<>(null, Objects.requireNonNull(error, "error must not be null"));
    }

    /**
     * Run {@code body} and convert any runtime failure into an
     * {@link AnalysisError} for {@code stage}.
     *
     * @param stage the stage being executed
     * @param body  the computation; must not return {@code null}
     * @param <T>   value type
     * @return success with the computed value, or failure
     */
    public static <T> AnalysisResult<T> capture(AnalysisStage stage, Supplier<T> body) {
        Objects.requireNonNull(stage, "stage must not be null");
        Objects.requireNonNull(body, "body must not be null");
        try {
            return success(body.get());
        } catch (RuntimeException e) {
            AnalysisError error = AnalysisError.of(stage, e);
            LOG.error("Stage [{}] failed ({}): {}", stage, error.getCategory(), error.getMessage(), e);
            return failure(error);
        }
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the success value
     * @throws NoSuchElementException if this result is a failure
     */
    public T getValue() {
        if (error != null) {
            throw new NoSuchElementException("No value present; stage failed: " + error.getMessage());
        }
        return value;
    }

    public Optional<AnalysisError> getError() {
        return Optional.ofNullable(error);
    }

    @Override
    public String toString() {
        return error == null ? "AnalysisResult.success(" + value + ")" : "AnalysisResult.failure(" + error + ")";
    }
}
