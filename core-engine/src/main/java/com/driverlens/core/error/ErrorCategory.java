package com.driverlens.core.error;

import com.driverlens.core.store.ArtifactNotFoundException;
import org.apache.commons.math3.exception.util.ExceptionContextProvider;

import java.io.FileNotFoundException;
import java.nio.file.NoSuchFileException;
import java.util.NoSuchElementException;

/**
 * Coarse failure categories, each with the message shown to a person reading
 * the report.
 *
 * @since 1.0.0
 */
public enum ErrorCategory {

    INVALID_VALUE("The supplied values are not valid. Check the input data."),
    MISSING_KEY("A required column was not found. Check that the column names are correct."),
    TYPE_MISMATCH("A column has an unexpected data type. Check that the data is in the expected format."),
    MISSING_FILE("A required file or artifact was not found. Check that the input paths are correct."),
    NUMERIC("A numeric computation failed. Check the numeric data for missing or constant values."),
    UNEXPECTED("An unexpected error occurred. Please retry the operation.");

    private final String userMessage;

    ErrorCategory(String userMessage) {
        this.userMessage = userMessage;
    }

    public String getUserMessage() {
        return userMessage;
    }

    /**
     * Map a failure to its category.
     *
     * <p>
     * Commons Math exceptions are checked first because several of them extend
     * {@link IllegalArgumentException}.
     * </p>
     *
     * @param failure the caught exception
     * @return the matching category, {@link #UNEXPECTED} if none matches
     */
    public static ErrorCategory classify(Throwable failure) {
        if (failure instanceof ExceptionContextProvider || failure instanceof ArithmeticException) {
            return NUMERIC;
        }
        if (failure instanceof ArtifactNotFoundException
                || failure instanceof FileNotFoundException
                || failure instanceof NoSuchFileException) {
            return MISSING_FILE;
        }
        if (failure instanceof NoSuchElementException) {
            return MISSING_KEY;
        }
        if (failure instanceof ClassCastException) {
            return TYPE_MISMATCH;
        }
        if (failure instanceof IllegalArgumentException) {
            return INVALID_VALUE;
        }
        return UNEXPECTED;
    }
}
