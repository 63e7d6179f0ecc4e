package org.timberline.pipeline.api.calculator;

/**
 * Thrown by a Calculator when it cannot produce any result for its input.
 * Failures of individual results are reported as {@link CalculationError}s instead.
 */
public class CalculationException extends Exception {

    public CalculationException(String message) {
        super(message);
    }

    public CalculationException(String message, Throwable cause) {
        super(message, cause);
    }
}
