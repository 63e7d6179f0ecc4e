package org.timberline.pipeline.api.calculator;

/**
 * One derived result the Calculator failed to produce. Does not invalidate the
 * other results of the same call.
 *
 * @param resultName name of the failed result
 * @param message    human-readable reason
 * @param cause      underlying exception, may be null
 */
public record CalculationError(String resultName, String message, Throwable cause) {

    public CalculationError(String resultName, Throwable cause) {
        this(resultName, cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName(), cause);
    }

    @Override
    public String toString() {
        return resultName + ": " + message;
    }
}
