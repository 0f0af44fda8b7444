package com.ella.insights.exceptions;

/**
 * Raised by a single forecasting method that cannot produce a usable value for its input.
 * Never escapes the forecasting service.
 */
public class ForecastingException extends RuntimeException {

    public ForecastingException(String message) {
        super(message);
    }

    public ForecastingException(String message, Throwable cause) {
        super(message, cause);
    }
}
