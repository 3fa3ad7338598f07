package com.forecastsync.core.error;

public class InvalidInputException extends ForecastException {
    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
