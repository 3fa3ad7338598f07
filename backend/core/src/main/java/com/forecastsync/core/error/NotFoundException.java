package com.forecastsync.core.error;

public class NotFoundException extends ForecastException {
    public NotFoundException(String message) {
        super(message);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
