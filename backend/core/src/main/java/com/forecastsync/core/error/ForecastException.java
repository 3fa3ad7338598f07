package com.forecastsync.core.error;

public abstract class ForecastException extends RuntimeException {
    protected ForecastException(String message) {
        super(message);
    }

    protected ForecastException(String message, Throwable cause) {
        super(message, cause);
    }

    public static ForecastException unwrap(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof ForecastException forecastException) {
                return forecastException;
            }
            current = current.getCause();
        }
        return null;
    }
}
