package com.forecastsync.core.error;

public class NetworkException extends ForecastException {
    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
