package com.forecastsync.core.error;

public class DecodeException extends ForecastException {
    public DecodeException(String message) {
        super(message);
    }

    public DecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
