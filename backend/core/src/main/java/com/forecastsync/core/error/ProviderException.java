package com.forecastsync.core.error;

public class ProviderException extends ForecastException {
    private final int statusCode;

    public ProviderException(String message) {
        this(message, -1);
    }

    public ProviderException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    // -1 when the failure did not come from a response
    public int statusCode() {
        return statusCode;
    }
}
