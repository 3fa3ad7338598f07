package com.forecastsync.service.http;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

public record TrustStoreSettings(Path path, String password, String type) {
    static final String PATH_VARIABLE = "FORECAST_TRUSTSTORE_PATH";
    static final String PASSWORD_VARIABLE = "FORECAST_TRUSTSTORE_PASSWORD";
    static final String TYPE_VARIABLE = "FORECAST_TRUSTSTORE_TYPE";

    public TrustStoreSettings {
        if (path == null) {
            throw new IllegalStateException(PATH_VARIABLE + " is required");
        }
        if (password == null) {
            throw new IllegalStateException(PASSWORD_VARIABLE + " must be set when " + PATH_VARIABLE + " is configured");
        }
        type = type == null || type.isBlank() ? typeFromExtension(path) : type.trim().toUpperCase(Locale.ROOT);
    }

    public static Optional<TrustStoreSettings> fromEnvironment(Map<String, String> environment) {
        String path = environment.get(PATH_VARIABLE);
        if (path == null || path.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(new TrustStoreSettings(
                Path.of(path.trim()),
                environment.get(PASSWORD_VARIABLE),
                environment.get(TYPE_VARIABLE)
        ));
    }

    private static String typeFromExtension(Path path) {
        String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12")) {
            return "PKCS12";
        }
        return "JKS";
    }
}
