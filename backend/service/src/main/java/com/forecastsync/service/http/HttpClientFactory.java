package com.forecastsync.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Optional;

public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    public static HttpClient forProvider(Duration timeout, Optional<TrustStoreSettings> trustStore) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        trustStore.map(HttpClientFactory::sslContext).ifPresent(builder::sslContext);
        return builder.build();
    }

    static SSLContext sslContext(TrustStoreSettings settings) {
        if (!Files.exists(settings.path())) {
            throw new IllegalStateException("Truststore file does not exist: " + settings.path());
        }
        try (InputStream in = Files.newInputStream(settings.path())) {
            KeyStore trustStore = KeyStore.getInstance(settings.type());
            trustStore.load(in, settings.password().toCharArray());

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(trustStore);

            SSLContext sslContext = SSLContext.getInstance("TLS");
            sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
            return sslContext;
        } catch (IOException | GeneralSecurityException e) {
            throw new IllegalStateException("Failed to build SSL context from " + settings.type()
                    + " truststore " + settings.path(), e);
        }
    }
}
