package com.forecastsync.service.http;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.OutputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpClientFactoryTest {
    @TempDir
    Path tempDir;

    @Test
    void providerTimeoutBecomesConnectTimeout() {
        HttpClient client = HttpClientFactory.forProvider(Duration.ofSeconds(7), Optional.empty());

        assertEquals(HttpClient.Redirect.NORMAL, client.followRedirects());
        assertEquals(Duration.ofSeconds(7), client.connectTimeout().orElseThrow());
    }

    @Test
    void failsWhenTruststoreFileIsMissing() {
        TrustStoreSettings settings = new TrustStoreSettings(tempDir.resolve("does-not-exist.jks"), "changeit", null);

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> HttpClientFactory.forProvider(Duration.ofSeconds(1), Optional.of(settings)));
        assertTrue(ex.getMessage().contains("Truststore file does not exist"));
    }

    @Test
    void createsClientWithPkcs12TruststoreFromEnvironment() throws Exception {
        Path truststore = tempDir.resolve("truststore.p12");
        writeEmptyTruststore(truststore, "PKCS12", "changeit".toCharArray());

        Optional<TrustStoreSettings> settings = TrustStoreSettings.fromEnvironment(Map.of(
                "FORECAST_TRUSTSTORE_PATH", truststore.toString(),
                "FORECAST_TRUSTSTORE_PASSWORD", "changeit"
        ));
        HttpClient client = HttpClientFactory.forProvider(Duration.ofSeconds(1), settings);

        assertEquals("PKCS12", settings.orElseThrow().type());
        assertNotNull(client.sslContext());
    }

    @Test
    void failsWithWrongTruststorePassword() throws Exception {
        Path truststore = tempDir.resolve("truststore.jks");
        writeEmptyTruststore(truststore, "JKS", "correct-password".toCharArray());
        TrustStoreSettings settings = new TrustStoreSettings(truststore, "wrong-password", null);

        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> HttpClientFactory.forProvider(Duration.ofSeconds(1), Optional.of(settings)));
        assertTrue(ex.getMessage().contains("Failed to build SSL context from JKS truststore"));
    }

    static void writeEmptyTruststore(Path file, String type, char[] password) throws Exception {
        KeyStore keyStore = KeyStore.getInstance(type);
        keyStore.load(null, password);
        try (OutputStream out = Files.newOutputStream(file)) {
            keyStore.store(out, password);
        }
    }
}
