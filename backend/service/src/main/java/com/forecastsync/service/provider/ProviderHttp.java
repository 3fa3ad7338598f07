package com.forecastsync.service.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.forecastsync.core.error.DecodeException;
import com.forecastsync.core.error.NetworkException;
import com.forecastsync.core.error.ProviderException;
import com.forecastsync.core.util.JsonUtils;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

final class ProviderHttp {
    private final HttpClient httpClient;
    private final Duration timeout;
    private final String accept;
    private final String userAgent;

    ProviderHttp(HttpClient httpClient, Duration timeout, String accept, String userAgent) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        this.accept = accept;
        this.userAgent = userAgent;
    }

    JsonNode getJson(URI uri, String redactedUri) {
        int attempts = 0;
        while (true) {
            attempts++;
            HttpRequest request = HttpRequest.newBuilder(uri)
                    .GET()
                    .timeout(timeout)
                    .header("Accept", accept)
                    .header("User-Agent", userAgent)
                    .build();
            HttpResponse<String> response;
            try {
                response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            } catch (IOException e) {
                throw new NetworkException("Request failed for " + redactedUri + ": " + describe(e), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new NetworkException("Interrupted while requesting " + redactedUri, e);
            }
            int status = response.statusCode();
            if (status / 100 == 2) {
                return parse(response.body(), redactedUri);
            }
            if (attempts >= 2 || status < 500) {
                throw new ProviderException("Request failed with status " + status + " for " + redactedUri, status);
            }
        }
    }

    JsonNode getJson(URI uri) {
        return getJson(uri, uri.toString());
    }

    private static JsonNode parse(String body, String redactedUri) {
        try {
            JsonNode node = JsonUtils.objectMapper().readTree(body);
            if (node == null || node.isMissingNode()) {
                throw new DecodeException("Empty response body from " + redactedUri);
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new DecodeException("Malformed JSON from " + redactedUri, e);
        }
    }

    private static String describe(IOException e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
