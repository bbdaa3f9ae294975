package com.interlockingbrick.scoring.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.interlockingbrick.scoring.error.SyncDeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Posts JSON bodies to the reflector. Only the status code of a response is looked at.
 */
public class ReflectorClient {
    private static final Logger log = LoggerFactory.getLogger(ReflectorClient.class);

    private final HttpClientWrapper httpClient;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public ReflectorClient(HttpClientWrapper httpClient, ObjectMapper objectMapper, Duration timeout) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    /**
     * @return the 2xx status code returned by the reflector
     * @throws SyncDeliveryException on a non-2xx status, timeout or network failure
     */
    public int post(ReflectorCredentials credentials, String endpoint, Object body) {
        String url = credentials.baseUrl() + endpoint;
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new SyncDeliveryException("Cannot serialize body for " + endpoint, e);
        }
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("apikey", credentials.apikey())
                    .POST(HttpRequest.BodyPublishers.ofString(json))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new SyncDeliveryException("Invalid reflector url " + url, e);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SyncDeliveryException("POST " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SyncDeliveryException("POST " + endpoint + " interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new SyncDeliveryException("POST " + endpoint + " returned HTTP " + status, status);
        }
        log.debug("[Sync][Post] endpoint={} status={}", endpoint, status);
        return status;
    }
}
