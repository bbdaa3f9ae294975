package com.interlockingbrick.scoring.sync;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Seam around {@link HttpClient} so reflector delivery can be tested without a network.
 */
public interface HttpClientWrapper {

    HttpResponse<String> send(HttpRequest request, HttpResponse.BodyHandler<String> bodyHandler)
            throws IOException, InterruptedException;

    class Default implements HttpClientWrapper {
        private final HttpClient httpClient;

        public Default(Duration connectTimeout) {
            this.httpClient = HttpClient.newBuilder()
                    .connectTimeout(connectTimeout)
                    .build();
        }

        @Override
        public HttpResponse<String> send(HttpRequest request, HttpResponse.BodyHandler<String> bodyHandler)
                throws IOException, InterruptedException {
            return httpClient.send(request, bodyHandler);
        }
    }
}
