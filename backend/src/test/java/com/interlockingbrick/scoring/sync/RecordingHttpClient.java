package com.interlockingbrick.scoring.sync;

import javax.net.ssl.SSLSession;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Flow;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * In-memory reflector: records every request and answers with whatever {@link #respond} decides.
 */
class RecordingHttpClient implements HttpClientWrapper {

    record Call(String path, String apikey, String body, Duration timeout) {}

    interface Responder {
        int statusFor(Call call) throws IOException;
    }

    final BlockingQueue<Call> calls = new LinkedBlockingQueue<>();
    volatile Responder respond = call -> 200;

    @Override
    public HttpResponse<String> send(HttpRequest request, HttpResponse.BodyHandler<String> bodyHandler) throws IOException {
        Call call = new Call(request.uri().getPath(),
                request.headers().firstValue("apikey").orElse(null),
                bodyOf(request),
                request.timeout().orElse(null));
        calls.add(call);
        return new StubResponse(request, respond.statusFor(call));
    }

    Call next() throws InterruptedException {
        return calls.poll(5, TimeUnit.SECONDS);
    }

    static String bodyOf(HttpRequest request) {
        HttpRequest.BodyPublisher publisher = request.bodyPublisher().orElseThrow();
        HttpResponse.BodySubscriber<String> subscriber = HttpResponse.BodySubscribers.ofString(StandardCharsets.UTF_8);
        publisher.subscribe(new Flow.Subscriber<ByteBuffer>() {
            @Override public void onSubscribe(Flow.Subscription subscription) { subscriber.onSubscribe(subscription); }
            @Override public void onNext(ByteBuffer item) { subscriber.onNext(List.of(item)); }
            @Override public void onError(Throwable throwable) { subscriber.onError(throwable); }
            @Override public void onComplete() { subscriber.onComplete(); }
        });
        return subscriber.getBody().toCompletableFuture().join();
    }

    private record StubResponse(HttpRequest request, int statusCode) implements HttpResponse<String> {
        @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(java.util.Map.of(), (a, b) -> true); }
        @Override public String body() { return ""; }
        @Override public Optional<SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return request.uri(); }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }
}
