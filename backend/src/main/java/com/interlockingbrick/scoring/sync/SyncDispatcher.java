package com.interlockingbrick.scoring.sync;

import com.interlockingbrick.scoring.error.SyncDeliveryException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Relays event state to the reflector from a single background worker.
 *
 * <p>Producers call {@link #enqueue(SyncMessage)} and never block. The worker waits until
 * credentials are configured, then delivers messages in FIFO order, one HTTP POST each, without
 * retries. A failed delivery is logged and counted; the worker moves on to the next message.
 * If the worker thread dies anyway, {@link #superviseWorker()} starts a new one.
 */
@Component
public class SyncDispatcher {
    private static final Logger log = LoggerFactory.getLogger(SyncDispatcher.class);

    static final String WORKER_NAME = "reflector-sync";
    static final String SYNC_ENDPOINT = "/sync";

    private final ReflectorClient client;
    private final BlockingQueue<SyncMessage> queue;
    private final CountDownLatch credentialsReady = new CountDownLatch(1);
    private final Object lifecycleLock = new Object();

    private volatile ReflectorCredentials credentials;
    private volatile Thread worker;
    private volatile boolean started;
    private volatile boolean stopped;

    private final AtomicLong delivered = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicInteger restarts = new AtomicInteger();
    private volatile String lastError;
    private volatile Instant lastErrorAt;

    public SyncDispatcher(ReflectorClient client,
                          @Value("${scoring.sync.queue-capacity:10000}") int queueCapacity) {
        this.client = client;
        this.queue = new LinkedBlockingQueue<>(Math.max(1, queueCapacity));
    }

    @PostConstruct
    public void start() {
        synchronized (lifecycleLock) {
            if (started) return;
            started = true;
            startWorker();
        }
    }

    /**
     * Supplies the reflector credentials and releases the worker. Later calls replace the
     * credentials used for subsequent deliveries.
     */
    public void configure(ReflectorCredentials credentials) {
        if (credentials == null || !credentials.isComplete()) {
            throw new IllegalArgumentException("sync_url, event_code and apikey are required");
        }
        this.credentials = credentials;
        credentialsReady.countDown();
        log.info("[Sync][Configure] base={}", credentials.baseUrl());
    }

    public boolean isConfigured() {
        return credentials != null;
    }

    /**
     * Queues a message for delivery without blocking.
     *
     * @return false when the message was dropped (dispatcher stopped or queue full)
     */
    public boolean enqueue(SyncMessage message) {
        // stop() flips the flag under the same lock, so nothing lands behind the stop message
        synchronized (lifecycleLock) {
            if (stopped) {
                dropped.incrementAndGet();
                log.warn("[Sync][Enqueue] rejected after stop: {}", message);
                return false;
            }
            if (!queue.offer(message)) {
                dropped.incrementAndGet();
                log.warn("[Sync][Enqueue] queue full (capacity={}), dropping {}", queue.size(), message);
                return false;
            }
        }
        log.debug("[Sync][Enqueue] {} depth={}", message, queue.size());
        return true;
    }

    /**
     * Posts a full snapshot to the reflector on the caller thread, bypassing the queue.
     *
     * @return true when the reflector accepted it
     */
    public boolean forceSync(EventSnapshot snapshot) {
        ReflectorCredentials creds = this.credentials;
        if (creds == null) {
            log.warn("[Sync][Force] skipped, credentials not configured");
            return false;
        }
        try {
            int status = client.post(creds, SYNC_ENDPOINT, snapshot);
            log.info("[Sync][Force] match={} teams={} status={}", snapshot.match(), snapshot.teams().size(), status);
            return true;
        } catch (SyncDeliveryException e) {
            recordError(e.getMessage());
            log.warn("[Sync][Force] failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Restarts the worker if it died. Runs on the scheduler.
     */
    @Scheduled(fixedDelayString = "${scoring.sync.supervise-interval-ms:5000}")
    public void superviseWorker() {
        synchronized (lifecycleLock) {
            if (!started || stopped) return;
            Thread current = worker;
            if (current != null && current.isAlive()) return;
            int n = restarts.incrementAndGet();
            log.error("[Sync][Supervisor] worker not running, restarting (restart #{}) depth={}", n, queue.size());
            startWorker();
        }
    }

    public SyncHealth health() {
        Thread current = worker;
        return new SyncHealth(
                credentials != null,
                current != null && current.isAlive(),
                stopped,
                queue.size(),
                delivered.get(),
                failed.get(),
                dropped.get(),
                restarts.get(),
                lastError,
                lastErrorAt);
    }

    /**
     * Asks the worker to finish the queued messages and exit. Enqueues after this are rejected.
     */
    @PreDestroy
    public void stop() {
        Thread current;
        synchronized (lifecycleLock) {
            if (stopped) return;
            stopped = true;
            current = worker;
        }
        boolean queued = queue.offer(SyncMessages.STOP);
        if (current == null) return;
        if (!queued || credentialsReady.getCount() > 0) {
            // the worker cannot reach the stop message
            current.interrupt();
        }
        log.info("[Sync][Stop] pending={} delivered={} failed={}", queue.size(), delivered.get(), failed.get());
    }

    private void startWorker() {
        Thread t = new Thread(this::runWorker, WORKER_NAME);
        t.setDaemon(true);
        t.setUncaughtExceptionHandler((thread, e) -> {
            recordError(e.toString());
            log.error("[Sync][Worker] {} died", thread.getName(), e);
        });
        worker = t;
        t.start();
    }

    private void runWorker() {
        try {
            credentialsReady.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[Sync][Worker] interrupted before credentials arrived");
            return;
        }
        log.info("[Sync][Worker] started, depth={}", queue.size());
        while (true) {
            SyncMessage message;
            try {
                message = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.info("[Sync][Worker] interrupted, exiting");
                return;
            }
            if (message == SyncMessages.STOP) {
                log.info("[Sync][Worker] stop received");
                return;
            }
            deliver(message);
        }
    }

    private void deliver(SyncMessage message) {
        try {
            int status = client.post(credentials, message.endpoint(), message.body());
            delivered.incrementAndGet();
            log.info("[Sync][Deliver] endpoint={} status={}", message.endpoint(), status);
        } catch (SyncDeliveryException e) {
            failed.incrementAndGet();
            recordError(e.getMessage());
            log.warn("[Sync][Deliver] endpoint={} failed: {}", message.endpoint(), e.getMessage());
        } catch (RuntimeException e) {
            failed.incrementAndGet();
            recordError(e.toString());
            log.warn("[Sync][Deliver] endpoint={} unexpected error", message.endpoint(), e);
        }
    }

    private void recordError(String error) {
        lastError = error;
        lastErrorAt = Instant.now();
    }
}
