package com.interlockingbrick.scoring.sync;

import java.time.Instant;

public record SyncHealth(boolean credentialsConfigured,
                         boolean workerAlive,
                         boolean stopped,
                         int queueDepth,
                         long delivered,
                         long failed,
                         long dropped,
                         int restarts,
                         String lastError,
                         Instant lastErrorAt) {}
