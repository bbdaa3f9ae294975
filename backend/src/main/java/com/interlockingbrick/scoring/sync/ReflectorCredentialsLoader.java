package com.interlockingbrick.scoring.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Loads reflector credentials at startup, from properties first and then from the
 * credentials file. Without either the dispatcher keeps buffering until an operator
 * supplies credentials.
 */
@Component
public class ReflectorCredentialsLoader {
    private static final Logger log = LoggerFactory.getLogger(ReflectorCredentialsLoader.class);

    private final SyncDispatcher dispatcher;
    private final ObjectMapper objectMapper;
    private final String credentialsFile;
    private final ReflectorCredentials fromProperties;

    public ReflectorCredentialsLoader(SyncDispatcher dispatcher,
                                      ObjectMapper objectMapper,
                                      @Value("${scoring.sync.credentials-file:sync.json}") String credentialsFile,
                                      @Value("${scoring.sync.url:}") String syncUrl,
                                      @Value("${scoring.sync.event-code:}") String eventCode,
                                      @Value("${scoring.sync.apikey:}") String apikey) {
        this.dispatcher = dispatcher;
        this.objectMapper = objectMapper;
        this.credentialsFile = credentialsFile;
        this.fromProperties = new ReflectorCredentials(syncUrl, eventCode, apikey);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOnStartup() {
        Optional<ReflectorCredentials> creds = load();
        if (creds.isPresent()) {
            dispatcher.configure(creds.get());
        } else {
            log.info("[Sync][Credentials] none found, messages will be buffered until configured");
        }
    }

    public Optional<ReflectorCredentials> load() {
        if (fromProperties.isComplete()) {
            log.info("[Sync][Credentials] using scoring.sync.* properties");
            return Optional.of(fromProperties);
        }
        if (credentialsFile == null || credentialsFile.isBlank()) return Optional.empty();
        Path path = Paths.get(credentialsFile.trim());
        if (!Files.isRegularFile(path)) {
            log.debug("[Sync][Credentials] no file at {}", path.toAbsolutePath());
            return Optional.empty();
        }
        try {
            ReflectorCredentials creds = objectMapper.readValue(path.toFile(), ReflectorCredentials.class);
            if (!creds.isComplete()) {
                log.warn("[Sync][Credentials] {} is missing sync_url, event_code or apikey", path);
                return Optional.empty();
            }
            log.info("[Sync][Credentials] loaded from {}", path.toAbsolutePath());
            return Optional.of(creds);
        } catch (IOException e) {
            log.warn("[Sync][Credentials] cannot read {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
