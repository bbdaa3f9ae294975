package com.interlockingbrick.scoring.config;

import com.interlockingbrick.scoring.store.EventDatabase;
import com.interlockingbrick.scoring.store.EventDatabaseLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.jdbc.DataSourceBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.nio.file.Paths;
import java.time.Clock;

@Configuration
public class StoreConfig {
    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Event database the store is bound to. With location disabled (tests, explicit
     * {@code spring.datasource.url}) the name is descriptive only.
     */
    @Bean
    public EventDatabase eventDatabase(Clock clock,
                                       @Value("${scoring.store.dir:.}") String directory,
                                       @Value("${scoring.store.locate-event-db:true}") boolean locate) {
        if (!locate) {
            return new EventDatabase("in-memory", Paths.get("."), null, null);
        }
        return new EventDatabaseLocator(directory, clock).locate();
    }

    @Bean
    @ConditionalOnProperty(name = "scoring.store.locate-event-db", havingValue = "true", matchIfMissing = true)
    public DataSource dataSource(EventDatabase eventDatabase) {
        String url = eventDatabase.jdbcUrl();
        log.info("[Store][DataSource] url={}", url);
        return DataSourceBuilder.create()
                .driverClassName("org.h2.Driver")
                .url(url)
                .username("sa")
                .password("")
                .build();
    }
}
