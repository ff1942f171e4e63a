package com.zeus.people.service;

import com.zeus.people.service.config.EventStoreProperties;
import com.zeus.people.service.config.PeopleServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Host for the people event store, its write repositories and the command service.
 *
 * <p>Flyway creates the store's tables at startup from {@code db/migration/eventstore}; everything
 * else is wired in {@link com.zeus.people.service.config.EventStoreConfig}.
 */
@SpringBootApplication
@EnableConfigurationProperties({PeopleServiceProperties.class, EventStoreProperties.class})
public class PeopleServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(PeopleServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PeopleServiceApplication.class, args);
        log.info("People service started");
    }
}
