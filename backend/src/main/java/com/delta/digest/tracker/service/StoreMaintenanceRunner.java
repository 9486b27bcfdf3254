package com.delta.digest.tracker.service;

import com.delta.digest.tracker.persistence.JdbcKeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "tracker.store", name = "backend", havingValue = "jdbc")
public class StoreMaintenanceRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StoreMaintenanceRunner.class);

    private final JdbcKeyValueStore store;

    public StoreMaintenanceRunner(JdbcKeyValueStore store) {
        this.store = store;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            int purged = store.purgeExpired();
            if (purged > 0) {
                log.info("Purged {} expired store entries", purged);
            }
        } catch (RuntimeException e) {
            log.warn("Skipping expired entry purge because the store is unreachable: {}", e.getMessage());
        }
    }
}
