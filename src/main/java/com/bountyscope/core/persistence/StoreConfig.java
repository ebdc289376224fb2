package com.bountyscope.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Provides the {@link ScanStore}: JDBC-backed when a {@link DataSource} is available
 * and its tables can be created, otherwise an in-memory store that does not survive
 * restarts.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    @Bean
    public ScanStore scanStore(ObjectProvider<DataSource> dataSource) {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory scan store (runs will not persist across restarts)");
            return new InMemoryScanStore();
        }
        var store = new JdbcScanStore(ds);
        try {
            store.createTables();
            log.info("Configured JDBC scan store");
            return store;
        } catch (SQLException e) {
            log.error("Could not prepare scan store tables, falling back to in-memory store: {}", e.getMessage(), e);
            return new InMemoryScanStore();
        }
    }
}
