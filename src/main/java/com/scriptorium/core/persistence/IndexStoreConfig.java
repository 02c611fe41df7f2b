package com.scriptorium.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Provides the {@link IndexStore} bean.
 * <p>
 * When a {@link DataSource} is available (i.e. PostgreSQL is configured), a
 * {@link JdbcIndexStore} is created. Otherwise an in-memory store is used as a
 * fallback -- suitable for development and testing but not durable across restarts.
 */
@Configuration
public class IndexStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(IndexStoreConfig.class);

    @Bean
    public IndexStore indexStore(ObjectProvider<DataSource> dataSource) throws Exception {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory index store (state will not persist across restarts)");
            return new InMemoryIndexStore();
        }
        log.info("Configuring JDBC index store");
        var store = new JdbcIndexStore(ds);
        store.createTables();
        return store;
    }
}
