package com.provenant.core.persistence;

import com.provenant.core.audit.AuditStore;
import com.provenant.core.audit.InMemoryAuditStore;
import com.provenant.core.audit.JdbcAuditStore;
import com.provenant.core.keys.InMemoryKeyRecordStore;
import com.provenant.core.keys.JdbcKeyRecordStore;
import com.provenant.core.keys.KeyRecordStore;
import com.provenant.core.signing.InMemorySigningRequestStore;
import com.provenant.core.signing.JdbcSigningRequestStore;
import com.provenant.core.signing.SigningRequestStore;
import com.provenant.core.suspension.InMemorySuspensionStore;
import com.provenant.core.suspension.JdbcSuspensionStore;
import com.provenant.core.suspension.SuspensionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;

/**
 * Spring {@link Configuration} that picks the durable stores.
 * <p>
 * When a {@link DataSource} is available (i.e. PostgreSQL is configured), the audit chain,
 * key records, signing requests with their votes, and suspension records are persisted
 * through JDBC. Otherwise in-memory
 * stores are used as a fallback -- suitable for development and testing but not durable
 * across restarts.
 */
@Configuration
public class PersistenceConfig {

    private static final Logger log = LoggerFactory.getLogger(PersistenceConfig.class);

    @Bean
    public AuditStore auditStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.warn("No DataSource available; using in-memory audit log (the chain will not survive a restart)");
            return new InMemoryAuditStore();
        }
        log.info("Configuring JDBC audit store");
        var store = new JdbcAuditStore(ds);
        store.createTables();
        return store;
    }

    @Bean
    public KeyRecordStore keyRecordStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory key record store");
            return new InMemoryKeyRecordStore();
        }
        var store = new JdbcKeyRecordStore(ds);
        store.createTables();
        return store;
    }

    @Bean
    public SigningRequestStore signingRequestStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.warn("No DataSource available; using in-memory signing requests (pending votes will not survive a restart)");
            return new InMemorySigningRequestStore();
        }
        var store = new JdbcSigningRequestStore(ds);
        store.createTables();
        return store;
    }

    @Bean
    public SuspensionStore suspensionStore(ObjectProvider<DataSource> dataSource) throws SQLException {
        DataSource ds = dataSource.getIfAvailable();
        if (ds == null) {
            log.info("No DataSource available; using in-memory suspension store");
            return new InMemorySuspensionStore();
        }
        var store = new JdbcSuspensionStore(ds);
        store.createTables();
        return store;
    }
}
