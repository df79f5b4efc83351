package com.carelog.r2dbc.config;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.r2dbc.core.DatabaseClient;

import com.carelog.core.store.LegacyAggregateStore;
import com.carelog.r2dbc.store.R2dbcLegacyAggregateStore;

/**
 * Resolves the legacy aggregate capability once, when the context starts.
 *
 * <p>Callers never branch on a missing table at runtime: they receive either the
 * R2DBC-backed store or {@link LegacyAggregateStore#disabled()}.</p>
 */
@Configuration
@EnableConfigurationProperties(LegacyAggregateProperties.class)
public class LegacyAggregateConfig {

    private static final Logger log = LoggerFactory.getLogger(LegacyAggregateConfig.class);

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(10);

    @Bean
    @DependsOnDatabaseInitialization
    public LegacyAggregateStore legacyAggregateStore(DatabaseClient db, LegacyAggregateProperties props) {
        boolean enabled = switch (props.getMode()) {
            case ENABLED -> true;
            case DISABLED -> false;
            case AUTO -> memoriesTableExists(db);
        };

        log.info("Legacy aggregate (mode={}, enabled={})", props.getMode(), enabled);
        return enabled ? new R2dbcLegacyAggregateStore(db) : LegacyAggregateStore.disabled();
    }

    private static boolean memoriesTableExists(DatabaseClient db) {
        String sql = "SELECT COUNT(*) AS n FROM information_schema.tables "
                + "WHERE table_schema = current_schema() AND table_name = 'memories'";
        Long count = db.sql(sql).map((row, meta) -> row.get("n", Long.class)).one().block(PROBE_TIMEOUT);
        return count != null && count > 0;
    }
}
