package com.di.geoingest.util;

import com.di.geoingest.config.DbConfigSnapshot;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Builds a small HikariCP pool for one relational sync. The caller owns the pool and closes it
 * when the sync ends.
 */
@Slf4j
public final class HikariPoolFactory {

    private static final AtomicInteger POOL_ID = new AtomicInteger();

    private HikariPoolFactory() {}

    public static HikariDataSource create(DbConfigSnapshot snapshot) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(snapshot.jdbcUrl());
        config.setUsername(snapshot.username());
        config.setPassword(snapshot.password());
        config.setDriverClassName("org.postgresql.Driver");
        config.setMaximumPoolSize(snapshot.maximumPoolSize());
        config.setMinimumIdle(1);
        config.setConnectionTimeout(snapshot.connectionTimeoutMs());

        // Cursor-based fetches need a transaction
        config.setAutoCommit(false);
        config.addDataSourceProperty("tcpKeepAlive", "true");
        config.setPoolName("geoingest-" + POOL_ID.incrementAndGet() + "-" + snapshot.database());

        log.info("[POOL] Creating pool {} for {} (user: {})",
                config.getPoolName(), snapshot.displayUrl(), snapshot.username());
        return new HikariDataSource(config);
    }
}
