package com.supportsignal.session.config;

import java.util.function.ToIntFunction;

import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

/**
 * Database configuration for the session store.
 *
 * Every request resolves its token against the store, so the pool is sized
 * for many short point lookups rather than long transactions.
 *
 * Key settings:
 * - Fail fast on connection acquisition (callers treat the store as unavailable)
 * - Explicit transaction control (auto-commit off)
 * - Pool metrics exposed via Micrometer
 */
@Slf4j
@Configuration
@EnableTransactionManagement
public class DatabaseConfig {

    private static final String POOL_NAME = "SessionStorePool";

    /**
     * Primary DataSource bean with HikariCP connection pooling.
     *
     * Values under spring.datasource.hikari in application.yml override the
     * defaults set here. The pool starts lazily on first use, after binding.
     *
     * @param properties Spring Boot DataSource properties
     * @param meterRegistry Micrometer registry for pool metrics
     * @return configured HikariCP DataSource
     */
    @Bean
    @Primary
    @ConfigurationProperties("spring.datasource.hikari")
    public HikariDataSource dataSource(
            DataSourceProperties properties,
            MeterRegistry meterRegistry) {

        HikariDataSource dataSource = properties.initializeDataSourceBuilder()
            .type(HikariDataSource.class)
            .build();

        dataSource.setPoolName(POOL_NAME);
        dataSource.setMaximumPoolSize(20);
        dataSource.setMinimumIdle(5);

        // Acquisition failures surface to callers as StoreUnavailable
        dataSource.setConnectionTimeout(2000);
        dataSource.setValidationTimeout(1000);
        dataSource.setLeakDetectionThreshold(30000);

        dataSource.setAutoCommit(false);
        dataSource.setMetricRegistry(meterRegistry);

        registerPoolGauges(dataSource, meterRegistry);

        log.info("HikariCP DataSource configured: pool={}, url={}", POOL_NAME, properties.determineUrl());

        return dataSource;
    }

    /**
     * Exposes pending-thread and utilization gauges used for store alerting.
     *
     * @param dataSource HikariCP data source
     * @param meterRegistry Micrometer registry
     */
    private void registerPoolGauges(HikariDataSource dataSource, MeterRegistry meterRegistry) {
        Gauge.builder("session.store.pool.pending", dataSource,
                ds -> poolStat(ds, HikariPoolMXBean::getThreadsAwaitingConnection))
            .description("Threads waiting for a session store connection")
            .register(meterRegistry);

        Gauge.builder("session.store.pool.utilization", dataSource, ds -> {
                double total = poolStat(ds, HikariPoolMXBean::getTotalConnections);
                return total > 0 ? poolStat(ds, HikariPoolMXBean::getActiveConnections) * 100.0 / total : 0.0;
            })
            .description("Percentage of session store connections in use")
            .register(meterRegistry);
    }

    private static double poolStat(HikariDataSource dataSource, ToIntFunction<HikariPoolMXBean> stat) {
        HikariPoolMXBean poolMXBean = dataSource.getHikariPoolMXBean();
        return poolMXBean == null ? 0.0 : stat.applyAsInt(poolMXBean);
    }
}
