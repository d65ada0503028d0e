package com.mind.dashboard.config;

import com.github.benmanes.caffeine.cache.Ticker;
import com.mind.dashboard.repository.GuardedRecordStore;
import com.mind.dashboard.repository.RecordStore;
import com.mind.dashboard.repository.RecordStoreJdbcRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class DashboardConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Ticker cacheTicker() {
        return Ticker.systemTicker();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService recordStoreExecutor(DashboardProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.recordStore().threads(), r -> {
            Thread t = new Thread(r, "record-store-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    @Primary
    public RecordStore guardedRecordStore(RecordStoreJdbcRepository jdbcRepository,
                                          ExecutorService recordStoreExecutor,
                                          DashboardProperties properties) {
        return new GuardedRecordStore(jdbcRepository, recordStoreExecutor,
                properties.recordStore().timeout(), properties.recordStore().retryAfter());
    }
}
