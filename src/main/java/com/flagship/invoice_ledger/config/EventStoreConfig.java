package com.flagship.invoice_ledger.config;

import com.flagship.invoice_ledger.eventsourcing.AggregateProjection;
import com.flagship.invoice_ledger.eventsourcing.ProjectionRegistry;
import com.flagship.invoice_ledger.eventstore.InMemoryEventStore;
import com.flagship.invoice_ledger.observability.EventStoreMetrics;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.List;

/**
 * Wiring for the event store and the repositories' executor.
 *
 * The JPA store is a component of its own and active unless
 * {@code event-store.type=memory} selects the in-memory store declared here.
 */
@Configuration
public class EventStoreConfig {

    @Value("${event-store.executor.pool-size:4}")
    private int poolSize;

    @Value("${event-store.executor.queue-capacity:500}")
    private int queueCapacity;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ProjectionRegistry projectionRegistry(List<AggregateProjection<?, ?>> projections) {
        return new ProjectionRegistry(projections);
    }

    /**
     * Runs repository calls off the caller's thread. A full queue rejects the
     * call instead of blocking the caller.
     */
    @Bean(name = "eventStoreExecutor")
    public ThreadPoolTaskExecutor eventStoreExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("event-store-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    @ConditionalOnProperty(name = "event-store.type", havingValue = "memory")
    public InMemoryEventStore inMemoryEventStore(ProjectionRegistry projectionRegistry,
                                                 Clock clock,
                                                 EventStoreMetrics metrics) {
        return new InMemoryEventStore(projectionRegistry, clock, metrics);
    }
}
