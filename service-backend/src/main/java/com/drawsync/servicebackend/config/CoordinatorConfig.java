package com.drawsync.servicebackend.config;

import com.drawsync.servicebackend.coordinator.BufferFlusher;
import com.drawsync.servicebackend.coordinator.RoomCoordinator;
import com.drawsync.servicebackend.coordinator.SessionRegistry;
import com.drawsync.servicebackend.coordinator.store.RoomStateStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for the real-time room coordinator.
 */
@Configuration
public class CoordinatorConfig {

    @Bean
    public Clock coordinatorClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService roomCommandExecutor(CoordinatorProperties properties) {
        return Executors.newFixedThreadPool(properties.workerThreads(), daemonThreads("room-worker"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService roomPersistenceExecutor(CoordinatorProperties properties) {
        return Executors.newFixedThreadPool(properties.persistenceThreads(), daemonThreads("room-persistence"));
    }

    @Bean
    public SessionRegistry sessionRegistry(Clock coordinatorClock,
                                           CoordinatorProperties properties,
                                           @Qualifier("roomCommandExecutor") ExecutorService commandExecutor,
                                           @Qualifier("roomPersistenceExecutor") ExecutorService persistenceExecutor) {
        return new SessionRegistry(coordinatorClock, properties.lockTimeout(), commandExecutor, persistenceExecutor);
    }

    @Bean
    public RoomCoordinator roomCoordinator(SessionRegistry sessionRegistry, RoomStateStore roomStateStore) {
        return new RoomCoordinator(sessionRegistry, roomStateStore);
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public BufferFlusher bufferFlusher(SessionRegistry sessionRegistry,
                                       RoomStateStore roomStateStore,
                                       CoordinatorProperties properties) {
        return new BufferFlusher(sessionRegistry, roomStateStore, properties.flushInterval());
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
