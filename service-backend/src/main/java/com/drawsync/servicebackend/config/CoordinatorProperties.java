package com.drawsync.servicebackend.config;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tuning of the real-time room coordinator.
 *
 * @param flushInterval      period of the buffer flush to the room store
 * @param lockTimeout        age after which an object lock can be taken over by another user
 * @param workerThreads      threads shared by all room command lanes
 * @param persistenceThreads threads shared by all room persistence lanes
 */
@Validated
@ConfigurationProperties(prefix = "app.coordinator")
public record CoordinatorProperties(
        @NotNull @DefaultValue("5s") Duration flushInterval,
        @NotNull @DefaultValue("30s") Duration lockTimeout,
        @Positive @DefaultValue("4") int workerThreads,
        @Positive @DefaultValue("2") int persistenceThreads
) {
}
