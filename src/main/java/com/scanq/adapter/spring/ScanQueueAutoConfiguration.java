package com.scanq.adapter.spring;

import com.scanq.adapter.lease.ReservationSweeper;
import com.scanq.config.ConfigLoader;
import com.scanq.config.ScanQueueConfig;
import com.scanq.scheduler.WeightedFairScheduler;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for the scan admission scheduler.
 */
@Configuration
@ConditionalOnProperty(prefix = "scanq", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ScanQueueProperties.class)
public class ScanQueueAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ScanQueueAutoConfiguration.class);

    private ReservationSweeper reservationSweeper;

    @Bean
    @ConditionalOnMissingBean
    public ScanQueueConfig scanQueueConfig(ScanQueueProperties properties) {
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public WeightedFairScheduler weightedFairScheduler(ScanQueueConfig config) {
        log.info("Creating WeightedFairScheduler: {}", config.name());
        return new WeightedFairScheduler(config);
    }

    /**
     * Lease sweeper; idle unless a reservation TTL is configured.
     */
    @Bean(destroyMethod = "")
    @ConditionalOnMissingBean
    public ReservationSweeper reservationSweeper(ScanQueueConfig config, WeightedFairScheduler scheduler) {
        this.reservationSweeper = new ReservationSweeper(scheduler, config.lease());
        this.reservationSweeper.start();
        return this.reservationSweeper;
    }

    @PreDestroy
    public void shutdown() {
        if (reservationSweeper != null && reservationSweeper.isStarted()) {
            log.info("Stopping ReservationSweeper");
            reservationSweeper.close();
        }
    }
}
