package com.strata.config;

import com.strata.lifecycle.DataLifecycleManager;
import com.strata.storage.ProviderRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;

/**
 * Configuration for the data lifecycle manager and its scheduler
 */
@Configuration
public class LifecycleConfig {
    private static final Logger logger = LoggerFactory.getLogger(LifecycleConfig.class);
    
    /**
     * Dedicated thread running lifecycle cycles
     */
    @Bean(name = "lifecycleScheduler", destroyMethod = "dispose")
    public Scheduler lifecycleScheduler() {
        return Schedulers.newSingle("lifecycle-scheduler");
    }
    
    @Bean
    public Clock lifecycleClock() {
        return Clock.systemUTC();
    }
    
    @Bean(initMethod = "start", destroyMethod = "stop")
    public DataLifecycleManager dataLifecycleManager(ProviderRegistry providerRegistry,
                                                     LifecycleProperties lifecycleProperties,
                                                     ObjectProvider<MeterRegistry> meterRegistry,
                                                     Clock lifecycleClock,
                                                     Scheduler lifecycleScheduler) {
        MeterRegistry registry = meterRegistry.getIfAvailable(() -> {
            logger.info("No MeterRegistry available, lifecycle metrics kept in memory");
            return new SimpleMeterRegistry();
        });
        return new DataLifecycleManager(providerRegistry, lifecycleProperties.toPolicies(),
            lifecycleProperties.toSettings(), registry, lifecycleClock, lifecycleScheduler);
    }
}
