package com.odin.share_relay_service.config;

import com.odin.share_relay_service.utility.DelayScheduler;
import com.odin.share_relay_service.utility.ExecutorDelayScheduler;
import com.odin.share_relay_service.utility.KeyedSerialExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Thread pools of the relay: one small pool that only fires timers and one bounded
 * worker pool shared by the per-principal lanes, where every blocking call runs.
 */
@Slf4j
@Configuration
public class ExecutionConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService relayTimerExecutor(ShareRelayProperties properties) {
        log.info("Creating relay timer pool with {} threads", properties.getTimerThreads());
        return Executors.newScheduledThreadPool(properties.getTimerThreads(),
                new CustomizableThreadFactory("relay-timer-"));
    }

    @Bean
    public DelayScheduler delayScheduler(ScheduledExecutorService relayTimerExecutor) {
        return new ExecutorDelayScheduler(relayTimerExecutor);
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService laneWorkerPool(ShareRelayProperties properties) {
        log.info("Creating lane worker pool with {} threads", properties.getLaneWorkers());
        return Executors.newFixedThreadPool(properties.getLaneWorkers(),
                new CustomizableThreadFactory("relay-lane-"));
    }

    @Bean
    public KeyedSerialExecutor principalLanes(@Qualifier("laneWorkerPool") ExecutorService laneWorkerPool) {
        return new KeyedSerialExecutor(laneWorkerPool);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
