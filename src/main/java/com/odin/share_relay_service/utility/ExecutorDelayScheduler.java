package com.odin.share_relay_service.utility;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class ExecutorDelayScheduler implements DelayScheduler {

	private final ScheduledExecutorService scheduler;

	public ExecutorDelayScheduler(ScheduledExecutorService scheduler) {
		this.scheduler = scheduler;
	}

	@Override
	public Handle schedule(Duration delay, Runnable task) {
		Runnable guarded = CorrelationIdUtil.propagate(() -> {
			try {
				task.run();
			} catch (RuntimeException e) {
				log.error("[TIMER] Scheduled task failed: {}", e.getMessage(), e);
			}
		});
		ScheduledFuture<?> future = scheduler.schedule(guarded, delay.toMillis(), TimeUnit.MILLISECONDS);
		return () -> future.cancel(false);
	}
}
