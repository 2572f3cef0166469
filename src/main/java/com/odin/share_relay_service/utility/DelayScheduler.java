package com.odin.share_relay_service.utility;

import java.time.Duration;

/**
 * Registers one-shot delayed tasks and hands back a handle to cancel them.
 */
public interface DelayScheduler {

    Handle schedule(Duration delay, Runnable task);

    @FunctionalInterface
    interface Handle {

        /**
         * @return true if the task was prevented from running
         */
        boolean cancel();
    }
}
