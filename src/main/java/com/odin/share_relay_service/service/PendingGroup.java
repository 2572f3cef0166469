package com.odin.share_relay_service.service;

import com.odin.share_relay_service.dto.InboundItem;
import com.odin.share_relay_service.utility.DelayScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.LongConsumer;

/**
 * Buffer of one media group: BUFFERING while items arrive, DRAINING once sealed,
 * DONE after its items were handed to exactly one relay (or discarded).
 *
 * The group owns its timer. Each re-arm bumps the generation, so a timer that fires
 * after it was replaced cannot seal the group.
 */
final class PendingGroup {

    enum State {
        BUFFERING,
        DRAINING,
        DONE
    }

    private final String principalId;
    private final String groupId;
    private final String sessionId;
    private final List<InboundItem> items = new ArrayList<>();

    private State state = State.BUFFERING;
    private DelayScheduler.Handle timer;
    private long generation;

    PendingGroup(String principalId, String groupId, String sessionId) {
        this.principalId = principalId;
        this.groupId = groupId;
        this.sessionId = sessionId;
    }

    /**
     * Buffer an item and restart the quiet-period timer.
     *
     * @param onQuiet called from the timer with the generation it was armed for
     * @return false if the group is no longer buffering
     */
    synchronized boolean append(InboundItem item, DelayScheduler scheduler, Duration quietPeriod, LongConsumer onQuiet) {
        if (state != State.BUFFERING) {
            return false;
        }
        items.add(item);
        if (timer != null) {
            timer.cancel();
        }
        long armed = ++generation;
        timer = scheduler.schedule(quietPeriod, () -> onQuiet.accept(armed));
        return true;
    }

    /**
     * Seal from a timer. Only the latest timer wins.
     */
    synchronized boolean sealIfCurrent(long armedGeneration) {
        if (state != State.BUFFERING || armedGeneration != generation) {
            return false;
        }
        state = State.DRAINING;
        timer = null;
        return true;
    }

    /**
     * Seal now regardless of the timer.
     */
    synchronized void seal() {
        if (state != State.BUFFERING) {
            return;
        }
        cancelTimer();
        state = State.DRAINING;
    }

    /**
     * Take the items for relay.
     *
     * @return the items, or null if they were already claimed, discarded or are still buffering
     */
    synchronized List<InboundItem> claim() {
        if (state != State.DRAINING) {
            return null;
        }
        state = State.DONE;
        return new ArrayList<>(items);
    }

    /**
     * Drop the group. Items of a group whose relay has not started yet are lost.
     */
    synchronized List<InboundItem> discard() {
        if (state == State.DONE) {
            return Collections.emptyList();
        }
        cancelTimer();
        state = State.DONE;
        return new ArrayList<>(items);
    }

    synchronized State state() {
        return state;
    }

    synchronized int size() {
        return items.size();
    }

    String principalId() {
        return principalId;
    }

    String groupId() {
        return groupId;
    }

    String sessionId() {
        return sessionId;
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
    }
}
