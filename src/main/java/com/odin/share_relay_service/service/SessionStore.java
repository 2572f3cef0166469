package com.odin.share_relay_service.service;

import com.odin.share_relay_service.dto.DrainedSession;
import com.odin.share_relay_service.dto.ItemRef;
import com.odin.share_relay_service.dto.UploadMode;
import com.odin.share_relay_service.exception.InvalidStateException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owner of all upload sessions, keyed by principal.
 *
 * A principal with an entry here is collecting; no entry means idle. Each session carries a
 * session id so that late relays of an earlier session can never land in a newer one.
 * Refs are kept sorted by arrival sequence, so the count always equals the number of refs.
 */
@Slf4j
@Service
public class SessionStore {

    private final Map<String, UploadSession> sessions = new ConcurrentHashMap<>();
    private final Map<String, AtomicLong> arrivalCounters = new ConcurrentHashMap<>();
    private final Clock clock;

    public SessionStore(Clock clock) {
        this.clock = clock;
    }

    /**
     * Start a fresh collecting session, replacing whatever the principal had.
     *
     * @return id of the new session
     */
    public String begin(String principalId) {
        UploadSession fresh = new UploadSession(UUID.randomUUID().toString(), clock.instant());
        UploadSession previous = sessions.put(principalId, fresh);
        if (previous != null) {
            log.warn("[SESSION-STORE] Replaced open session principal={} session={} refs={}",
                    principalId, previous.sessionId, previous.size());
        }
        log.info("[SESSION-STORE] Collecting started principal={} session={}", principalId, fresh.sessionId);
        return fresh.sessionId;
    }

    /**
     * Append a relayed ref at its arrival position.
     *
     * @param sessionId the session the item was uploaded into, null for the current one
     * @return number of refs in the session after the append
     * @throws InvalidStateException if the principal is not collecting or the session was replaced
     */
    public int accept(String principalId, String sessionId, long sequence, ItemRef ref) {
        int[] count = {-1};
        sessions.computeIfPresent(principalId, (key, session) -> {
            if (sessionId != null && !session.sessionId.equals(sessionId)) {
                return session;
            }
            count[0] = session.put(sequence, ref, clock.instant());
            return session;
        });
        if (count[0] < 0) {
            throw new InvalidStateException("Principal " + principalId + " is not collecting into session " + sessionId);
        }
        log.debug("[SESSION-STORE] Accepted ref={} seq={} principal={} count={}", ref, sequence, principalId, count[0]);
        return count[0];
    }

    /**
     * @return id of the collecting session
     * @throws InvalidStateException if the principal is idle
     */
    public String requireCollecting(String principalId) {
        return currentSessionId(principalId)
                .orElseThrow(() -> new InvalidStateException("Principal " + principalId + " is not collecting"));
    }

    public Optional<String> currentSessionId(String principalId) {
        UploadSession session = sessions.get(principalId);
        return session == null ? Optional.empty() : Optional.of(session.sessionId);
    }

    public UploadMode mode(String principalId) {
        return sessions.containsKey(principalId) ? UploadMode.COLLECTING : UploadMode.IDLE;
    }

    public boolean isCollecting(String principalId) {
        return mode(principalId) == UploadMode.COLLECTING;
    }

    public int count(String principalId) {
        UploadSession session = sessions.get(principalId);
        return session == null ? 0 : session.size();
    }

    /**
     * Mark activity without adding a ref, so a session with uploads in flight is not swept.
     */
    public void touch(String principalId) {
        sessions.computeIfPresent(principalId, (key, session) -> {
            session.lastActivity = clock.instant();
            return session;
        });
    }

    /**
     * Next arrival sequence number of the principal. Monotonic for the lifetime of the process.
     */
    public long nextSequence(String principalId) {
        return arrivalCounters.computeIfAbsent(principalId, key -> new AtomicLong()).incrementAndGet();
    }

    /**
     * Take the session's refs and return the principal to idle.
     */
    public DrainedSession drain(String principalId) {
        UploadSession session = sessions.remove(principalId);
        if (session == null) {
            return DrainedSession.empty(principalId);
        }
        log.info("[SESSION-STORE] Drained principal={} session={} refs={}", principalId, session.sessionId, session.size());
        return session.snapshot(principalId);
    }

    /**
     * Put a drained session back after its share could not be saved. Refs of a session begun
     * in the meantime are kept and the restored refs are merged in by sequence.
     */
    public void restore(DrainedSession drained) {
        if (drained.isEmpty()) {
            return;
        }
        sessions.compute(drained.getPrincipalId(), (key, current) -> {
            UploadSession target = current != null ? current : new UploadSession(drained.getSessionId(), clock.instant());
            target.merge(drained.getEntries(), clock.instant());
            return target;
        });
        log.info("[SESSION-STORE] Restored principal={} refs={}", drained.getPrincipalId(), drained.getCount());
    }

    /**
     * Discard the session without producing a share.
     *
     * @return what was discarded, so the caller can clean up relayed items
     */
    public DrainedSession abandon(String principalId) {
        UploadSession session = sessions.remove(principalId);
        if (session == null) {
            return DrainedSession.empty(principalId);
        }
        log.info("[SESSION-STORE] Abandoned principal={} session={} refs={}", principalId, session.sessionId, session.size());
        return session.snapshot(principalId);
    }

    /**
     * Abandon every session without activity for longer than {@code idleTtl}.
     */
    public List<DrainedSession> abandonIdle(Duration idleTtl) {
        Instant cutoff = clock.instant().minus(idleTtl);
        List<DrainedSession> abandoned = new ArrayList<>();
        for (Map.Entry<String, UploadSession> entry : sessions.entrySet()) {
            UploadSession session = entry.getValue();
            if (session.lastActivity.isBefore(cutoff) && sessions.remove(entry.getKey(), session)) {
                abandoned.add(session.snapshot(entry.getKey()));
                log.info("[SESSION-STORE] Idle session abandoned principal={} session={} idleSince={}",
                        entry.getKey(), session.sessionId, session.lastActivity);
            }
        }
        return abandoned;
    }

    /**
     * Mutated only inside map compute functions; reads from outside lock on the instance.
     */
    private static final class UploadSession {

        private final String sessionId;
        private final NavigableMap<Long, ItemRef> refs = new TreeMap<>();
        private volatile Instant lastActivity;

        private UploadSession(String sessionId, Instant lastActivity) {
            this.sessionId = sessionId;
            this.lastActivity = lastActivity;
        }

        private synchronized int put(long sequence, ItemRef ref, Instant now) {
            refs.put(sequence, ref);
            lastActivity = now;
            return refs.size();
        }

        private synchronized void merge(Map<Long, ItemRef> restored, Instant now) {
            restored.forEach(refs::putIfAbsent);
            lastActivity = now;
        }

        private int size() {
            synchronized (this) {
                return refs.size();
            }
        }

        private DrainedSession snapshot(String principalId) {
            synchronized (this) {
                return DrainedSession.of(principalId, sessionId, refs);
            }
        }
    }
}
