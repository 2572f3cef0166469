package com.odin.share_relay_service.dto;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Snapshot of an upload session taken when it is drained or abandoned.
 * Keeps the arrival sequence of every ref so the session can be restored unchanged.
 */
@Value
public class DrainedSession {

    String principalId;
    String sessionId;
    NavigableMap<Long, ItemRef> entries;

    public static DrainedSession empty(String principalId) {
        return new DrainedSession(principalId, null, Collections.emptyNavigableMap());
    }

    public static DrainedSession of(String principalId, String sessionId, NavigableMap<Long, ItemRef> entries) {
        return new DrainedSession(principalId, sessionId, Collections.unmodifiableNavigableMap(new TreeMap<>(entries)));
    }

    public List<ItemRef> getRefs() {
        return new ArrayList<>(entries.values());
    }

    public int getCount() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
