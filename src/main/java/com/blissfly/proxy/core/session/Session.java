package com.blissfly.proxy.core.session;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Server-held shared state joined by one or more members.
 * Instances are only touched while the owning {@link SessionManager} monitor is held.
 */
final class Session {
    private final String id;
    private final String type;
    private final Map<String, Object> state = new LinkedHashMap<>();
    private final Map<String, Object> settings = new LinkedHashMap<>();
    private final Map<String, SessionMember> members = new LinkedHashMap<>();
    private long updatedAt;

    Session(String id, String type, Map<String, Object> settings, long now) {
        this.id = id;
        this.type = type;
        if (settings != null) {
            settings.forEach((k, v) -> {
                if (k != null && v != null) {
                    this.settings.put(k, v);
                }
            });
        }
        this.updatedAt = now;
    }

    void addMember(SessionMember member, long now) {
        members.put(member.id(), member);
        updatedAt = now;
    }

    void removeMember(SessionMember member, long now) {
        members.remove(member.id());
        updatedAt = now;
    }

    /**
     * Shallow merge; a null value removes the key.
     */
    void mergeState(Map<String, Object> partial, long now) {
        partial.forEach((k, v) -> {
            if (v == null) {
                state.remove(k);
            } else {
                state.put(k, v);
            }
        });
        updatedAt = now;
    }

    boolean isEmpty() {
        return members.isEmpty();
    }

    List<SessionMember> members() {
        return new ArrayList<>(members.values());
    }

    SessionView view() {
        return new SessionView(id, type, Collections.unmodifiableMap(new LinkedHashMap<>(state)),
                members.size(), updatedAt, Collections.unmodifiableMap(new LinkedHashMap<>(settings)));
    }
}
