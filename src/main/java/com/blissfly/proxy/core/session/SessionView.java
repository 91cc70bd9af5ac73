package com.blissfly.proxy.core.session;

import java.util.Map;

/**
 * Sanitized, client-facing view of a session. Member identities are reduced to a count.
 *
 * @param id          Session identifier.
 * @param type        Application-defined session type.
 * @param state       Current shared state.
 * @param memberCount Number of connected members.
 * @param timestamp   Last modification time, epoch milliseconds.
 * @param settings    Settings given when the session was created.
 */
public record SessionView(String id, String type, Map<String, Object> state, int memberCount,
        long timestamp, Map<String, Object> settings) {
}
