package com.blissfly.proxy.core.session;

import java.io.IOException;

/**
 * A connection participating in a shared session.
 * Implementations must allow {@link #send} from several threads.
 */
public interface SessionMember {

    /**
     * @return Server-side identifier; never sent to clients.
     */
    String id();

    /**
     * Delivers one JSON message to this member.
     *
     * @param message Serialized JSON.
     * @throws IOException if the connection is gone.
     */
    void send(String message) throws IOException;
}
