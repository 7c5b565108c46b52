package com.drawsync.servicebackend.coordinator;

import com.drawsync.servicebackend.message.ServerEvent;

/**
 * A live client connection carrying a verified user identity.
 */
public interface ClientConnection {

    String id();

    Long userId();

    String username();

    boolean isOpen();

    /**
     * Delivers an event. Implementations log and drop on transport failure rather than throw.
     */
    void send(ServerEvent event);

    /**
     * Best-effort delivery; may be dropped when the connection is backed up.
     */
    default void sendVolatile(ServerEvent event) {
        send(event);
    }
}
