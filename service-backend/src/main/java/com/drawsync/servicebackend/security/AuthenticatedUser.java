package com.drawsync.servicebackend.security;

import java.security.Principal;

/**
 * Verified identity of a caller, taken from its bearer token.
 */
public record AuthenticatedUser(Long id, String username, String email) implements Principal {
    @Override
    public String getName() {
        return username;
    }
}
