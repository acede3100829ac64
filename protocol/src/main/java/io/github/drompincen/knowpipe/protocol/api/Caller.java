package io.github.drompincen.knowpipe.protocol.api;

import java.util.Set;

public record Caller(String userId, Set<String> roles) {

    public static final String ADMIN = "ADMIN";

    public Caller {
        roles = roles == null ? Set.of() : Set.copyOf(roles);
    }

    public static Caller user(String userId) {
        return new Caller(userId, Set.of());
    }

    public static Caller admin(String userId) {
        return new Caller(userId, Set.of(ADMIN));
    }

    public boolean isAdmin() {
        return roles.contains(ADMIN);
    }
}
