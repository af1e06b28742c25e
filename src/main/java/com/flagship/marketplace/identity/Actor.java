package com.flagship.marketplace.identity;

import lombok.NonNull;
import lombok.Value;

import java.util.UUID;

/**
 * The authenticated caller of an operation.
 *
 * Every mutating operation receives the actor explicitly; nothing in the
 * engine reads an ambient "current user".
 */
@Value
public class Actor {

    private static final UUID SYSTEM_ID = new UUID(0L, 0L);

    @NonNull
    UUID id;

    @NonNull
    Role role;

    public static Actor member(UUID id) {
        return new Actor(id, Role.MEMBER);
    }

    public static Actor administrator(UUID id) {
        return new Actor(id, Role.ADMINISTRATOR);
    }

    public static Actor system() {
        return new Actor(SYSTEM_ID, Role.SYSTEM);
    }

    public boolean isAdministrator() {
        return role == Role.ADMINISTRATOR;
    }

    public boolean isSystem() {
        return role == Role.SYSTEM;
    }

    public boolean is(UUID userId) {
        return id.equals(userId);
    }
}
