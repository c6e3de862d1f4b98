package com.github.salilvnair.commandconsole.security;

import java.util.Locale;

/**
 * The user acting on the console. {@code department} is only required for department scoped roles.
 */
public record Actor(String userId, String role, String department) {

    public Actor {
        role = role == null ? null : role.trim().toLowerCase(Locale.ROOT);
    }

    public static Actor of(String userId, String role) {
        return new Actor(userId, role, null);
    }

    public static Actor of(String userId, String role, String department) {
        return new Actor(userId, role, department);
    }
}
