package com.phillippitts.livetranslate.domain;

import com.phillippitts.livetranslate.exception.InvalidMessageException;

import java.util.Locale;

/**
 * Role a connection takes after registering.
 *
 * <p>The wire names are the classroom terms clients send ({@code teacher}, {@code student});
 * {@code presenter} and {@code listener} are accepted as aliases. A connection that has not
 * registered yet has no role.
 */
public enum Role {
    PRESENTER("teacher"),
    LISTENER("student");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses a role from its wire name or alias (case-insensitive).
     *
     * @throws InvalidMessageException if the value is missing or unknown
     */
    public static Role fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidMessageException("register", "role is required");
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "teacher":
            case "presenter":
                return PRESENTER;
            case "student":
            case "listener":
                return LISTENER;
            default:
                throw new InvalidMessageException("register", "unknown role '" + value + "'");
        }
    }
}
