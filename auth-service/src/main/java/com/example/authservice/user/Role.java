package com.example.authservice.user;

import java.util.Arrays;

/**
 * User roles known to the platform.
 *
 * Registration and role updates check role membership. The gates compare the role claim of a
 * verified token as an opaque string.
 */
public enum Role {
    /**
     * Administrator - Full system access
     */
    ADMIN("admin"),

    /**
     * Instructor - Manages courses, lessons and quizzes
     */
    INSTRUCTOR("instructor"),

    /**
     * Student - Enrolls in courses and takes quizzes
     */
    STUDENT("student");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /**
     * Value carried in the role claim and stored with the user.
     */
    public String value() {
        return value;
    }

    public static boolean isKnown(String value) {
        return Arrays.stream(values()).anyMatch(role -> role.value.equals(value));
    }
}
