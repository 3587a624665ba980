package com.hypothesis.core;

public enum Speaker {
    USER("user"),
    SYSTEM("assistant");

    private final String role;

    Speaker(String role) {
        this.role = role;
    }

    /**
     * Role name used when the turn is rendered into a prompt.
     */
    public String getRole() {
        return role;
    }
}
