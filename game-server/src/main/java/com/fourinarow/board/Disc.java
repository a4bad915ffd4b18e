package com.fourinarow.board;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * A player's token color. Red always moves first.
 */
public enum Disc {
    RED("red"),
    YELLOW("yellow");

    private final String wireName;

    Disc(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public Disc opposite() {
        return this == RED ? YELLOW : RED;
    }
}
