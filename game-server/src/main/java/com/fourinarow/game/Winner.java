package com.fourinarow.game;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fourinarow.board.Disc;

/**
 * Terminal result of a session. An unfinished session has no winner (null).
 */
public enum Winner {
    RED("red"),
    YELLOW("yellow"),
    DRAW("draw");

    private final String wireName;

    Winner(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public static Winner of(Disc disc) {
        return disc == Disc.RED ? RED : YELLOW;
    }
}
