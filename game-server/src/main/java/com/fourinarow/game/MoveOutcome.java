package com.fourinarow.game;

public enum MoveOutcome {
    CONTINUE,
    WIN,
    DRAW
}
