package com.fourinarow.game;

/**
 * A move that conflicts with the session state. Reported to the acting
 * connection only; the session is left untouched.
 */
public class InvalidMoveException extends RuntimeException {

    public enum Reason {
        NOT_YOUR_TURN("It's not your turn!"),
        GAME_OVER("Game is already over!"),
        BAD_COLUMN("Invalid column!"),
        COLUMN_FULL("Column is full!");

        private final String message;

        Reason(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }

    private final Reason reason;

    public InvalidMoveException(Reason reason) {
        super(reason.getMessage());
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
