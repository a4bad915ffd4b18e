package com.fourinarow.game;

import com.fourinarow.board.Board;
import com.fourinarow.board.Cell;
import com.fourinarow.board.ColumnFullException;
import com.fourinarow.board.Disc;
import com.fourinarow.board.WinLine;

import java.util.List;
import java.util.Optional;

/**
 * The state machine of one game.
 *
 * Not thread-safe on its own: {@link GameSessionManager} holds this object's
 * monitor around every call, which serializes all moves, rebinds and
 * forfeits against one board without blocking other sessions.
 *
 * Once a winner is set the board is never written again.
 */
public class GameSession {

    private final String id;
    private final Board board;

    private Player red;
    private Player yellow;
    private Disc currentTurn;
    private Winner winner;
    private List<Cell> winningCells;

    // Set when the session leaves the registry; late callers treat it as missing
    private boolean closed;

    GameSession(String id, Player red, Player yellow) {
        this.id = id;
        this.board = Board.empty();
        this.red = red;
        this.yellow = yellow;
        this.currentTurn = Disc.RED;
    }

    public String getId() {
        return id;
    }

    Optional<Disc> colorOf(String connectionId) {
        if (red.getConnectionId().equals(connectionId)) {
            return Optional.of(Disc.RED);
        }
        if (yellow.getConnectionId().equals(connectionId)) {
            return Optional.of(Disc.YELLOW);
        }
        return Optional.empty();
    }

    Optional<Disc> colorOfUser(String userId) {
        if (red.getUserId().equals(userId)) {
            return Optional.of(Disc.RED);
        }
        if (yellow.getUserId().equals(userId)) {
            return Optional.of(Disc.YELLOW);
        }
        return Optional.empty();
    }

    Player player(Disc color) {
        return color == Disc.RED ? red : yellow;
    }

    void rebind(Disc color, String connectionId) {
        if (color == Disc.RED) {
            red = red.withConnection(connectionId);
        } else {
            yellow = yellow.withConnection(connectionId);
        }
    }

    /**
     * Applies a move for {@code color}. Checks run in a fixed order: turn,
     * game over, column range, column capacity. A rejected move leaves the
     * session unchanged.
     */
    MoveOutcome play(Disc color, int col) {
        if (color != currentTurn) {
            throw new InvalidMoveException(InvalidMoveException.Reason.NOT_YOUR_TURN);
        }
        if (winner != null) {
            throw new InvalidMoveException(InvalidMoveException.Reason.GAME_OVER);
        }
        if (col < 0 || col >= Board.COLUMNS) {
            throw new InvalidMoveException(InvalidMoveException.Reason.BAD_COLUMN);
        }

        int row;
        try {
            row = board.drop(col, color);
        } catch (ColumnFullException e) {
            throw new InvalidMoveException(InvalidMoveException.Reason.COLUMN_FULL);
        }

        Optional<WinLine> line = board.evaluateWin(row, col);
        if (line.isPresent()) {
            winner = Winner.of(color);
            winningCells = line.get().getCells();
            return MoveOutcome.WIN;
        }
        if (board.isFull()) {
            winner = Winner.DRAW;
            return MoveOutcome.DRAW;
        }
        currentTurn = currentTurn.opposite();
        return MoveOutcome.CONTINUE;
    }

    boolean isClosed() {
        return closed;
    }

    void close() {
        closed = true;
    }

    GameSnapshot snapshot() {
        return new GameSnapshot(id, board.toArray(), currentTurn, red, yellow, winner, winningCells);
    }

    @Override
    public String toString() {
        return "GameSession{" +
                "id='" + id + '\'' +
                ", red=" + red +
                ", yellow=" + yellow +
                ", currentTurn=" + currentTurn +
                ", winner=" + winner +
                '}';
    }
}
