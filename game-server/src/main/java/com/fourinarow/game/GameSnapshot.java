package com.fourinarow.game;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fourinarow.board.Cell;
import com.fourinarow.board.Disc;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable view of a session, taken under the session's monitor. This is
 * what gets published as {@code gameState}, and its seats define the
 * session's broadcast scope.
 */
@JsonPropertyOrder({"sessionId", "board", "currentTurn", "players", "winner", "winningCells"})
public final class GameSnapshot {

    private final String sessionId;
    private final Disc[][] board;
    private final Disc currentTurn;
    private final Player red;
    private final Player yellow;
    private final Winner winner;
    private final List<Cell> winningCells;

    GameSnapshot(String sessionId, Disc[][] board, Disc currentTurn, Player red, Player yellow,
                 Winner winner, List<Cell> winningCells) {
        this.sessionId = sessionId;
        this.board = board;
        this.currentTurn = currentTurn;
        this.red = red;
        this.yellow = yellow;
        this.winner = winner;
        this.winningCells = winningCells;
    }

    public String getSessionId() {
        return sessionId;
    }

    public Disc[][] getBoard() {
        return board;
    }

    public Disc getCurrentTurn() {
        return currentTurn;
    }

    public Map<String, Player> getPlayers() {
        Map<String, Player> players = new LinkedHashMap<>();
        players.put(Disc.RED.getWireName(), red);
        players.put(Disc.YELLOW.getWireName(), yellow);
        return players;
    }

    public Winner getWinner() {
        return winner;
    }

    /**
     * Null unless a color won.
     */
    public List<Cell> getWinningCells() {
        return winningCells;
    }

    @JsonIgnore
    public Player getRed() {
        return red;
    }

    @JsonIgnore
    public Player getYellow() {
        return yellow;
    }

    @JsonIgnore
    public boolean isFinished() {
        return winner != null;
    }

    @JsonIgnore
    public List<String> getConnectionIds() {
        return List.of(red.getConnectionId(), yellow.getConnectionId());
    }

    /**
     * The player seated on {@code connectionId}, if any.
     */
    public Optional<Player> seatOf(String connectionId) {
        if (red.getConnectionId().equals(connectionId)) {
            return Optional.of(red);
        }
        if (yellow.getConnectionId().equals(connectionId)) {
            return Optional.of(yellow);
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "GameSnapshot{" +
                "sessionId='" + sessionId + '\'' +
                ", currentTurn=" + currentTurn +
                ", winner=" + winner +
                '}';
    }
}
