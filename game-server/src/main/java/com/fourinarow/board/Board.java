package com.fourinarow.board;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The 6 x 7 drop grid.
 *
 * Row 0 is the top row, so a dropped disc settles in the highest-indexed empty
 * row of its column. Columns always fill bottom-up, which is what makes
 * {@link #isFull()} a top-row check.
 *
 * Not thread-safe. A board is only ever touched while holding the owning
 * game session's monitor.
 */
public class Board {

    public static final int ROWS = 6;
    public static final int COLUMNS = 7;
    public static final int WIN_LENGTH = 4;

    // Each axis is walked in both directions from the placed cell
    private static final int[][] AXES = {
            {0, 1},   // horizontal
            {1, 0},   // vertical
            {1, 1},   // diagonal down-right
            {1, -1}   // diagonal down-left
    };

    private final Disc[][] cells;

    private Board() {
        this.cells = new Disc[ROWS][COLUMNS];
    }

    public static Board empty() {
        return new Board();
    }

    /**
     * Drops a disc into {@code col}.
     *
     * @return the row the disc landed in
     * @throws ColumnFullException if the column has no empty cell
     * @throws IllegalArgumentException if {@code col} is outside the grid
     */
    public int drop(int col, Disc disc) throws ColumnFullException {
        if (col < 0 || col >= COLUMNS) {
            throw new IllegalArgumentException("Column out of range: " + col);
        }
        for (int row = ROWS - 1; row >= 0; row--) {
            if (cells[row][col] == null) {
                cells[row][col] = disc;
                return row;
            }
        }
        throw new ColumnFullException(col);
    }

    /**
     * Checks whether the disc at ({@code row}, {@code col}) completes a run of
     * at least four along any axis. Runs on both sides of the cell are merged,
     * so a placement that closes a gap in the middle of a line is detected too.
     */
    public Optional<WinLine> evaluateWin(int row, int col) {
        if (!inBounds(row, col)) {
            return Optional.empty();
        }
        Disc disc = cells[row][col];
        if (disc == null) {
            return Optional.empty();
        }

        for (int[] axis : AXES) {
            List<Cell> run = new ArrayList<>();
            run.add(new Cell(row, col));
            collect(run, disc, row, col, axis[0], axis[1]);
            collect(run, disc, row, col, -axis[0], -axis[1]);

            if (run.size() >= WIN_LENGTH) {
                Collections.sort(run);
                return Optional.of(new WinLine(disc, run));
            }
        }
        return Optional.empty();
    }

    private void collect(List<Cell> run, Disc disc, int row, int col, int dRow, int dCol) {
        int r = row + dRow;
        int c = col + dCol;
        while (inBounds(r, c) && cells[r][c] == disc) {
            run.add(new Cell(r, c));
            r += dRow;
            c += dCol;
        }
    }

    public boolean isFull() {
        for (int col = 0; col < COLUMNS; col++) {
            if (cells[0][col] == null) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the disc at a cell, or null if it is empty.
     */
    public Disc get(int row, int col) {
        return cells[row][col];
    }

    public int occupiedCount() {
        int count = 0;
        for (Disc[] row : cells) {
            for (Disc disc : row) {
                if (disc != null) {
                    count++;
                }
            }
        }
        return count;
    }

    /**
     * Deep copy of the grid for publishing. Empty cells are null.
     */
    public Disc[][] toArray() {
        Disc[][] copy = new Disc[ROWS][];
        for (int row = 0; row < ROWS; row++) {
            copy[row] = cells[row].clone();
        }
        return copy;
    }

    private static boolean inBounds(int row, int col) {
        return row >= 0 && row < ROWS && col >= 0 && col < COLUMNS;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Disc[] row : cells) {
            for (Disc disc : row) {
                sb.append(disc == null ? '.' : disc == Disc.RED ? 'R' : 'Y');
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
