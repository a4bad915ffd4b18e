package com.fourinarow.board;

import java.util.List;

/**
 * A completed run of four or more same-colored discs.
 * Cells are sorted by row, then column.
 */
public final class WinLine {

    private final Disc disc;
    private final List<Cell> cells;

    public WinLine(Disc disc, List<Cell> cells) {
        this.disc = disc;
        this.cells = List.copyOf(cells);
    }

    public Disc getDisc() {
        return disc;
    }

    public List<Cell> getCells() {
        return cells;
    }

    @Override
    public String toString() {
        return "WinLine{" + disc + ", cells=" + cells + '}';
    }
}
