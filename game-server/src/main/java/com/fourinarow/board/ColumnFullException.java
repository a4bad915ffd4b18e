package com.fourinarow.board;

/**
 * Thrown when a disc is dropped into a column with no empty cell left.
 */
public class ColumnFullException extends Exception {

    private final int column;

    public ColumnFullException(int column) {
        super("Column " + column + " is full");
        this.column = column;
    }

    public int getColumn() {
        return column;
    }
}
