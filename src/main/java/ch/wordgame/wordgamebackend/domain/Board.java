package ch.wordgame.wordgamebackend.domain;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Immutable square board of letter tiles.
 *
 * <p>Placing tiles returns a new board, so a board handed out in a state view can never
 * change underneath its reader.
 */
public final class Board {

    public static final char EMPTY = '.';

    private final int size;
    private final char[][] squares;

    private Board(int size, char[][] squares) {
        this.size = size;
        this.squares = squares;
    }

    public static Board empty(int size) {
        char[][] squares = new char[size][size];
        for (char[] row : squares) {
            Arrays.fill(row, EMPTY);
        }
        return new Board(size, squares);
    }

    public BoardPosition center() {
        return new BoardPosition(size / 2, size / 2);
    }

    public boolean isInside(BoardPosition position) {
        return position.row() >= 0 && position.row() < size
                && position.col() >= 0 && position.col() < size;
    }

    public char letterAt(BoardPosition position) {
        return squares[position.row()][position.col()];
    }

    public boolean isOccupied(BoardPosition position) {
        return isInside(position) && letterAt(position) != EMPTY;
    }

    /**
     * @return {@code true} if no tile has been placed yet
     */
    public boolean isBlank() {
        for (char[] row : squares) {
            for (char c : row) {
                if (c != EMPTY) return false;
            }
        }
        return true;
    }

    /**
     * Returns a copy of this board with the given letters placed.
     *
     * @param placements letters by target square; squares must be inside the board
     * @return new board instance
     */
    public Board withLetters(Map<BoardPosition, Character> placements) {
        char[][] copy = new char[size][];
        for (int r = 0; r < size; r++) {
            copy[r] = squares[r].clone();
        }
        placements.forEach((pos, letter) -> copy[pos.row()][pos.col()] = letter);
        return new Board(size, copy);
    }

    /**
     * @return one string per row, {@link #EMPTY} marking free squares
     */
    public List<String> getRows() {
        List<String> rows = new ArrayList<>(size);
        for (char[] row : squares) {
            rows.add(new String(row));
        }
        return rows;
    }
}
