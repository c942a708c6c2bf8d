package ch.wordgame.wordgamebackend.domain;

/**
 * Square on the board, 0-based ({@code row}: top to bottom, {@code col}: left to right).
 *
 * @param row 0-based row index
 * @param col 0-based column index
 */
public record BoardPosition(
        int row,
        int col
) {
    public BoardPosition offset(int dRow, int dCol) {
        return new BoardPosition(row + dRow, col + dCol);
    }
}
