package ch.wordgame.wordgamebackend.engine;

import ch.wordgame.wordgamebackend.domain.Board;
import ch.wordgame.wordgamebackend.domain.BoardPosition;

import java.util.List;

/**
 * Checks placement legality and scores a move. Implementations must not modify the given board.
 */
public interface PlacementEngine {

    /**
     * @param board current board
     * @param start first square of the word
     * @param end last square of the word
     * @param tiles tiles to place on the free squares between start and end, in order;
     *              {@link ch.wordgame.wordgamebackend.domain.Tiles#BLANK} for a blank tile
     * @param blanks letters the blank tiles stand for, one per blank in {@code tiles}, in order
     * @return the resulting board and score
     * @throws IllegalMoveException if the placement is not allowed
     */
    PlacementResult tryPlace(Board board, BoardPosition start, BoardPosition end,
                             List<Character> tiles, List<Character> blanks);
}
