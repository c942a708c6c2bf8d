package ch.wordgame.wordgamebackend.engine;

import ch.wordgame.wordgamebackend.domain.Board;

/**
 * Outcome of an accepted placement.
 *
 * @param board board including the newly placed tiles
 * @param word the word formed between start and end
 * @param score points earned by the move
 */
public record PlacementResult(
        Board board,
        String word,
        int score
) {}
