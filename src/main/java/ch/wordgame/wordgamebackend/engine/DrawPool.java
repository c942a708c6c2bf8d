package ch.wordgame.wordgamebackend.engine;

import java.util.List;

/**
 * Source of replacement tiles for one game.
 *
 * <p>A draw pool is owned by a single turn controller and is not thread-safe.
 */
public interface DrawPool {

    /**
     * Draws up to {@code count} tiles; fewer when the pool runs low.
     */
    List<Character> draw(int count);

    /**
     * Returns the given tiles to the pool in exchange for the same number of new ones.
     *
     * @throws IllegalMoveException if the pool holds fewer tiles than requested
     */
    List<Character> exchange(List<Character> tiles);

    int remaining();
}
