package ch.wordgame.wordgamebackend.engine;

/**
 * Raised by the placement engine or the draw pool when a move breaks the rules.
 */
public class IllegalMoveException extends RuntimeException {

    public IllegalMoveException(String message) {
        super(message);
    }
}
