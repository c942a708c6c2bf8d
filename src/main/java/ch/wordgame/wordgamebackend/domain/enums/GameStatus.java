package ch.wordgame.wordgamebackend.domain.enums;

/**
 * Lifecycle phase of a game. The only transition is {@code LOBBY -> ACTIVE}.
 */
public enum GameStatus {
    /**
     * Players may join; guarded by the game's lobby lock.
     */
    LOBBY,
    /**
     * Turn phase: all state changes go through the game's turn controller.
     */
    ACTIVE
}
