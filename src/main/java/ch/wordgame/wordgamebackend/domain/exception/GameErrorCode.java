package ch.wordgame.wordgamebackend.domain.exception;

/**
 * Reasons a game request can be rejected.
 *
 * <p>All codes describe a local, per-request outcome: a rejected request never changes
 * game state and never stops the turn controller of the affected game.
 */
public enum GameErrorCode {
    /**
     * Unknown game or player identifier.
     */
    NOT_FOUND,
    GAME_FULL,
    ALREADY_STARTED,
    NOT_ENOUGH_PLAYERS,
    /**
     * Turn request against a game that is still in the lobby.
     */
    NOT_STARTED,
    NOT_YOUR_TURN,
    /**
     * Placement rejected by the placement engine, or exchange refused by the draw pool.
     */
    ILLEGAL_MOVE,
    /**
     * Tiles referenced by a play or swap are not on the player's rack.
     */
    INVALID_TILES,
    /**
     * The player already waits for a reply to an earlier request.
     */
    REQUEST_IN_FLIGHT,
    TIMEOUT,
    INVALID_REQUEST,
    INTERNAL_ERROR
}
