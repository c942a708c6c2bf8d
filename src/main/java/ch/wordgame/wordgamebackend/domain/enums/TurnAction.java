package ch.wordgame.wordgamebackend.domain.enums;

/**
 * Kinds of requests accepted by a turn controller.
 */
public enum TurnAction {
    QUERY,
    PLAY,
    SWAP
}
