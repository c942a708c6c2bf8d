package ch.wordgame.wordgamebackend.domain.enums;

public enum GameEventType {
    PLAYER_JOINED,
    GAME_STARTED,
    TILES_PLAYED,
    TILES_SWAPPED
}
