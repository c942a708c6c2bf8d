package ch.wordgame.wordgamebackend.web.api.dto;

import ch.wordgame.wordgamebackend.domain.Game;
import ch.wordgame.wordgamebackend.domain.Player;
import ch.wordgame.wordgamebackend.domain.enums.GameEventType;
import ch.wordgame.wordgamebackend.domain.enums.GameStatus;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * Public game event pushed to {@code /topic/games/{gameId}/events}. Never carries rack contents.
 */
public record GameEventDto(
        GameEventType type,
        UUID gameId,
        GameStatus gameStatus,
        Instant timeStamp,
        Map<String, Object> payload
) {
    public static GameEventDto playerJoined(Game game, Player player, int playerCount) {
        return new GameEventDto(
                GameEventType.PLAYER_JOINED,
                game.getId(),
                game.getStatus(),
                Instant.now(),
                Map.of(
                        "playerName", player.getName(),
                        "playerNumber", player.getNumber(),
                        "playerCount", playerCount
                )
        );
    }

    public static GameEventDto gameStarted(Game game, Player firstPlayer) {
        return new GameEventDto(
                GameEventType.GAME_STARTED,
                game.getId(),
                game.getStatus(),
                Instant.now(),
                Map.of(
                        "currentTurnPlayerName", firstPlayer.getName(),
                        "turn", firstPlayer.getNumber()
                )
        );
    }

    public static GameEventDto tilesPlayed(Game game, Player player, String word, int score, Player next) {
        return new GameEventDto(
                GameEventType.TILES_PLAYED,
                game.getId(),
                game.getStatus(),
                Instant.now(),
                Map.of(
                        "playerName", player.getName(),
                        "word", word,
                        "score", score,
                        "totalScore", player.getScore(),
                        "currentTurnPlayerName", next.getName(),
                        "turn", next.getNumber()
                )
        );
    }

    public static GameEventDto tilesSwapped(Game game, Player player, int tileCount, Player next) {
        return new GameEventDto(
                GameEventType.TILES_SWAPPED,
                game.getId(),
                game.getStatus(),
                Instant.now(),
                Map.of(
                        "playerName", player.getName(),
                        "tileCount", tileCount,
                        "currentTurnPlayerName", next.getName(),
                        "turn", next.getNumber()
                )
        );
    }
}
