package ch.wordgame.wordgamebackend.web.api.dto;

import java.util.List;
import java.util.UUID;

/**
 * Game state as seen by one player.
 *
 * @param gameId game identifier
 * @param players all players in turn order (public data only)
 * @param board board rows, {@code '.'} marking free squares
 * @param turn join number of the player whose turn it is
 * @param tiles the requesting player's own rack
 * @param tilesInPool tiles left in the draw pool
 */
public record GameStateDto(
        UUID gameId,
        List<PlayerSummaryDto> players,
        List<String> board,
        int turn,
        String tiles,
        int tilesInPool
) {}
