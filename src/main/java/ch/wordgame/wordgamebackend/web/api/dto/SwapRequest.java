package ch.wordgame.wordgamebackend.web.api.dto;

import java.util.UUID;

/**
 * Request DTO used to exchange rack tiles for new ones. Consumes the player's turn.
 *
 * @param playerId identifier of the acting player
 * @param tiles letters to give back, e.g. {@code "QX"}
 */
public record SwapRequest(
        UUID playerId,
        String tiles
) {}
