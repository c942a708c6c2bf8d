package ch.wordgame.wordgamebackend.web.api.dto;

/**
 * Request DTO used to join an existing game.
 *
 * <p>Contains only the display name. The backend generates the {@code playerId} and returns
 * it in the join response.
 *
 * @param playerName display name of the joining player
 */
public record JoinGameRequest(
        String playerName
) {}
