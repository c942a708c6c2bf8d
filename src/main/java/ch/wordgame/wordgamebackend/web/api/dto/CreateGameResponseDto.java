package ch.wordgame.wordgamebackend.web.api.dto;

import java.util.UUID;

/**
 * DTO returned after creating a new game.
 *
 * @param gameId identifier clients use to join and address the game
 */
public record CreateGameResponseDto(
        UUID gameId
) {}
