package ch.wordgame.wordgamebackend.web.api.dto;

import java.util.UUID;

public record JoinGameResponseDto(
        UUID gameId,
        UUID playerId,
        String playerName,
        int playerNumber
) {}
