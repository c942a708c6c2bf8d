package ch.wordgame.wordgamebackend.web.api.dto;

public record HealthStatusDto(
        String status,
        int games
) {}
