package ch.wordgame.wordgamebackend.web.api.dto;

/**
 * Body of every rejected request.
 *
 * @param code {@link ch.wordgame.wordgamebackend.domain.exception.GameErrorCode} name
 * @param message human readable reason
 */
public record ErrorResponseDto(
        String code,
        String message
) {}
