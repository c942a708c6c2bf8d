package ch.wordgame.wordgamebackend.web.api.controller;

import ch.wordgame.wordgamebackend.domain.exception.GameErrorCode;
import ch.wordgame.wordgamebackend.domain.exception.GameException;
import ch.wordgame.wordgamebackend.web.api.dto.ErrorResponseDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps request rejections to HTTP responses with an {@link ErrorResponseDto} body.
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    @ExceptionHandler(GameException.class)
    public ResponseEntity<ErrorResponseDto> gameException(GameException e) {
        HttpStatus status = statusOf(e.getCode());
        if (status.is5xxServerError()) {
            log.warn("Request failed with {}: {}", e.getCode(), e.getMessage());
        } else {
            log.debug("Request rejected with {}: {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ErrorResponseDto(e.getCode().name(), e.getMessage()));
    }

    /**
     * Body that is not valid JSON or does not fit the request DTO (e.g. malformed UUID).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> unreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponseDto(GameErrorCode.INVALID_REQUEST.name(), "Malformed request body"));
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponseDto> missingParameter(MissingServletRequestParameterException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponseDto(GameErrorCode.INVALID_REQUEST.name(), e.getMessage()));
    }

    static HttpStatus statusOf(GameErrorCode code) {
        return switch (code) {
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case GAME_FULL, ALREADY_STARTED, NOT_ENOUGH_PLAYERS, NOT_STARTED, NOT_YOUR_TURN -> HttpStatus.CONFLICT;
            case ILLEGAL_MOVE, INVALID_TILES, INVALID_REQUEST -> HttpStatus.BAD_REQUEST;
            case REQUEST_IN_FLIGHT -> HttpStatus.TOO_MANY_REQUESTS;
            case TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case INTERNAL_ERROR -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
