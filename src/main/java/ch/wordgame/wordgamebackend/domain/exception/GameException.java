package ch.wordgame.wordgamebackend.domain.exception;

import lombok.Getter;

/**
 * Rejection of a single game request, carrying a {@link GameErrorCode}.
 */
@Getter
public class GameException extends RuntimeException {

    private final GameErrorCode code;

    public GameException(GameErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public GameException(GameErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
