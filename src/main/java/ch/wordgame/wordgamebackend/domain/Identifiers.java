package ch.wordgame.wordgamebackend.domain;

import ch.wordgame.wordgamebackend.domain.exception.GameErrorCode;
import ch.wordgame.wordgamebackend.domain.exception.GameException;

import java.util.UUID;

/**
 * Identifier space for games and players.
 *
 * <p>Identifiers are random UUIDs. Collisions are treated as practically impossible,
 * so no uniqueness check or retry is performed.
 */
public final class Identifiers {

    private Identifiers() {
        // utility class
    }

    public static UUID newId() {
        return UUID.randomUUID();
    }

    /**
     * Parses a client-supplied identifier.
     *
     * @param value textual UUID
     * @return parsed identifier
     * @throws GameException with {@link GameErrorCode#INVALID_REQUEST} if the value is blank or malformed
     */
    public static UUID parse(String value) {
        if (value == null || value.isBlank()) {
            throw new GameException(GameErrorCode.INVALID_REQUEST, "Identifier must not be empty");
        }
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw new GameException(GameErrorCode.INVALID_REQUEST, "Malformed identifier: " + value, e);
        }
    }
}
