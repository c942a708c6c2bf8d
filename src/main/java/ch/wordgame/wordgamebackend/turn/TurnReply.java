package ch.wordgame.wordgamebackend.turn;

import ch.wordgame.wordgamebackend.domain.exception.GameException;
import ch.wordgame.wordgamebackend.web.api.dto.GameStateDto;

/**
 * Reply written by a turn controller into the requesting player's reply slot.
 * Exactly one of {@code state} and {@code error} is set.
 *
 * @param ticket ticket of the request this reply answers
 * @param state state view for the requesting player
 * @param error rejection reason
 */
public record TurnReply(
        long ticket,
        GameStateDto state,
        GameException error
) {
    public static TurnReply success(long ticket, GameStateDto state) {
        return new TurnReply(ticket, state, null);
    }

    public static TurnReply failure(long ticket, GameException error) {
        return new TurnReply(ticket, null, error);
    }

    /**
     * @return the state view
     * @throws GameException the rejection carried by this reply
     */
    public GameStateDto unwrap() {
        if (error != null) {
            // controller-side exception kept as cause
            throw new GameException(error.getCode(), error.getMessage(), error);
        }
        return state;
    }
}
