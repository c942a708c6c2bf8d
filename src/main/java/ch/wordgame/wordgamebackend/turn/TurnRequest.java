package ch.wordgame.wordgamebackend.turn;

import ch.wordgame.wordgamebackend.domain.BoardPosition;
import ch.wordgame.wordgamebackend.domain.enums.TurnAction;

import java.util.List;
import java.util.UUID;

/**
 * Request submitted to a turn controller.
 *
 * @param action kind of request
 * @param playerId requesting player
 * @param startPos first square of the word ({@link TurnAction#PLAY} only)
 * @param endPos last square of the word ({@link TurnAction#PLAY} only)
 * @param tiles tiles to play or swap; empty for {@link TurnAction#QUERY}
 * @param blanks letters chosen for the blank tiles of a {@link TurnAction#PLAY}, in order
 */
public record TurnRequest(
        TurnAction action,
        UUID playerId,
        BoardPosition startPos,
        BoardPosition endPos,
        List<Character> tiles,
        List<Character> blanks
) {
    public TurnRequest {
        tiles = tiles == null ? List.of() : List.copyOf(tiles);
        blanks = blanks == null ? List.of() : List.copyOf(blanks);
    }

    public static TurnRequest query(UUID playerId) {
        return new TurnRequest(TurnAction.QUERY, playerId, null, null, List.of(), List.of());
    }

    public static TurnRequest play(UUID playerId, BoardPosition startPos, BoardPosition endPos, List<Character> tiles) {
        return play(playerId, startPos, endPos, tiles, List.of());
    }

    public static TurnRequest play(UUID playerId, BoardPosition startPos, BoardPosition endPos,
                                   List<Character> tiles, List<Character> blanks) {
        return new TurnRequest(TurnAction.PLAY, playerId, startPos, endPos, tiles, blanks);
    }

    public static TurnRequest swap(UUID playerId, List<Character> tiles) {
        return new TurnRequest(TurnAction.SWAP, playerId, null, null, tiles, List.of());
    }
}
