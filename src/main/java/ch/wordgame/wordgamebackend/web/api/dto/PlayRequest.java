package ch.wordgame.wordgamebackend.web.api.dto;

import ch.wordgame.wordgamebackend.domain.BoardPosition;

import java.util.UUID;

/**
 * Request DTO used to play tiles.
 *
 * <p>Placement legality and turn order are checked by the game's turn controller.
 *
 * @param playerId identifier of the acting player
 * @param startPos first square of the word
 * @param endPos last square of the word
 * @param tiles letters to place on the free squares between start and end, e.g. {@code "CAT"};
 *              {@code '?'} places a blank tile
 * @param blanks letters the blank tiles stand for, in order, e.g. {@code "A"} for {@code "C?T"};
 *               optional when no blank is played
 */
public record PlayRequest(
        UUID playerId,
        BoardPosition startPos,
        BoardPosition endPos,
        String tiles,
        String blanks
) {}
