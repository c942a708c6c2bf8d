package ch.wordgame.wordgamebackend.engine;

import ch.wordgame.wordgamebackend.domain.Board;
import ch.wordgame.wordgamebackend.domain.BoardPosition;
import ch.wordgame.wordgamebackend.domain.Tiles;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default placement engine.
 *
 * Rules implemented here:
 * - Start and end lie on the board, in one row or one column, start not after end, at least two squares apart.
 * - Tiles fill the free squares between start and end in order; occupied squares keep their letter
 *   and become part of the word. The number of tiles must match the number of free squares.
 * - The word must not continue past start or end (no adjacent tile in line).
 * - The first word covers the centre square; every later word touches a tile already on the board.
 * - The word must be accepted by the {@link WordValidator}.
 * - Every blank tile takes the next letter of the blank designations; the designation count
 *   must match the number of blanks. Blank letters are stored lower-case on the board.
 *
 * Scoring: sum of the letter values of the word (blank letters count 0, also when reused by
 * later words), plus {@link #ALL_TILES_BONUS} when a full rack
 * of {@link #FULL_RACK} tiles is placed. Cross-words are neither checked nor scored.
 */
public class StandardPlacementEngine implements PlacementEngine {

    public static final int FULL_RACK = 7;
    public static final int ALL_TILES_BONUS = 50;

    private final WordValidator wordValidator;

    public StandardPlacementEngine(WordValidator wordValidator) {
        this.wordValidator = wordValidator;
    }

    @Override
    public PlacementResult tryPlace(Board board, BoardPosition start, BoardPosition end,
                                    List<Character> tiles, List<Character> blanks) {
        if (start == null || end == null) {
            throw new IllegalMoveException("Start and end position are required");
        }
        if (tiles == null || tiles.isEmpty()) {
            throw new IllegalMoveException("At least one tile must be placed");
        }
        List<Character> designations = blanks == null ? List.of() : blanks;
        long blankCount = tiles.stream().filter(t -> t == Tiles.BLANK).count();
        if (blankCount != designations.size()) {
            throw new IllegalMoveException("Expected " + blankCount + " blank letter(s) but got " + designations.size());
        }
        if (designations.stream().anyMatch(c -> c < 'A' || c > 'Z')) {
            throw new IllegalMoveException("Blank tiles must stand for a letter A-Z");
        }
        if (!board.isInside(start) || !board.isInside(end)) {
            throw new IllegalMoveException("Placement is outside the board");
        }

        boolean horizontal = start.row() == end.row();
        if (!horizontal && start.col() != end.col()) {
            throw new IllegalMoveException("Tiles must be placed in a single row or column");
        }

        int dRow = horizontal ? 0 : 1;
        int dCol = horizontal ? 1 : 0;
        int length = horizontal ? end.col() - start.col() + 1 : end.row() - start.row() + 1;
        if (length < 1) {
            throw new IllegalMoveException("End position must not come before start position");
        }
        if (length < 2) {
            throw new IllegalMoveException("Words must be at least two letters long");
        }

        // 1) Walk the span, filling free squares with the given tiles
        Map<BoardPosition, Character> placed = new LinkedHashMap<>();
        StringBuilder word = new StringBuilder(length);
        StringBuilder scored = new StringBuilder(length);
        Iterator<Character> remaining = tiles.iterator();
        Iterator<Character> blankLetters = designations.iterator();
        boolean touchesExisting = false;
        boolean coversCenter = false;

        for (int i = 0; i < length; i++) {
            BoardPosition pos = start.offset(i * dRow, i * dCol);
            if (pos.equals(board.center())) {
                coversCenter = true;
            }
            if (board.isOccupied(pos)) {
                char existing = board.letterAt(pos);
                word.append(Character.toUpperCase(existing));
                scored.append(existing);
                touchesExisting = true;
                continue;
            }
            if (!remaining.hasNext()) {
                throw new IllegalMoveException("Not enough tiles to fill the squares between start and end");
            }
            char tile = remaining.next();
            char letter = tile == Tiles.BLANK ? Character.toLowerCase(blankLetters.next()) : tile;
            placed.put(pos, letter);
            word.append(Character.toUpperCase(letter));
            scored.append(letter);
            if (hasOccupiedNeighbour(board, pos)) {
                touchesExisting = true;
            }
        }
        if (remaining.hasNext()) {
            throw new IllegalMoveException("More tiles than free squares between start and end");
        }

        // 2) The word has to span the whole run of tiles in its line
        if (board.isOccupied(start.offset(-dRow, -dCol)) || board.isOccupied(end.offset(dRow, dCol))) {
            throw new IllegalMoveException("Word must include all adjacent tiles in its line");
        }

        // 3) Connection to the existing board
        if (board.isBlank()) {
            if (!coversCenter) {
                throw new IllegalMoveException("The first word must cover the centre square");
            }
        } else if (!touchesExisting) {
            throw new IllegalMoveException("Word must connect to tiles already on the board");
        }

        // 4) Dictionary
        String formed = word.toString();
        if (!wordValidator.isWord(formed)) {
            throw new IllegalMoveException("Not a valid word: " + formed);
        }

        int score = LetterValues.valueOf(scored);
        if (placed.size() == FULL_RACK) {
            score += ALL_TILES_BONUS;
        }
        return new PlacementResult(board.withLetters(placed), formed, score);
    }

    private boolean hasOccupiedNeighbour(Board board, BoardPosition pos) {
        return board.isOccupied(pos.offset(-1, 0))
                || board.isOccupied(pos.offset(1, 0))
                || board.isOccupied(pos.offset(0, -1))
                || board.isOccupied(pos.offset(0, 1));
    }
}
