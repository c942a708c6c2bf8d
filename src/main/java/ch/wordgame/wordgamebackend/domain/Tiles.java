package ch.wordgame.wordgamebackend.domain;

import ch.wordgame.wordgamebackend.domain.exception.GameErrorCode;
import ch.wordgame.wordgamebackend.domain.exception.GameException;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for tile sequences. Tiles are upper-case letters or {@link #BLANK}; a rack is a
 * multiset of tiles kept as a list.
 */
public final class Tiles {

    /**
     * Blank tile. Stands for any letter when played and scores nothing.
     */
    public static final char BLANK = '?';

    private Tiles() {
        // utility class
    }

    /**
     * Parses a client tile string such as {@code "cat"} or {@code "c?t"} into tiles.
     *
     * @param value letters, case-insensitive, and {@link #BLANK}; {@code null} yields no tiles
     * @return tiles in the given order
     * @throws GameException with {@link GameErrorCode#INVALID_REQUEST} for any other character
     */
    public static List<Character> parse(String value) {
        return parse(value, true);
    }

    /**
     * Parses the letters chosen for blank tiles, e.g. {@code "a"} for a play of {@code "c?t"}.
     *
     * @throws GameException with {@link GameErrorCode#INVALID_REQUEST} for non-letter characters
     */
    public static List<Character> parseLetters(String value) {
        return parse(value, false);
    }

    private static List<Character> parse(String value, boolean blanksAllowed) {
        List<Character> tiles = new ArrayList<>();
        if (value == null) {
            return tiles;
        }
        for (char c : value.trim().toCharArray()) {
            char upper = Character.toUpperCase(c);
            boolean valid = (upper >= 'A' && upper <= 'Z') || (blanksAllowed && upper == BLANK);
            if (!valid) {
                throw new GameException(GameErrorCode.INVALID_REQUEST, "Invalid tile: '" + c + "'");
            }
            tiles.add(upper);
        }
        return tiles;
    }

    public static String asString(List<Character> tiles) {
        StringBuilder sb = new StringBuilder(tiles.size());
        tiles.forEach(sb::append);
        return sb.toString();
    }

    /**
     * Multiset containment: every tile of {@code wanted} must be matched by a distinct tile of {@code rack}.
     */
    public static boolean containsAll(List<Character> rack, List<Character> wanted) {
        List<Character> remaining = new ArrayList<>(rack);
        for (Character tile : wanted) {
            if (!remaining.remove(tile)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Removes one occurrence per tile of {@code used} from {@code rack}.
     * Callers check {@link #containsAll(List, List)} first.
     */
    public static void removeAll(List<Character> rack, List<Character> used) {
        for (Character tile : used) {
            rack.remove(tile);
        }
    }
}
