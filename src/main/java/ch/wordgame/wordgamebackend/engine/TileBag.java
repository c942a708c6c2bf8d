package ch.wordgame.wordgamebackend.engine;

import ch.wordgame.wordgamebackend.domain.Tiles;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Shuffled bag holding the 100 tiles of the standard English distribution: 98 letters and
 * two {@link Tiles#BLANK blanks}.
 */
public class TileBag implements DrawPool {

    //                                    A  B  C  D   E  F  G  H  I  J  K  L  M  N  O  P  Q  R  S  T  U  V  W  X  Y  Z
    private static final int[] COUNTS = {9, 2, 2, 4, 12, 2, 3, 2, 9, 1, 1, 4, 2, 6, 8, 2, 1, 6, 4, 6, 4, 2, 2, 1, 2, 1};
    private static final int BLANKS = 2;

    private final List<Character> tiles = new ArrayList<>();
    private final Random random;

    public TileBag() {
        this(new Random());
    }

    public TileBag(Random random) {
        this.random = random;
        for (int i = 0; i < COUNTS.length; i++) {
            for (int n = 0; n < COUNTS[i]; n++) {
                tiles.add((char) ('A' + i));
            }
        }
        for (int n = 0; n < BLANKS; n++) {
            tiles.add(Tiles.BLANK);
        }
        Collections.shuffle(tiles, random);
    }

    @Override
    public List<Character> draw(int count) {
        List<Character> drawn = new ArrayList<>();
        while (drawn.size() < count && !tiles.isEmpty()) {
            drawn.add(tiles.remove(tiles.size() - 1));
        }
        return drawn;
    }

    @Override
    public List<Character> exchange(List<Character> returned) {
        if (returned.size() > tiles.size()) {
            throw new IllegalMoveException("Only " + tiles.size() + " tiles left in the bag, cannot swap "
                    + returned.size());
        }
        // draw first so a player never gets their own tiles back
        List<Character> drawn = draw(returned.size());
        tiles.addAll(returned);
        Collections.shuffle(tiles, random);
        return drawn;
    }

    @Override
    public int remaining() {
        return tiles.size();
    }
}
