package ch.wordgame.wordgamebackend.engine;

/**
 * Point value per letter (standard English tile values). Letters placed with a blank tile are
 * kept lower-case on the board and score nothing.
 */
public final class LetterValues {

    //                                    A  B  C  D  E  F  G  H  I  J  K  L  M  N  O  P   Q  R  S  T  U  V  W  X  Y   Z
    private static final int[] VALUES = {1, 3, 3, 2, 1, 4, 2, 4, 1, 8, 5, 1, 3, 1, 1, 3, 10, 1, 1, 1, 1, 4, 4, 8, 4, 10};

    private LetterValues() {
        // utility class
    }

    public static int valueOf(char letter) {
        if (letter < 'A' || letter > 'Z') {
            return 0;
        }
        return VALUES[letter - 'A'];
    }

    public static int valueOf(CharSequence word) {
        int sum = 0;
        for (int i = 0; i < word.length(); i++) {
            sum += valueOf(word.charAt(i));
        }
        return sum;
    }
}
