package ch.wordgame.wordgamebackend.engine;

/**
 * Decides whether a formed word is acceptable.
 */
@FunctionalInterface
public interface WordValidator {

    boolean isWord(String word);

    static WordValidator acceptAll() {
        return word -> true;
    }
}
