package ch.wordgame.wordgamebackend.engine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Word validator backed by a word list (one word per line, case-insensitive, blank lines ignored).
 */
public class WordListValidator implements WordValidator {

    private final Set<String> words;

    public WordListValidator(Set<String> words) {
        this.words = words;
    }

    public static WordListValidator load(InputStream in) throws IOException {
        Set<String> words = new HashSet<>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String word = line.trim();
                if (!word.isEmpty()) {
                    words.add(word.toUpperCase(Locale.ROOT));
                }
            }
        }
        return new WordListValidator(words);
    }

    @Override
    public boolean isWord(String word) {
        return word != null && words.contains(word.toUpperCase(Locale.ROOT));
    }

    public int size() {
        return words.size();
    }
}
