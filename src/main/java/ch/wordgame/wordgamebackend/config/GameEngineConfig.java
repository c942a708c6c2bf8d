package ch.wordgame.wordgamebackend.config;

import ch.wordgame.wordgamebackend.domain.GameConfiguration;
import ch.wordgame.wordgamebackend.engine.DrawPoolFactory;
import ch.wordgame.wordgamebackend.engine.PlacementEngine;
import ch.wordgame.wordgamebackend.engine.StandardPlacementEngine;
import ch.wordgame.wordgamebackend.engine.TileBag;
import ch.wordgame.wordgamebackend.engine.WordListValidator;
import ch.wordgame.wordgamebackend.engine.WordValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * Wires the game rules: configuration, word validation, placement and tile supply.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code wordgame.dictionary.location}: word list resource; empty accepts every word</li>
 * </ul>
 */
@Slf4j
@Configuration
public class GameEngineConfig {

    @Bean
    public GameConfiguration gameConfiguration() {
        return GameConfiguration.defaultConfig();
    }

    @Bean
    public WordValidator wordValidator(@Value("${wordgame.dictionary.location:}") String location,
                                       ResourceLoader resourceLoader) throws IOException {
        if (location == null || location.isBlank()) {
            log.info("No dictionary configured, every word is accepted");
            return WordValidator.acceptAll();
        }
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            WordListValidator validator = WordListValidator.load(in);
            log.info("Loaded {} words from {}", validator.size(), location);
            return validator;
        }
    }

    @Bean
    public PlacementEngine placementEngine(WordValidator wordValidator) {
        return new StandardPlacementEngine(wordValidator);
    }

    @Bean
    public DrawPoolFactory drawPoolFactory() {
        return TileBag::new;
    }
}
