package ch.wordgame.wordgamebackend.service;

import ch.wordgame.wordgamebackend.domain.Game;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Service responsible for removing idle games from the registry.
 *
 * <p>Games live in memory only and are never finished explicitly, so without eviction the
 * registry would grow for the whole process lifetime. A game whose last request is older than
 * the configured threshold is removed and its turn controller is stopped.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code wordgame.eviction.interval-ms}: how often to run the eviction (default: 10 minutes)</li>
 *   <li>{@code wordgame.eviction.idle-threshold-minutes}: idle time after which a game is removed (default: 24 hours)</li>
 * </ul>
 */
@Service
@Slf4j
@Getter
public class GameEvictionService {

    private final GameRegistry gameRegistry;

    @Value("${wordgame.eviction.idle-threshold-minutes:1440}")
    private long idleThresholdMinutes;

    public GameEvictionService(GameRegistry gameRegistry) {
        this.gameRegistry = gameRegistry;
    }

    /**
     * Scheduled task that evicts idle games.
     *
     * @return number of evicted games
     */
    @Scheduled(fixedRateString = "${wordgame.eviction.interval-ms:600000}")
    public int evictIdleGames() {
        Instant threshold = Instant.now().minusSeconds(idleThresholdMinutes * 60L);

        log.debug("Starting game eviction. Removing games idle since before {} (threshold: {} minutes)",
                threshold, idleThresholdMinutes);

        List<Game> idle = gameRegistry.snapshot().stream()
                .filter(game -> !game.getLastActivity().isAfter(threshold))
                .toList();

        int evicted = 0;
        for (Game game : idle) {
            if (gameRegistry.remove(game.getId()).isPresent()) {
                game.shutdown();
                evicted++;
            }
        }

        if (evicted > 0) {
            log.info("Evicted {} idle game(s) (idle longer than {} minutes)", evicted, idleThresholdMinutes);
        } else {
            log.debug("No idle games to evict");
        }
        return evicted;
    }
}
