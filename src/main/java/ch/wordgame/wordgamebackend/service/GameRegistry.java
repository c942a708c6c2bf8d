package ch.wordgame.wordgamebackend.service;

import ch.wordgame.wordgamebackend.domain.Game;
import ch.wordgame.wordgamebackend.domain.GameConfiguration;
import ch.wordgame.wordgamebackend.domain.exception.GameErrorCode;
import ch.wordgame.wordgamebackend.domain.exception.GameException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide map from game id to game.
 *
 * <p>One registry lock guards the map and is held only for the map access itself, never
 * across game-level operations, so its hold time does not depend on game activity.
 */
@Component
public class GameRegistry {

    private final GameConfiguration gameConfiguration;

    private final Map<UUID, Game> games = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public GameRegistry(GameConfiguration gameConfiguration) {
        this.gameConfiguration = gameConfiguration;
    }

    /**
     * Creates an empty lobby game and registers it.
     */
    public Game create() {
        Game game = new Game(gameConfiguration);
        lock.lock();
        try {
            games.put(game.getId(), game);
        } finally {
            lock.unlock();
        }
        return game;
    }

    /**
     * @throws GameException with {@link GameErrorCode#NOT_FOUND} if no such game is registered
     */
    public Game lookup(UUID gameId) {
        return find(gameId)
                .orElseThrow(() -> new GameException(GameErrorCode.NOT_FOUND, "No existing game with ID " + gameId));
    }

    public Optional<Game> find(UUID gameId) {
        lock.lock();
        try {
            return Optional.ofNullable(games.get(gameId));
        } finally {
            lock.unlock();
        }
    }

    public Optional<Game> remove(UUID gameId) {
        lock.lock();
        try {
            return Optional.ofNullable(games.remove(gameId));
        } finally {
            lock.unlock();
        }
    }

    public List<Game> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(games.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return games.size();
        } finally {
            lock.unlock();
        }
    }
}
