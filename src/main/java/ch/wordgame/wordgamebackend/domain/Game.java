package ch.wordgame.wordgamebackend.domain;

import ch.wordgame.wordgamebackend.domain.enums.GameStatus;
import ch.wordgame.wordgamebackend.domain.exception.GameErrorCode;
import ch.wordgame.wordgamebackend.domain.exception.GameException;
import ch.wordgame.wordgamebackend.turn.TurnController;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * One playthrough: players, board and turn state.
 *
 * <p>The game runs in two phases with different owners:
 * <ul>
 *   <li>{@link GameStatus#LOBBY}: any request thread may call {@link #addPlayer(String)} and
 *       {@link #start(Function)}; both run under the game's lobby lock.</li>
 *   <li>{@link GameStatus#ACTIVE}: the player set is frozen and the {@link TurnController}
 *       launched by {@code start} is the only code allowed to change racks, scores,
 *       the board and the turn index.</li>
 * </ul>
 */
@Getter
public class Game {

    private final UUID id;

    private final GameConfiguration config;

    @Getter(AccessLevel.NONE)
    private final ReentrantLock lobbyLock = new ReentrantLock();

    private volatile GameStatus status = GameStatus.LOBBY;

    /**
     * Join-ordered players. Mutable only under the lobby lock; replaced by an unmodifiable
     * copy on start.
     */
    @Getter(AccessLevel.NONE)
    private volatile Map<UUID, Player> players = new LinkedHashMap<>();

    /**
     * Current board. Owned by the turn controller after start.
     */
    private Board board;

    /**
     * Join number of the player whose turn it is. Owned by the turn controller after start.
     */
    private int turnIndex;

    private volatile TurnController turnController;

    private volatile Instant lastActivity;

    public Game(GameConfiguration config) {
        this(Identifiers.newId(), config);
    }

    public Game(UUID id, GameConfiguration config) {
        this.id = id;
        this.config = config;
        this.lastActivity = Instant.now();
    }

    public boolean isActive() {
        return status == GameStatus.ACTIVE;
    }

    /**
     * Adds a player in the lobby phase.
     *
     * @param name display name
     * @return the new player, numbered by join order
     * @throws GameException {@link GameErrorCode#ALREADY_STARTED} once the game is active,
     *                       {@link GameErrorCode#GAME_FULL} when the player limit is reached
     */
    public Player addPlayer(String name) {
        lobbyLock.lock();
        try {
            if (isActive()) {
                throw new GameException(GameErrorCode.ALREADY_STARTED, "Game has already started");
            }
            if (players.size() >= config.getMaxPlayers()) {
                throw new GameException(GameErrorCode.GAME_FULL, "Maximum players reached for game");
            }
            Player player = new Player(Identifiers.newId(), name, players.size());
            players.put(player.getId(), player);
            touch();
            return player;
        } finally {
            lobbyLock.unlock();
        }
    }

    /**
     * Activates the game and hands it over to a turn controller.
     *
     * <p>Player set, empty board and turn index are fixed before {@code launcher} runs, so
     * the controller sees a complete game from its first step. The transition happens
     * exactly once.
     *
     * @param launcher creates and starts the controller that owns this game from now on
     * @throws GameException {@link GameErrorCode#ALREADY_STARTED} if already active,
     *                       {@link GameErrorCode#NOT_ENOUGH_PLAYERS} below the minimum player count
     */
    public void start(Function<Game, TurnController> launcher) {
        lobbyLock.lock();
        try {
            if (isActive()) {
                throw new GameException(GameErrorCode.ALREADY_STARTED, "Game has already started");
            }
            if (players.size() < config.getMinPlayers()) {
                throw new GameException(GameErrorCode.NOT_ENOUGH_PLAYERS,
                        "At least " + config.getMinPlayers() + " players needed to start game");
            }
            Map<UUID, Player> lobbyPlayers = players;
            players = Collections.unmodifiableMap(new LinkedHashMap<>(lobbyPlayers));
            board = Board.empty(config.getBoardSize());
            turnIndex = 0;
            try {
                turnController = launcher.apply(this);
            } catch (RuntimeException e) {
                players = lobbyPlayers;
                throw e;
            }
            status = GameStatus.ACTIVE;
            touch();
        } finally {
            lobbyLock.unlock();
        }
    }

    public Optional<Player> findPlayer(UUID playerId) {
        if (isActive()) {
            return Optional.ofNullable(players.get(playerId));
        }
        lobbyLock.lock();
        try {
            return Optional.ofNullable(players.get(playerId));
        } finally {
            lobbyLock.unlock();
        }
    }

    /**
     * @return snapshot of the players in join order
     */
    public List<Player> getPlayersInTurnOrder() {
        if (isActive()) {
            return new ArrayList<>(players.values());
        }
        lobbyLock.lock();
        try {
            return new ArrayList<>(players.values());
        } finally {
            lobbyLock.unlock();
        }
    }

    public int getPlayerCount() {
        return getPlayersInTurnOrder().size();
    }

    /**
     * Replaces the board. Turn controller only.
     */
    public void setBoard(Board board) {
        this.board = board;
    }

    /**
     * Moves the turn to the next player in join order, wrapping around. Turn controller only.
     *
     * @return the new turn index
     */
    public int advanceTurn() {
        turnIndex = (turnIndex + 1) % players.size();
        return turnIndex;
    }

    public void touch() {
        lastActivity = Instant.now();
    }

    /**
     * Stops the turn controller, if any. Callers still waiting for a reply run into their timeout.
     */
    public void shutdown() {
        TurnController controller = turnController;
        if (controller != null) {
            controller.stop();
        }
    }
}
