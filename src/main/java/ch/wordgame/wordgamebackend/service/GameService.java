package ch.wordgame.wordgamebackend.service;

import ch.wordgame.wordgamebackend.domain.BoardPosition;
import ch.wordgame.wordgamebackend.domain.Game;
import ch.wordgame.wordgamebackend.domain.Player;
import ch.wordgame.wordgamebackend.domain.Tiles;
import ch.wordgame.wordgamebackend.domain.exception.GameErrorCode;
import ch.wordgame.wordgamebackend.domain.exception.GameException;
import ch.wordgame.wordgamebackend.turn.TurnController;
import ch.wordgame.wordgamebackend.turn.TurnControllerFactory;
import ch.wordgame.wordgamebackend.turn.TurnRequest;
import ch.wordgame.wordgamebackend.web.api.dto.GameEventDto;
import ch.wordgame.wordgamebackend.web.api.dto.GameStateDto;
import ch.wordgame.wordgamebackend.web.api.dto.JoinGameResponseDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Entry point for all game requests.
 *
 * <p>Routes each request to the right owner: lobby operations go to the game's lobby gate,
 * turn requests to the game's turn controller.
 */
@Slf4j
@Service
public class GameService {

    private static final int MAX_NAME_LENGTH = 50;

    private final GameRegistry gameRegistry;
    private final TurnControllerFactory turnControllerFactory;
    private final GameEventPublisher eventPublisher;

    public GameService(GameRegistry gameRegistry,
                       TurnControllerFactory turnControllerFactory,
                       GameEventPublisher eventPublisher) {
        this.gameRegistry = gameRegistry;
        this.turnControllerFactory = turnControllerFactory;
        this.eventPublisher = eventPublisher;
    }

    public Game createGame() {
        Game game = gameRegistry.create();
        log.info("Created game {}", game.getId());
        return game;
    }

    public JoinGameResponseDto joinGame(UUID gameId, String playerName) {
        if (playerName == null || playerName.isBlank()) {
            throw new GameException(GameErrorCode.INVALID_REQUEST, "Player name must not be empty");
        }
        String name = playerName.trim();
        if (name.length() > MAX_NAME_LENGTH) {
            throw new GameException(GameErrorCode.INVALID_REQUEST,
                    "Player name must be at most " + MAX_NAME_LENGTH + " characters");
        }

        Game game = gameRegistry.lookup(gameId);
        Player player = game.addPlayer(name);
        log.info("Player {} joined game {} as number {}", player.getName(), gameId, player.getNumber());

        eventPublisher.publish(GameEventDto.playerJoined(game, player, game.getPlayerCount()));

        return new JoinGameResponseDto(game.getId(), player.getId(), player.getName(), player.getNumber());
    }

    public void startGame(UUID gameId) {
        Game game = gameRegistry.lookup(gameId);
        game.start(turnControllerFactory::launch);
        log.info("Started game {} with {} players", gameId, game.getPlayerCount());

        Player first = game.getPlayersInTurnOrder().get(0);
        eventPublisher.publish(GameEventDto.gameStarted(game, first));
    }

    public GameStateDto getState(UUID gameId, UUID playerId) {
        return submit(gameId, TurnRequest.query(playerId));
    }

    public GameStateDto play(UUID gameId, UUID playerId, BoardPosition startPos, BoardPosition endPos,
                             String tiles, String blanks) {
        return submit(gameId, TurnRequest.play(playerId, startPos, endPos,
                Tiles.parse(tiles), Tiles.parseLetters(blanks)));
    }

    public GameStateDto swap(UUID gameId, UUID playerId, String tiles) {
        return submit(gameId, TurnRequest.swap(playerId, Tiles.parse(tiles)));
    }

    // ----------------- helpers -----------------

    private GameStateDto submit(UUID gameId, TurnRequest request) {
        if (request.playerId() == null) {
            throw new GameException(GameErrorCode.INVALID_REQUEST, "playerId is required");
        }
        Game game = gameRegistry.lookup(gameId);
        game.touch();
        TurnController controller = game.getTurnController();
        if (controller == null) {
            throw new GameException(GameErrorCode.NOT_STARTED, "Game " + gameId + " has not started yet");
        }
        return controller.submit(request);
    }
}
