package ch.wordgame.wordgamebackend.turn;

import ch.wordgame.wordgamebackend.domain.Game;
import ch.wordgame.wordgamebackend.domain.Player;
import ch.wordgame.wordgamebackend.domain.Tiles;
import ch.wordgame.wordgamebackend.domain.exception.GameErrorCode;
import ch.wordgame.wordgamebackend.domain.exception.GameException;
import ch.wordgame.wordgamebackend.engine.DrawPool;
import ch.wordgame.wordgamebackend.engine.IllegalMoveException;
import ch.wordgame.wordgamebackend.engine.PlacementEngine;
import ch.wordgame.wordgamebackend.engine.PlacementResult;
import ch.wordgame.wordgamebackend.service.GameEventPublisher;
import ch.wordgame.wordgamebackend.web.api.dto.GameEventDto;
import ch.wordgame.wordgamebackend.web.api.dto.GameStateDto;
import ch.wordgame.wordgamebackend.web.api.dto.PlayerSummaryDto;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Exclusive owner of an active game.
 *
 * <p>Request threads call {@link #submit(TurnRequest)}, which puts the request into this
 * controller's mailbox and blocks on the player's reply slot. The controller's own worker
 * thread ({@link #run()}) takes requests one at a time in mailbox order, so racks, scores,
 * board and turn index are only ever touched by that single thread and need no locking.
 *
 * <p>Turn order is enforced through the game's turn index, not arrival order: a play or swap
 * from a player whose number differs from the turn index is rejected and leaves the game
 * unchanged.
 */
@Slf4j
public class TurnController implements Runnable {

    private final Game game;
    private final List<Player> turnOrder;
    private final PlacementEngine placementEngine;
    private final DrawPool drawPool;
    private final GameEventPublisher eventPublisher;
    private final Duration replyTimeout;

    private final BlockingQueue<Envelope> mailbox = new LinkedBlockingQueue<>();

    private volatile boolean running = true;
    private volatile Thread worker;

    private record Envelope(long ticket, Player player, TurnRequest request) {}

    public TurnController(Game game,
                          List<Player> turnOrder,
                          PlacementEngine placementEngine,
                          DrawPool drawPool,
                          GameEventPublisher eventPublisher,
                          Duration replyTimeout) {
        this.game = game;
        this.turnOrder = List.copyOf(turnOrder);
        this.placementEngine = placementEngine;
        this.drawPool = drawPool;
        this.eventPublisher = eventPublisher;
        this.replyTimeout = replyTimeout;
    }

    /**
     * Submits a request and waits for its reply.
     *
     * @param request request of one player
     * @return the state view for the requesting player
     * @throws GameException {@link GameErrorCode#NOT_FOUND} for an unknown player or a stopped controller,
     *                       {@link GameErrorCode#REQUEST_IN_FLIGHT} if the player is still waiting for an
     *                       earlier reply, {@link GameErrorCode#TIMEOUT} if no reply arrives in time, or the
     *                       rejection produced by the controller
     */
    public GameStateDto submit(TurnRequest request) {
        Player player = game.findPlayer(request.playerId())
                .orElseThrow(() -> new GameException(GameErrorCode.NOT_FOUND,
                        "No player with ID " + request.playerId() + " in game " + game.getId()));
        if (!running) {
            throw new GameException(GameErrorCode.NOT_FOUND, "Game " + game.getId() + " is no longer available");
        }

        long ticket = player.beginRequest();
        try {
            mailbox.add(new Envelope(ticket, player, request));
            return player.awaitReply(ticket, replyTimeout).unwrap();
        } finally {
            player.endRequest();
        }
    }

    /**
     * Stops the worker after the request it is currently handling.
     */
    public void stop() {
        running = false;
        Thread current = worker;
        if (current != null) {
            current.interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public void run() {
        worker = Thread.currentThread();
        log.info("Turn controller started for game {} with {} players", game.getId(), turnOrder.size());
        try {
            dealInitialRacks();
            while (running) {
                Envelope envelope;
                try {
                    envelope = mailbox.take();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                }
                deliver(envelope, handle(envelope));
            }
        } finally {
            running = false;
            log.info("Turn controller stopped for game {}", game.getId());
        }
    }

    private void dealInitialRacks() {
        int rackSize = game.getConfig().getRackSize();
        for (Player player : turnOrder) {
            player.getRack().addAll(drawPool.draw(rackSize));
        }
    }

    private TurnReply handle(Envelope envelope) {
        Player player = envelope.player();
        TurnRequest request = envelope.request();
        game.touch();
        try {
            GameStateDto state = switch (request.action()) {
                case QUERY -> stateFor(player);
                case PLAY -> play(player, request);
                case SWAP -> swap(player, request);
            };
            return TurnReply.success(envelope.ticket(), state);
        } catch (GameException e) {
            log.debug("Rejected {} from player {} in game {}: {} ({})",
                    request.action(), player.getName(), game.getId(), e.getCode(), e.getMessage());
            return TurnReply.failure(envelope.ticket(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected failure handling {} in game {}", request.action(), game.getId(), e);
            return TurnReply.failure(envelope.ticket(),
                    new GameException(GameErrorCode.INTERNAL_ERROR, "Internal error while handling request", e));
        }
    }

    private GameStateDto play(Player player, TurnRequest request) {
        requireTurn(player);
        List<Character> tiles = request.tiles();
        if (!Tiles.containsAll(player.getRack(), tiles)) {
            throw new GameException(GameErrorCode.INVALID_TILES,
                    "Tiles " + Tiles.asString(tiles) + " are not all on your rack");
        }

        PlacementResult result;
        try {
            result = placementEngine.tryPlace(game.getBoard(), request.startPos(), request.endPos(),
                    tiles, request.blanks());
        } catch (IllegalMoveException e) {
            throw new GameException(GameErrorCode.ILLEGAL_MOVE, e.getMessage(), e);
        }

        Tiles.removeAll(player.getRack(), tiles);
        player.getRack().addAll(drawPool.draw(tiles.size()));
        player.addScore(result.score());
        game.setBoard(result.board());
        Player next = turnOrder.get(game.advanceTurn());

        log.info("Player {} played {} for {} points in game {}", player.getName(), result.word(), result.score(), game.getId());
        eventPublisher.publish(GameEventDto.tilesPlayed(game, player, result.word(), result.score(), next));
        return stateFor(player);
    }

    private GameStateDto swap(Player player, TurnRequest request) {
        requireTurn(player);
        List<Character> tiles = request.tiles();
        if (tiles.isEmpty()) {
            throw new GameException(GameErrorCode.INVALID_TILES, "No tiles given to swap");
        }
        if (!Tiles.containsAll(player.getRack(), tiles)) {
            throw new GameException(GameErrorCode.INVALID_TILES,
                    "Tiles " + Tiles.asString(tiles) + " are not all on your rack");
        }

        List<Character> replacements;
        try {
            replacements = drawPool.exchange(tiles);
        } catch (IllegalMoveException e) {
            throw new GameException(GameErrorCode.ILLEGAL_MOVE, e.getMessage(), e);
        }

        Tiles.removeAll(player.getRack(), tiles);
        player.getRack().addAll(replacements);
        Player next = turnOrder.get(game.advanceTurn());

        log.info("Player {} swapped {} tiles in game {}", player.getName(), tiles.size(), game.getId());
        eventPublisher.publish(GameEventDto.tilesSwapped(game, player, tiles.size(), next));
        return stateFor(player);
    }

    private void requireTurn(Player player) {
        if (player.getNumber() != game.getTurnIndex()) {
            throw new GameException(GameErrorCode.NOT_YOUR_TURN,
                    "It is not " + player.getName() + "'s turn");
        }
    }

    private GameStateDto stateFor(Player requester) {
        return new GameStateDto(
                game.getId(),
                turnOrder.stream().map(PlayerSummaryDto::from).toList(),
                game.getBoard().getRows(),
                game.getTurnIndex(),
                Tiles.asString(requester.getRack()),
                drawPool.remaining()
        );
    }

    private void deliver(Envelope envelope, TurnReply reply) {
        if (!envelope.player().deliver(reply)) {
            log.warn("Dropped reply {} for player {} in game {}: reply slot still occupied",
                    envelope.ticket(), envelope.player().getName(), game.getId());
        }
    }
}
