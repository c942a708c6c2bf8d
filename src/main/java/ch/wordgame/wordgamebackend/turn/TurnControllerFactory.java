package ch.wordgame.wordgamebackend.turn;

import ch.wordgame.wordgamebackend.domain.Game;
import ch.wordgame.wordgamebackend.engine.DrawPoolFactory;
import ch.wordgame.wordgamebackend.engine.PlacementEngine;
import ch.wordgame.wordgamebackend.service.GameEventPublisher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Creates the turn controller of a game when it starts and runs it on its own worker thread.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code wordgame.turn.reply-timeout-ms}: how long a caller waits for its reply (default: 10000)</li>
 * </ul>
 */
@Slf4j
@Component
public class TurnControllerFactory {

    private final ExecutorService turnControllerExecutor;
    private final PlacementEngine placementEngine;
    private final DrawPoolFactory drawPoolFactory;
    private final GameEventPublisher eventPublisher;
    private final Duration replyTimeout;

    public TurnControllerFactory(ExecutorService turnControllerExecutor,
                                 PlacementEngine placementEngine,
                                 DrawPoolFactory drawPoolFactory,
                                 GameEventPublisher eventPublisher,
                                 @Value("${wordgame.turn.reply-timeout-ms:10000}") long replyTimeoutMs) {
        this.turnControllerExecutor = turnControllerExecutor;
        this.placementEngine = placementEngine;
        this.drawPoolFactory = drawPoolFactory;
        this.eventPublisher = eventPublisher;
        this.replyTimeout = Duration.ofMillis(replyTimeoutMs);
    }

    /**
     * Builds the controller for {@code game} and starts its worker. Called by
     * {@link Game#start(java.util.function.Function)} while the lobby lock is held.
     *
     * @param game game being activated; players and board are already fixed
     * @return the running controller
     */
    public TurnController launch(Game game) {
        TurnController controller = new TurnController(
                game,
                game.getPlayersInTurnOrder(),
                placementEngine,
                drawPoolFactory.create(),
                eventPublisher,
                replyTimeout
        );
        turnControllerExecutor.execute(controller);
        log.debug("Launched turn controller for game {}", game.getId());
        return controller;
    }
}
