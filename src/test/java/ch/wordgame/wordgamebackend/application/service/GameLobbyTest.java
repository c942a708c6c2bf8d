package ch.wordgame.wordgamebackend.application.service;

import ch.wordgame.wordgamebackend.domain.Game;
import ch.wordgame.wordgamebackend.domain.GameConfiguration;
import ch.wordgame.wordgamebackend.domain.Player;
import ch.wordgame.wordgamebackend.domain.enums.GameStatus;
import ch.wordgame.wordgamebackend.domain.exception.GameErrorCode;
import ch.wordgame.wordgamebackend.domain.exception.GameException;
import ch.wordgame.wordgamebackend.turn.TurnController;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static ch.wordgame.wordgamebackend.testutil.GameTestUtils.assertRejected;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class GameLobbyTest {

    private final Function<Game, TurnController> launcher = g -> mock(TurnController.class);

    @Test
    void addPlayer_shouldNumberPlayersByJoinOrder() {
        Game game = new Game(GameConfiguration.defaultConfig());

        Player alice = game.addPlayer("Alice");
        Player bob = game.addPlayer("Bob");
        Player carol = game.addPlayer("Carol");

        assertThat(alice.getNumber()).isZero();
        assertThat(bob.getNumber()).isEqualTo(1);
        assertThat(carol.getNumber()).isEqualTo(2);
        assertThat(game.getPlayersInTurnOrder()).containsExactly(alice, bob, carol);
        assertThat(game.findPlayer(bob.getId())).contains(bob);
    }

    @Test
    void addPlayer_fifthPlayer_shouldBeRejectedWithGameFull() {
        Game game = new Game(GameConfiguration.defaultConfig());
        game.addPlayer("P1");
        game.addPlayer("P2");
        game.addPlayer("P3");
        game.addPlayer("P4");

        assertRejected(() -> game.addPlayer("P5"), GameErrorCode.GAME_FULL);
        assertThat(game.getPlayerCount()).isEqualTo(4);
    }

    @Test
    void start_withZeroOrOnePlayer_shouldFailWithNotEnoughPlayers() {
        Game game = new Game(GameConfiguration.defaultConfig());
        assertRejected(() -> game.start(launcher), GameErrorCode.NOT_ENOUGH_PLAYERS);

        game.addPlayer("Alice");
        assertRejected(() -> game.start(launcher), GameErrorCode.NOT_ENOUGH_PLAYERS);

        assertThat(game.getStatus()).isEqualTo(GameStatus.LOBBY);
        assertThat(game.getTurnController()).isNull();
    }

    @Test
    void start_shouldActivateExactlyOnce() {
        Game game = new Game(GameConfiguration.defaultConfig());
        game.addPlayer("Alice");
        game.addPlayer("Bob");

        game.start(launcher);

        assertThat(game.isActive()).isTrue();
        assertThat(game.getTurnController()).isNotNull();
        assertThat(game.getTurnIndex()).isZero();
        assertThat(game.getBoard().isBlank()).isTrue();

        TurnController first = game.getTurnController();
        assertRejected(() -> game.start(launcher), GameErrorCode.ALREADY_STARTED);
        assertThat(game.getTurnController()).isSameAs(first);
    }

    @Test
    void addPlayer_afterStart_shouldFailWithAlreadyStarted_regardlessOfPlayerCount() {
        Game game = new Game(GameConfiguration.defaultConfig());
        game.addPlayer("Alice");
        game.addPlayer("Bob");
        game.start(launcher);

        assertRejected(() -> game.addPlayer("Carol"), GameErrorCode.ALREADY_STARTED);
        assertThat(game.getPlayerCount()).isEqualTo(2);
    }

    @Test
    void addPlayer_fullAndStarted_shouldReportAlreadyStarted() {
        Game game = new Game(GameConfiguration.defaultConfig());
        for (int i = 0; i < 4; i++) {
            game.addPlayer("P" + i);
        }
        game.start(launcher);

        assertRejected(() -> game.addPlayer("P5"), GameErrorCode.ALREADY_STARTED);
    }

    @Test
    void start_whenLauncherFails_shouldStayInLobby() {
        Game game = new Game(GameConfiguration.defaultConfig());
        game.addPlayer("Alice");
        game.addPlayer("Bob");

        Function<Game, TurnController> failing = g -> {
            throw new IllegalStateException("executor rejected");
        };

        assertThatThrownBy(() -> game.start(failing))
                .isInstanceOf(IllegalStateException.class);

        assertThat(game.getStatus()).isEqualTo(GameStatus.LOBBY);
        Player carol = game.addPlayer("Carol");
        assertThat(carol.getNumber()).isEqualTo(2);
    }

    @Test
    void shutdown_shouldStopTurnController() {
        Game game = new Game(GameConfiguration.defaultConfig());
        game.addPlayer("Alice");
        game.addPlayer("Bob");
        TurnController controller = mock(TurnController.class);
        game.start(g -> controller);

        game.shutdown();

        verify(controller).stop();
    }

    @Test
    void addPlayer_concurrentJoins_shouldAdmitExactlyFourWithDistinctNumbers() throws Exception {
        Game game = new Game(GameConfiguration.defaultConfig());
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Integer> numbers = Collections.synchronizedList(new ArrayList<>());
        AtomicInteger full = new AtomicInteger();

        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String name = "Player" + i;
                futures.add(executor.submit(() -> {
                    go.await();
                    try {
                        numbers.add(game.addPlayer(name).getNumber());
                    } catch (GameException e) {
                        if (e.getCode() == GameErrorCode.GAME_FULL) {
                            full.incrementAndGet();
                        }
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(numbers).containsExactlyInAnyOrder(0, 1, 2, 3);
        assertThat(full.get()).isEqualTo(4);
    }
}
