package ch.wordgame.wordgamebackend.application.service;

import ch.wordgame.wordgamebackend.domain.BoardPosition;
import ch.wordgame.wordgamebackend.domain.Game;
import ch.wordgame.wordgamebackend.domain.GameConfiguration;
import ch.wordgame.wordgamebackend.domain.enums.GameEventType;
import ch.wordgame.wordgamebackend.domain.enums.GameStatus;
import ch.wordgame.wordgamebackend.domain.enums.TurnAction;
import ch.wordgame.wordgamebackend.domain.exception.GameErrorCode;
import ch.wordgame.wordgamebackend.service.GameEventPublisher;
import ch.wordgame.wordgamebackend.service.GameRegistry;
import ch.wordgame.wordgamebackend.service.GameService;
import ch.wordgame.wordgamebackend.turn.TurnController;
import ch.wordgame.wordgamebackend.turn.TurnControllerFactory;
import ch.wordgame.wordgamebackend.turn.TurnRequest;
import ch.wordgame.wordgamebackend.web.api.dto.GameEventDto;
import ch.wordgame.wordgamebackend.web.api.dto.GameStateDto;
import ch.wordgame.wordgamebackend.web.api.dto.JoinGameResponseDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.UUID;

import static ch.wordgame.wordgamebackend.testutil.GameTestUtils.assertRejected;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link GameService}.
 *
 * <p>The registry is real; turn controllers and the event channel are mocked, so these tests
 * only cover routing, lobby handling and the events published for it. Turn handling itself
 * is covered by {@link TurnControllerTest}.
 */
@ExtendWith(MockitoExtension.class)
class GameServiceTest {

    @Mock
    private TurnControllerFactory turnControllerFactory;

    @Mock
    private GameEventPublisher eventPublisher;

    @Mock
    private TurnController turnController;

    private GameRegistry gameRegistry;
    private GameService gameService;

    @BeforeEach
    void setUp() {
        gameRegistry = new GameRegistry(GameConfiguration.defaultConfig());
        gameService = new GameService(gameRegistry, turnControllerFactory, eventPublisher);
    }

    private Game startedGame() {
        Game game = gameService.createGame();
        gameService.joinGame(game.getId(), "Alice");
        gameService.joinGame(game.getId(), "Bob");
        when(turnControllerFactory.launch(any(Game.class))).thenReturn(turnController);
        gameService.startGame(game.getId());
        return game;
    }

    // ------------------------------------------------------------------------------------
    // lobby
    // ------------------------------------------------------------------------------------

    @Test
    void createGame_shouldRegisterLobbyGame() {
        Game game = gameService.createGame();

        assertThat(gameRegistry.lookup(game.getId())).isSameAs(game);
        assertThat(game.getStatus()).isEqualTo(GameStatus.LOBBY);
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void joinGame_shouldReturnJoinNumberAndPublishEvent() {
        Game game = gameService.createGame();

        JoinGameResponseDto alice = gameService.joinGame(game.getId(), "Alice");
        JoinGameResponseDto bob = gameService.joinGame(game.getId(), "  Bob ");

        assertThat(alice.playerNumber()).isZero();
        assertThat(bob.playerNumber()).isEqualTo(1);
        assertThat(bob.playerName()).isEqualTo("Bob");
        assertThat(bob.gameId()).isEqualTo(game.getId());

        ArgumentCaptor<GameEventDto> events = ArgumentCaptor.forClass(GameEventDto.class);
        verify(eventPublisher, times(2)).publish(events.capture());
        GameEventDto last = events.getAllValues().get(1);
        assertThat(last.type()).isEqualTo(GameEventType.PLAYER_JOINED);
        assertThat(last.payload())
                .containsEntry("playerName", "Bob")
                .containsEntry("playerCount", 2)
                .doesNotContainKey("playerId");
    }

    @Test
    void joinGame_blankOrTooLongName_shouldFailWithInvalidRequest() {
        Game game = gameService.createGame();

        assertRejected(() -> gameService.joinGame(game.getId(), " "), GameErrorCode.INVALID_REQUEST);
        assertRejected(() -> gameService.joinGame(game.getId(), null), GameErrorCode.INVALID_REQUEST);
        assertRejected(() -> gameService.joinGame(game.getId(), "x".repeat(51)), GameErrorCode.INVALID_REQUEST);

        assertThat(game.getPlayerCount()).isZero();
        verifyNoInteractions(eventPublisher);
    }

    @Test
    void joinGame_unknownGame_shouldFailWithNotFound() {
        assertRejected(() -> gameService.joinGame(UUID.randomUUID(), "Alice"), GameErrorCode.NOT_FOUND);
    }

    @Test
    void startGame_shouldLaunchControllerAndPublishEvent() {
        Game game = startedGame();

        assertThat(game.isActive()).isTrue();
        assertThat(game.getTurnController()).isSameAs(turnController);
        verify(turnControllerFactory).launch(game);

        ArgumentCaptor<GameEventDto> events = ArgumentCaptor.forClass(GameEventDto.class);
        verify(eventPublisher, times(3)).publish(events.capture());
        GameEventDto started = events.getAllValues().get(2);
        assertThat(started.type()).isEqualTo(GameEventType.GAME_STARTED);
        assertThat(started.gameStatus()).isEqualTo(GameStatus.ACTIVE);
        assertThat(started.payload()).containsEntry("currentTurnPlayerName", "Alice");
    }

    @Test
    void startGame_withOnePlayer_shouldNotLaunchController() {
        Game game = gameService.createGame();
        gameService.joinGame(game.getId(), "Alice");

        assertRejected(() -> gameService.startGame(game.getId()), GameErrorCode.NOT_ENOUGH_PLAYERS);

        verifyNoInteractions(turnControllerFactory);
        assertThat(game.getStatus()).isEqualTo(GameStatus.LOBBY);
    }

    @Test
    void startGame_twice_shouldFailWithAlreadyStarted() {
        Game game = startedGame();

        assertRejected(() -> gameService.startGame(game.getId()), GameErrorCode.ALREADY_STARTED);
        verify(turnControllerFactory, times(1)).launch(any(Game.class));
    }

    // ------------------------------------------------------------------------------------
    // turn requests
    // ------------------------------------------------------------------------------------

    @Test
    void getState_beforeStart_shouldFailWithNotStarted() {
        Game game = gameService.createGame();
        UUID playerId = gameService.joinGame(game.getId(), "Alice").playerId();

        assertRejected(() -> gameService.getState(game.getId(), playerId), GameErrorCode.NOT_STARTED);
    }

    @Test
    void getState_unknownGame_shouldFailWithNotFound() {
        assertRejected(() -> gameService.getState(UUID.randomUUID(), UUID.randomUUID()), GameErrorCode.NOT_FOUND);
    }

    @Test
    void play_shouldRouteParsedRequestToTurnController() {
        Game game = startedGame();
        UUID aliceId = game.getPlayersInTurnOrder().get(0).getId();
        GameStateDto state = new GameStateDto(game.getId(), List.of(), List.of(), 1, "SDOGLMN", 3);
        when(turnController.submit(any(TurnRequest.class))).thenReturn(state);

        GameStateDto result = gameService.play(game.getId(), aliceId,
                new BoardPosition(7, 6), new BoardPosition(7, 8), "cat", null);

        assertThat(result).isSameAs(state);
        ArgumentCaptor<TurnRequest> request = ArgumentCaptor.forClass(TurnRequest.class);
        verify(turnController).submit(request.capture());
        assertThat(request.getValue().action()).isEqualTo(TurnAction.PLAY);
        assertThat(request.getValue().playerId()).isEqualTo(aliceId);
        assertThat(request.getValue().tiles()).containsExactly('C', 'A', 'T');
        assertThat(request.getValue().startPos()).isEqualTo(new BoardPosition(7, 6));
        assertThat(request.getValue().blanks()).isEmpty();
    }

    @Test
    void play_withBlank_shouldParseDesignatedLetters() {
        Game game = startedGame();
        UUID aliceId = game.getPlayersInTurnOrder().get(0).getId();
        when(turnController.submit(any(TurnRequest.class)))
                .thenReturn(new GameStateDto(game.getId(), List.of(), List.of(), 1, "SDOGLMN", 3));

        gameService.play(game.getId(), aliceId, new BoardPosition(7, 6), new BoardPosition(7, 8), "c?t", "a");

        ArgumentCaptor<TurnRequest> request = ArgumentCaptor.forClass(TurnRequest.class);
        verify(turnController).submit(request.capture());
        assertThat(request.getValue().tiles()).containsExactly('C', '?', 'T');
        assertThat(request.getValue().blanks()).containsExactly('A');
    }

    @Test
    void swap_shouldRouteToTurnController() {
        Game game = startedGame();
        UUID bobId = game.getPlayersInTurnOrder().get(1).getId();
        GameStateDto state = new GameStateDto(game.getId(), List.of(), List.of(), 0, "EFGHIJK", 6);
        when(turnController.submit(any(TurnRequest.class))).thenReturn(state);

        gameService.swap(game.getId(), bobId, "qx");

        ArgumentCaptor<TurnRequest> request = ArgumentCaptor.forClass(TurnRequest.class);
        verify(turnController).submit(request.capture());
        assertThat(request.getValue().action()).isEqualTo(TurnAction.SWAP);
        assertThat(request.getValue().tiles()).containsExactly('Q', 'X');
    }

    @Test
    void turnRequest_withoutPlayerId_shouldFailWithInvalidRequest() {
        Game game = startedGame();

        assertRejected(() -> gameService.getState(game.getId(), null), GameErrorCode.INVALID_REQUEST);
        verifyNoInteractions(turnController);
    }

    @Test
    void play_withNonLetterTiles_shouldFailWithInvalidRequest() {
        Game game = startedGame();
        UUID aliceId = game.getPlayersInTurnOrder().get(0).getId();

        assertRejected(() -> gameService.play(game.getId(), aliceId,
                new BoardPosition(7, 6), new BoardPosition(7, 8), "c4t", null), GameErrorCode.INVALID_REQUEST);
        assertRejected(() -> gameService.play(game.getId(), aliceId,
                new BoardPosition(7, 6), new BoardPosition(7, 8), "c?t", "?"), GameErrorCode.INVALID_REQUEST);
        verifyNoInteractions(turnController);
    }
}
