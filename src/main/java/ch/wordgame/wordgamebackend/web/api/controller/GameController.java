package ch.wordgame.wordgamebackend.web.api.controller;

import ch.wordgame.wordgamebackend.domain.Game;
import ch.wordgame.wordgamebackend.domain.Identifiers;
import ch.wordgame.wordgamebackend.service.GameService;
import ch.wordgame.wordgamebackend.web.api.dto.*;

import io.swagger.v3.oas.annotations.Operation;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST endpoints for the game lifecycle. Rejections are mapped to HTTP responses by
 * {@link WebExceptionAdvice}.
 */
@RestController
@RequestMapping("/api/games")
public class GameController {

    private final GameService gameService;

    public GameController(GameService gameService) {
        this.gameService = gameService;
    }

    @Operation(summary = "Create a new game")
    @PostMapping
    public ResponseEntity<CreateGameResponseDto> createGame() {
        Game game = gameService.createGame();
        return ResponseEntity.status(HttpStatus.CREATED).body(new CreateGameResponseDto(game.getId()));
    }

    @Operation(summary = "Join a game that has not started yet")
    @PostMapping("/{gameId}/join")
    public ResponseEntity<JoinGameResponseDto> joinGame(@PathVariable String gameId,
                                                        @RequestBody JoinGameRequest request) {
        return ResponseEntity.ok(gameService.joinGame(Identifiers.parse(gameId), request.playerName()));
    }

    @Operation(summary = "Start a game with at least two players")
    @PostMapping("/{gameId}/start")
    public ResponseEntity<Void> startGame(@PathVariable String gameId) {
        gameService.startGame(Identifiers.parse(gameId));
        return ResponseEntity.ok().build();
    }

    @Operation(summary = "Get the game state as seen by a player")
    @GetMapping("/{gameId}/state")
    public ResponseEntity<GameStateDto> getState(@PathVariable String gameId,
                                                 @RequestParam String playerId) {
        return ResponseEntity.ok(gameService.getState(Identifiers.parse(gameId), Identifiers.parse(playerId)));
    }

    @Operation(summary = "Play tiles on the board")
    @PostMapping("/{gameId}/play")
    public ResponseEntity<GameStateDto> play(@PathVariable String gameId,
                                             @RequestBody PlayRequest request) {
        GameStateDto state = gameService.play(
                Identifiers.parse(gameId),
                request.playerId(),
                request.startPos(),
                request.endPos(),
                request.tiles(),
                request.blanks()
        );
        return ResponseEntity.ok(state);
    }

    @Operation(summary = "Swap rack tiles for new ones from the pool")
    @PostMapping("/{gameId}/swap")
    public ResponseEntity<GameStateDto> swap(@PathVariable String gameId,
                                             @RequestBody SwapRequest request) {
        return ResponseEntity.ok(gameService.swap(Identifiers.parse(gameId), request.playerId(), request.tiles()));
    }
}
