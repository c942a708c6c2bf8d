package ch.wordgame.wordgamebackend.web.api.controller;

import ch.wordgame.wordgamebackend.service.GameRegistry;
import ch.wordgame.wordgamebackend.web.api.dto.HealthStatusDto;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight health check: confirms the application context is alive and reports how many
 * games are currently held in memory.
 */
@RestController
@RequestMapping("/api")
public class HealthController {

    private final GameRegistry gameRegistry;

    public HealthController(GameRegistry gameRegistry) {
        this.gameRegistry = gameRegistry;
    }

    @GetMapping("/health")
    public HealthStatusDto health() {
        return new HealthStatusDto("OK", gameRegistry.size());
    }
}
