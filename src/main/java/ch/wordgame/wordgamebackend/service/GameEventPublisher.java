package ch.wordgame.wordgamebackend.service;

import ch.wordgame.wordgamebackend.web.api.dto.GameEventDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Pushes public game events to {@code /topic/games/{gameId}/events}.
 *
 * <p>Broker failures are logged only; game state never depends on event delivery.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameEventPublisher {

    private final SimpMessagingTemplate messagingTemplate;

    public static String destination(UUID gameId) {
        return "/topic/games/" + gameId + "/events";
    }

    public void publish(GameEventDto event) {
        try {
            messagingTemplate.convertAndSend(destination(event.gameId()), event);
        } catch (MessagingException e) {
            log.warn("Could not publish {} for game {}: {}", event.type(), event.gameId(), e.getMessage());
        }
    }
}
