package ch.wordgame.wordgamebackend.web.api.dto;

import ch.wordgame.wordgamebackend.domain.Player;

/**
 * Public view of a player. Contains neither the player id nor the rack.
 */
public record PlayerSummaryDto(
        String name,
        int number,
        int score,
        int tileCount
) {
    public static PlayerSummaryDto from(Player player) {
        return new PlayerSummaryDto(
                player.getName(),
                player.getNumber(),
                player.getScore(),
                player.getRack().size()
        );
    }
}
