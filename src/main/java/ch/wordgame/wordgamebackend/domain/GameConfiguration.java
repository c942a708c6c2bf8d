package ch.wordgame.wordgamebackend.domain;

import lombok.Getter;

/**
 * Rules a game is created with.
 *
 * <p>Player limits are fixed: a game holds at most four players and needs at least two to start.
 */
@Getter
public class GameConfiguration {

    private final int maxPlayers;

    private final int minPlayers;

    /**
     * Number of tiles a full rack holds.
     */
    private final int rackSize;

    /**
     * Board edge length in squares.
     */
    private final int boardSize;

    private GameConfiguration(int maxPlayers, int minPlayers, int rackSize, int boardSize) {
        this.maxPlayers = maxPlayers;
        this.minPlayers = minPlayers;
        this.rackSize = rackSize;
        this.boardSize = boardSize;
    }

    /**
     * Returns the default game configuration used by the application.
     *
     * @return default configuration (2-4 players, 7 tile racks, 15x15 board)
     */
    public static GameConfiguration defaultConfig() {
        return new GameConfiguration(4, 2, 7, 15);
    }
}
