package ch.wordgame.wordgamebackend.engine;

/**
 * Creates a fresh draw pool for every started game.
 */
@FunctionalInterface
public interface DrawPoolFactory {

    DrawPool create();
}
