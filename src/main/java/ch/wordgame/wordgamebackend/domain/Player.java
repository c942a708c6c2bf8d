package ch.wordgame.wordgamebackend.domain;

import ch.wordgame.wordgamebackend.domain.exception.GameErrorCode;
import ch.wordgame.wordgamebackend.domain.exception.GameException;
import ch.wordgame.wordgamebackend.turn.TurnReply;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Player participating in a game.
 *
 * <p>Identity, name and join number are fixed at join time. Rack and score belong to the
 * game's turn controller once the game is active and must not be touched by other threads.
 *
 * <p>Each player owns a single-slot reply channel. The turn controller writes exactly one
 * reply per request it services for this player; the caller that submitted the request is
 * its only reader.
 */
@Slf4j
@Getter
public class Player {

    private final UUID id;

    /**
     * Display name chosen by the player.
     */
    private final String name;

    /**
     * Zero-based join order; position in the turn rotation.
     */
    private final int number;

    private final List<Character> rack = new ArrayList<>();

    private int score;

    @Getter(AccessLevel.NONE)
    private final BlockingQueue<TurnReply> replySlot = new ArrayBlockingQueue<>(1);

    @Getter(AccessLevel.NONE)
    private final AtomicBoolean requestInFlight = new AtomicBoolean();

    @Getter(AccessLevel.NONE)
    private final AtomicLong ticketSequence = new AtomicLong();

    public Player(UUID id, String name, int number) {
        this.id = id;
        this.name = name;
        this.number = number;
    }

    public void addScore(int points) {
        this.score += points;
    }

    /**
     * Marks a request of this player as outstanding and returns its ticket.
     *
     * @return ticket the matching reply will carry
     * @throws GameException with {@link GameErrorCode#REQUEST_IN_FLIGHT} if an earlier request is still awaited
     */
    public long beginRequest() {
        if (!requestInFlight.compareAndSet(false, true)) {
            throw new GameException(GameErrorCode.REQUEST_IN_FLIGHT,
                    "Player " + name + " already has a request in progress");
        }
        return ticketSequence.incrementAndGet();
    }

    public void endRequest() {
        requestInFlight.set(false);
    }

    /**
     * Waits for the reply carrying {@code ticket}. Replies to earlier, timed out requests
     * are discarded.
     *
     * @param ticket ticket returned by {@link #beginRequest()}
     * @param timeout maximum time to wait
     * @return the matching reply
     * @throws GameException with {@link GameErrorCode#TIMEOUT} if no matching reply arrives in time
     */
    public TurnReply awaitReply(long ticket, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        try {
            while (true) {
                long remaining = deadline - System.nanoTime();
                TurnReply reply = remaining > 0 ? replySlot.poll(remaining, TimeUnit.NANOSECONDS) : null;
                if (reply == null) {
                    throw new GameException(GameErrorCode.TIMEOUT,
                            "No reply from the turn controller within " + timeout.toMillis() + " ms");
                }
                if (reply.ticket() == ticket) {
                    return reply;
                }
                log.debug("Discarding stale reply {} for player {} (waiting for {})", reply.ticket(), id, ticket);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GameException(GameErrorCode.TIMEOUT, "Interrupted while waiting for the turn controller", e);
        }
    }

    /**
     * Puts a reply into this player's slot without blocking. Replies with an older ticket
     * still in the slot belong to requests whose caller has already given up and are dropped.
     *
     * @return {@code false} if the slot is held by a reply that is not older than {@code reply}
     */
    public boolean deliver(TurnReply reply) {
        TurnReply stale = replySlot.peek();
        while (stale != null && stale.ticket() < reply.ticket()) {
            if (replySlot.remove(stale)) {
                log.debug("Dropped stale reply {} for player {}", stale.ticket(), id);
            }
            stale = replySlot.peek();
        }
        return replySlot.offer(reply);
    }
}
