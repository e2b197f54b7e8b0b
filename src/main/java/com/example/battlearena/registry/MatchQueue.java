package com.example.battlearena.registry;

import com.example.battlearena.model.domain.MatchmakingEntry;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * FIFO of players waiting for a PvP opponent.
 * Every method locks the queue itself; callers that need several steps to be atomic
 * synchronize on this instance too.
 */
@Component
public class MatchQueue {

    /** Two entries to start a match, the older one first. */
    public static final class Pair {
        private final MatchmakingEntry first;
        private final MatchmakingEntry second;

        Pair(MatchmakingEntry first, MatchmakingEntry second) {
            this.first = first;
            this.second = second;
        }

        public MatchmakingEntry getFirst() {
            return first;
        }

        public MatchmakingEntry getSecond() {
            return second;
        }
    }

    private final Deque<MatchmakingEntry> waiting = new ArrayDeque<>();

    public synchronized void enqueue(MatchmakingEntry entry) {
        waiting.addLast(entry);
    }

    public synchronized boolean contains(Long userId) {
        return waiting.stream().anyMatch(e -> e.getUserId().equals(userId));
    }

    /**
     * Takes the two oldest entries if both connections are still open. If one of them has
     * gone away the survivor goes back to the head of the queue and nothing is returned.
     */
    public synchronized Optional<Pair> pollPair(Predicate<MatchmakingEntry> alive) {
        if (waiting.size() < 2) {
            return Optional.empty();
        }
        MatchmakingEntry first = waiting.pollFirst();
        MatchmakingEntry second = waiting.pollFirst();
        boolean firstAlive = alive.test(first);
        boolean secondAlive = alive.test(second);
        if (firstAlive && secondAlive) {
            return Optional.of(new Pair(first, second));
        }
        if (secondAlive) {
            waiting.addFirst(second);
        }
        if (firstAlive) {
            waiting.addFirst(first);
        }
        return Optional.empty();
    }

    /** Puts an entry back at the head. Requeue a pair second-then-first to keep their order. */
    public synchronized void requeueFront(MatchmakingEntry entry) {
        waiting.addFirst(entry);
    }

    public synchronized Optional<MatchmakingEntry> removeByConnection(String connectionId) {
        return removeFirst(e -> e.getConnectionId().equals(connectionId));
    }

    public synchronized Optional<MatchmakingEntry> removeByUser(Long userId) {
        return removeFirst(e -> e.getUserId().equals(userId));
    }

    private Optional<MatchmakingEntry> removeFirst(Predicate<MatchmakingEntry> match) {
        Iterator<MatchmakingEntry> it = waiting.iterator();
        while (it.hasNext()) {
            MatchmakingEntry entry = it.next();
            if (match.test(entry)) {
                it.remove();
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public synchronized int size() {
        return waiting.size();
    }
}
