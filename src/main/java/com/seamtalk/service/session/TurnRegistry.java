package com.seamtalk.service.session;

import com.seamtalk.domain.Side;
import com.seamtalk.domain.Turn;
import com.seamtalk.domain.TurnSnapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turns of one session, indexed by id, plus the reference to the single open turn.
 *
 * <p>Mutated only by the session thread; reads of snapshots may come from anywhere, hence the
 * synchronized methods. Bounded: the oldest archived turns are evicted past {@code capacity}.
 */
final class TurnRegistry {

    private final int capacity;
    private final Map<UUID, Turn> turns = new LinkedHashMap<>();
    private Turn active;

    TurnRegistry(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1");
        }
        this.capacity = capacity;
    }

    /**
     * Creates a turn and makes it the active one.
     *
     * @throws IllegalStateException if another turn is still active
     */
    synchronized Turn open(Side side, Instant at) {
        if (active != null) {
            throw new IllegalStateException("Turn " + active.id() + " is still active");
        }
        Turn turn = new Turn(UUID.randomUUID(), side, at);
        turns.put(turn.id(), turn);
        active = turn;
        evictOldest();
        return turn;
    }

    synchronized Optional<Turn> active() {
        return Optional.ofNullable(active);
    }

    /**
     * The active turn, or a new one standing in for it when a final transcript arrives without
     * any (e.g. after the active one was already archived).
     */
    synchronized Turn resolveActiveOrCreate(Side side, Instant at) {
        if (active != null) {
            return active;
        }
        return open(side, at);
    }

    /** Clears the active reference if it points at {@code turn}. The turn stays retrievable. */
    synchronized void archive(Turn turn) {
        if (active == turn) {
            active = null;
        }
    }

    synchronized Optional<Turn> find(UUID id) {
        return Optional.ofNullable(turns.get(id));
    }

    synchronized List<TurnSnapshot> snapshots() {
        List<TurnSnapshot> out = new ArrayList<>(turns.size());
        for (Turn t : turns.values()) {
            out.add(t.snapshot());
        }
        return out;
    }

    private void evictOldest() {
        Iterator<Map.Entry<UUID, Turn>> it = turns.entrySet().iterator();
        while (turns.size() > capacity && it.hasNext()) {
            Turn oldest = it.next().getValue();
            if (oldest != active) {
                it.remove();
            }
        }
    }
}
