package com.hypothesis.core;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Conversation state for one client, kept for the lifetime of the process.
 *
 * <p>History is a sliding window: once {@code historyWindow} turns are held, appending evicts the oldest.
 * Only the orchestrator mutates a session, and it does so while holding {@link #getTurnLock()}.
 */
public class Session {

    @Getter
    private final String id;

    @Getter
    private final Instant createdAt;

    private final int historyWindow;
    private final Deque<Turn> turns = new ArrayDeque<>();
    private final AtomicInteger fatalFailures = new AtomicInteger();
    private final AtomicBoolean abandoned = new AtomicBoolean();

    @Getter
    private final ReentrantLock turnLock = new ReentrantLock();

    @Getter
    private volatile Mode mode = Mode.CONVERSATIONAL;

    @Getter
    private volatile TurnState state = TurnState.IDLE;

    public Session(String id, int historyWindow) {
        if (historyWindow < 2) {
            throw new IllegalArgumentException("History window must hold at least one exchange: " + historyWindow);
        }
        this.id = id;
        this.historyWindow = historyWindow;
        this.createdAt = Instant.now();
    }

    public synchronized void append(Turn turn) {
        turns.addLast(turn);
        while (turns.size() > historyWindow) {
            turns.removeFirst();
        }
    }

    public synchronized List<Turn> getTurns() {
        return new ArrayList<>(turns);
    }

    /**
     * Most recent turns, oldest first.
     */
    public synchronized List<Turn> recentTurns(int count) {
        List<Turn> all = new ArrayList<>(turns);
        return all.subList(Math.max(0, all.size() - count), all.size());
    }

    public synchronized Optional<Turn> lastResearchTurn() {
        Iterator<Turn> it = turns.descendingIterator();
        while (it.hasNext()) {
            Turn turn = it.next();
            if (turn.isResearch()) {
                return Optional.of(turn);
            }
        }
        return Optional.empty();
    }

    public synchronized int size() {
        return turns.size();
    }

    public synchronized void clear() {
        turns.clear();
        fatalFailures.set(0);
        mode = Mode.CONVERSATIONAL;
    }

    public void setMode(Mode mode) {
        this.mode = mode;
    }

    public void setState(TurnState state) {
        this.state = state;
    }

    public int recordFatalFailure() {
        return fatalFailures.incrementAndGet();
    }

    public int getFatalFailures() {
        return fatalFailures.get();
    }

    /**
     * Requests that the in-flight turn stop before its next plan step.
     */
    public void abandonActiveTurn() {
        abandoned.set(true);
    }

    public boolean isAbandoned() {
        return abandoned.get();
    }

    /**
     * Called by the orchestrator when a new turn starts.
     */
    public void resetAbandoned() {
        abandoned.set(false);
    }
}
