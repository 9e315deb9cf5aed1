package io.specqueue.coordinator;

import io.specqueue.model.CoordinatorState;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Strict forward round-robin over sources with pending work.
 *
 * <p>Every dispatch moves the cursor to the first eligible source after the current
 * one, wrapping around, even when the current source still has pending work. No I/O:
 * callers pass in which sources are eligible and persist the {@link CoordinatorState}.
 */
public final class SourceCoordinator {
    private final CoordinatorState state;
    private final Clock clock;

    public SourceCoordinator(CoordinatorState state) {
        this(state, Clock.systemUTC());
    }

    public SourceCoordinator(CoordinatorState state, Clock clock) {
        this.state = state;
        this.clock = clock;
    }

    public Optional<String> currentSource() {
        return Optional.ofNullable(state.currentSource());
    }

    public List<String> sourceOrder() {
        return List.copyOf(state.sourceOrder());
    }

    public boolean addSource(String sourceId) {
        if (state.sourceOrder().contains(sourceId)) {
            return false;
        }
        state.sourceOrder().add(sourceId);
        return true;
    }

    public boolean removeSource(String sourceId) {
        boolean removed = state.sourceOrder().remove(sourceId);
        if (sourceId.equals(state.currentSource())) {
            state.reset();
        }
        return removed;
    }

    public void syncSources(Collection<String> sourceIds) {
        Set<String> live = new LinkedHashSet<>(sourceIds);
        for (String known : new ArrayList<>(state.sourceOrder())) {
            if (!live.contains(known)) {
                removeSource(known);
            }
        }
        for (String sourceId : live) {
            addSource(sourceId);
        }
    }

    public Optional<String> peekNext(Set<String> eligible) {
        List<String> order = state.sourceOrder();
        List<String> pending = new ArrayList<>();
        for (String sourceId : order) {
            if (eligible.contains(sourceId)) {
                pending.add(sourceId);
            }
        }
        if (pending.isEmpty()) {
            return Optional.empty();
        }
        String current = state.currentSource();
        if (current == null) {
            return Optional.of(pending.get(0));
        }
        int currentIndex = order.indexOf(current);
        for (int i = currentIndex + 1; i < order.size(); i++) {
            if (eligible.contains(order.get(i))) {
                return Optional.of(order.get(i));
            }
        }
        return Optional.of(pending.get(0));
    }

    public Optional<String> dispatch(Set<String> eligible) {
        Optional<String> next = peekNext(eligible);
        next.ifPresent(sourceId -> state.moveTo(sourceId, Instant.now(clock)));
        return next;
    }
}
