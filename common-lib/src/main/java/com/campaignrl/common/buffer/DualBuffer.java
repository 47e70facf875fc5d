package com.campaignrl.common.buffer;

import com.campaignrl.common.model.Experience;
import com.campaignrl.common.model.ExperienceStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Active queue of pending experiences plus a bounded, time-retained history.
 *
 * <h3>Invariants</h3>
 * <ul>
 *   <li>{@code active.size() <= activeCapacity}, every element PENDING</li>
 *   <li>{@code history.size() <= historyCapacity}, every element PROCESSED or DROPPED_*</li>
 * </ul>
 *
 * <h3>Overflow policy</h3>
 * Adding to a full active queue evicts its oldest entry to history as
 * {@link ExperienceStatus#DROPPED_OVERFLOW}. That experience never contributes a Q-update.
 *
 * <h3>History eviction</h3>
 * After every archive: first entries older than {@code now - retention}, then oldest-first
 * until the capacity holds.
 *
 * <p>Not thread-safe; owned by {@code QLearningEngine}.
 */
public class DualBuffer {

    private final Deque<Experience> active  = new ArrayDeque<>();
    private final Deque<Experience> history = new ArrayDeque<>();

    private final int activeCapacity;
    private final int historyCapacity;
    private final int autoProcessThreshold;
    private final Duration retention;
    private final Clock clock;

    public DualBuffer(int activeCapacity, int historyCapacity, int autoProcessThreshold,
                      Duration retention, Clock clock) {
        this.activeCapacity       = activeCapacity;
        this.historyCapacity      = historyCapacity;
        this.autoProcessThreshold = autoProcessThreshold;
        this.retention            = retention;
        this.clock                = clock;
    }

    /**
     * Appends a pending experience.
     *
     * @return the experience dropped to history to make room, if any
     */
    public Optional<Experience> add(Experience experience) {
        if (!experience.isPending()) {
            throw new IllegalArgumentException("Only pending experiences enter the active buffer: " + experience.id());
        }
        Experience dropped = null;
        if (active.size() >= activeCapacity) {
            dropped = active.pollFirst().markDropped(ExperienceStatus.DROPPED_OVERFLOW, clock.instant());
            archive(dropped);
            evictHistory();
        }
        active.addLast(experience);
        return Optional.ofNullable(dropped);
    }

    public boolean shouldAutoProcess() {
        return active.size() >= autoProcessThreshold;
    }

    /** Removes and returns every pending experience, oldest first. */
    public List<Experience> drainUnprocessed() {
        List<Experience> drained = new ArrayList<>(active);
        active.clear();
        return drained;
    }

    /**
     * Marks the given experiences PROCESSED and archives them.
     *
     * @return the archived (processed) instances
     */
    public List<Experience> moveToHistory(Collection<Experience> experiences) {
        Instant now = clock.instant();
        List<Experience> archived = new ArrayList<>(experiences.size());
        for (Experience e : experiences) {
            Experience processed = e.markProcessed(now);
            archive(processed);
            archived.add(processed);
        }
        evictHistory();
        return archived;
    }

    /** Archives an experience that could not be learned from. */
    public Experience dropToHistory(Experience experience, ExperienceStatus dropStatus) {
        Experience dropped = experience.markDropped(dropStatus, clock.instant());
        archive(dropped);
        evictHistory();
        return dropped;
    }

    /** @return number of history entries evicted */
    public int evictHistory() {
        int before = history.size();
        Instant cutoff = clock.instant().minus(retention);
        history.removeIf(e -> e.timestamp().isBefore(cutoff));
        while (history.size() > historyCapacity) {
            history.pollFirst();
        }
        return before - history.size();
    }

    /**
     * Replaces both queues with persisted content. Non-pending entries in {@code pending}
     * and pending entries in {@code archived} are skipped, then capacities are enforced.
     */
    public void restore(Collection<Experience> pending, Collection<Experience> archived) {
        active.clear();
        history.clear();
        if (archived != null) {
            archived.stream().filter(e -> e.status().isTerminal()).forEach(history::addLast);
        }
        if (pending != null) {
            // an id already archived was consumed before the restart
            Set<String> archivedIds = new HashSet<>();
            history.forEach(e -> archivedIds.add(e.id()));
            pending.stream()
                .filter(Experience::isPending)
                .filter(e -> !archivedIds.contains(e.id()))
                .forEach(active::addLast);
        }
        while (active.size() > activeCapacity) {
            archive(active.pollFirst().markDropped(ExperienceStatus.DROPPED_OVERFLOW, clock.instant()));
        }
        evictHistory();
    }

    public List<Experience> activeSnapshot() {
        return List.copyOf(active);
    }

    public List<Experience> historySnapshot() {
        return List.copyOf(history);
    }

    public int activeSize()   { return active.size(); }
    public int historySize()  { return history.size(); }
    public int activeCapacity()  { return activeCapacity; }
    public int historyCapacity() { return historyCapacity; }

    public double activeUtilization() {
        return activeCapacity == 0 ? 0.0 : active.size() * 100.0 / activeCapacity;
    }

    public double historyUtilization() {
        return historyCapacity == 0 ? 0.0 : history.size() * 100.0 / historyCapacity;
    }

    private void archive(Experience terminal) {
        history.addLast(terminal);
    }
}
