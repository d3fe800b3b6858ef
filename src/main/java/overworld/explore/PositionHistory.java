package overworld.explore;

import overworld.domain.AreaId;
import overworld.domain.Coordinate;
import overworld.planning.NavConfig;

import java.util.*;

/**
 * Recent positions of the agent, used only for stuck detection, plus the set
 * of tiles ever visited in each area.
 *
 * After each sample the most recent {@link NavConfig#STUCK_WINDOW} samples are
 * inspected: if they hold at most {@link NavConfig#STUCK_DISTINCT_THRESHOLD}
 * distinct positions the stuck counter rises, otherwise it decays toward 0.
 * The agent counts as stuck once the counter reaches
 * {@link NavConfig#STUCK_COUNTER_THRESHOLD}. The counter is capped at the
 * window size so a long standstill is recovered from within one window of
 * varied movement.
 */
public class PositionHistory {

    private final int capacity;
    private final Deque<Sample> samples = new ArrayDeque<>();
    private final Map<AreaId, Set<Coordinate>> visited = new HashMap<>();
    private int stuckCounter = 0;

    public PositionHistory() {
        this(NavConfig.DEFAULT_HISTORY_CAPACITY);
    }

    public PositionHistory(int capacity) {
        if (capacity < NavConfig.STUCK_WINDOW) {
            throw new IllegalArgumentException("History capacity " + capacity
                    + " is smaller than the stuck window " + NavConfig.STUCK_WINDOW);
        }
        this.capacity = capacity;
    }

    /**
     * Records the agent's position for this cycle.
     */
    public void record(AreaId area, Coordinate position) {
        samples.addLast(new Sample(area, position));
        while (samples.size() > capacity) {
            samples.removeFirst();
        }
        visited.computeIfAbsent(area, k -> new HashSet<>()).add(position);

        // Too few samples say nothing about looping
        if (samples.size() <= NavConfig.STUCK_DISTINCT_THRESHOLD) {
            return;
        }
        if (distinctRecent() <= NavConfig.STUCK_DISTINCT_THRESHOLD) {
            stuckCounter = Math.min(stuckCounter + 1, NavConfig.STUCK_WINDOW);
        } else {
            stuckCounter = Math.max(0, stuckCounter - 1);
        }
    }

    public boolean isStuck() {
        return stuckCounter >= NavConfig.STUCK_COUNTER_THRESHOLD;
    }

    public int getStuckCounter() {
        return stuckCounter;
    }

    /**
     * Number of distinct positions among the most recent window of samples.
     */
    public int distinctRecent() {
        Set<Sample> distinct = new HashSet<>();
        Iterator<Sample> it = samples.descendingIterator();
        for (int i = 0; i < NavConfig.STUCK_WINDOW && it.hasNext(); i++) {
            distinct.add(it.next());
        }
        return distinct.size();
    }

    public boolean hasVisited(AreaId area, Coordinate position) {
        Set<Coordinate> tiles = visited.get(area);
        return tiles != null && tiles.contains(position);
    }

    /**
     * Number of distinct tiles ever recorded in an area.
     */
    public int visitedCount(AreaId area) {
        Set<Coordinate> tiles = visited.get(area);
        return tiles != null ? tiles.size() : 0;
    }

    public int size() {
        return samples.size();
    }

    /**
     * Forgets recent samples and the stuck counter; visited tiles are kept.
     */
    public void resetRecent() {
        samples.clear();
        stuckCounter = 0;
    }

    /** Inner class for (area, position) key. */
    private static class Sample {
        final AreaId area;
        final Coordinate position;

        Sample(AreaId area, Coordinate position) {
            this.area = area;
            this.position = position;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Sample)) return false;
            Sample other = (Sample) obj;
            return area.equals(other.area) && position.equals(other.position);
        }

        @Override
        public int hashCode() {
            return Objects.hash(area, position);
        }
    }
}
