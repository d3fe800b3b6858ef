package overworld.map;

import overworld.domain.AreaId;
import overworld.domain.Coordinate;
import overworld.domain.Direction;
import overworld.domain.TraversalStatus;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Everything known about one area: a terrain grid of classifier labels and a
 * traversal grid of {@link TraversalStatus} markers over the same area-local
 * coordinates, plus visit bookkeeping.
 *
 * Invariants maintained here rather than by callers:
 * - TRANSITION_EDGE, once set, is never replaced.
 * - At most one tile holds PLAYER. Placing the player remembers the status
 *   it covers and restores it when the marker moves on, so the transient
 *   marker never erases what was learned about a tile.
 */
public class AreaMap {

    /** Terrain value for tiles never observed */
    public static final String UNKNOWN_LABEL = "?";

    private final AreaId areaId;
    private String displayName;

    private final CoordinateGrid<String> terrain;
    private final CoordinateGrid<TraversalStatus> traversal;

    private int visitCount;
    private final Instant createdAt;
    private Instant lastUpdated;
    private final Clock clock;

    /** Tile the agent occupies in this area, null if unknown */
    private Coordinate playerPosition;

    /** Status covered by the PLAYER marker, restored when the marker moves */
    private TraversalStatus underPlayer = TraversalStatus.WALKABLE;

    /**
     * Creates an empty map for a never-visited area.
     */
    public AreaMap(AreaId areaId, String displayName) {
        this(areaId, displayName, Clock.systemUTC());
    }

    public AreaMap(AreaId areaId, String displayName, Clock clock) {
        this(areaId, displayName,
                new CoordinateGrid<>(UNKNOWN_LABEL),
                new CoordinateGrid<>(TraversalStatus.UNKNOWN),
                0, clock.instant(), clock.instant(), clock);
    }

    /**
     * Rebuilds a map from persisted parts. Any PLAYER markers left in the
     * traversal grid are reconciled: a single one becomes the tracked player
     * position, several are all reverted to WALKABLE.
     */
    public AreaMap(AreaId areaId, String displayName,
                   CoordinateGrid<String> terrain, CoordinateGrid<TraversalStatus> traversal,
                   int visitCount, Instant createdAt, Instant lastUpdated, Clock clock) {
        this.areaId = areaId;
        this.displayName = displayName != null ? displayName : areaId.key();
        this.terrain = terrain;
        this.traversal = traversal;
        this.visitCount = visitCount;
        this.createdAt = createdAt;
        this.lastUpdated = lastUpdated;
        this.clock = clock;

        List<Coordinate> markers = traversal.find(status -> status == TraversalStatus.PLAYER);
        if (markers.size() == 1) {
            playerPosition = markers.get(0);
        } else {
            for (Coordinate stale : markers) {
                traversal.set(stale, TraversalStatus.WALKABLE);
            }
        }
    }

    // ========== Accessors ==========

    public AreaId getAreaId() { return areaId; }

    public String getDisplayName() { return displayName; }

    public void setDisplayName(String displayName) {
        if (displayName != null && !displayName.isBlank()) {
            this.displayName = displayName;
        }
    }

    public int getVisitCount() { return visitCount; }

    public Instant getCreatedAt() { return createdAt; }

    public Instant getLastUpdated() { return lastUpdated; }

    public Coordinate getPlayerPosition() { return playerPosition; }

    /**
     * Read-only use only; writes must go through this class to keep the
     * marker invariants.
     */
    public CoordinateGrid<String> terrainGrid() { return terrain; }

    /**
     * Read-only use only; writes must go through this class to keep the
     * marker invariants.
     */
    public CoordinateGrid<TraversalStatus> traversalGrid() { return traversal; }

    public String getTerrain(Coordinate c) {
        return terrain.get(c);
    }

    public TraversalStatus getTraversal(Coordinate c) {
        return traversal.get(c);
    }

    public TraversalStatus getTraversal(int x, int y) {
        return traversal.get(x, y);
    }

    /**
     * Extent of everything observed or marked in this area, null if nothing yet.
     */
    public GridBounds getBounds() {
        GridBounds bounds = terrain.bounds();
        return bounds == null ? traversal.bounds() : bounds.including(traversal.bounds());
    }

    // ========== Mutation ==========

    public void setTerrain(Coordinate c, String label) {
        terrain.set(c, label != null ? label : UNKNOWN_LABEL);
    }

    /**
     * Writes a traversal marker.
     *
     * @return false if the write was refused because the tile holds a
     *         TRANSITION_EDGE (or the value was already there)
     */
    public boolean setTraversal(Coordinate c, TraversalStatus status) {
        if (status == TraversalStatus.PLAYER) {
            placePlayer(c);
            return true;
        }
        TraversalStatus current = traversal.get(c);
        if (current == TraversalStatus.TRANSITION_EDGE && status != TraversalStatus.TRANSITION_EDGE) {
            return false;
        }
        if (c.equals(playerPosition)) {
            // The tile keeps PLAYER on top; the new status becomes what it covers
            if (current == TraversalStatus.PLAYER) {
                underPlayer = status;
                if (status == TraversalStatus.TRANSITION_EDGE) {
                    traversal.set(c, status);
                }
                return true;
            }
        }
        if (current == status) return false;
        traversal.set(c, status);
        return true;
    }

    /**
     * Moves the PLAYER marker to {@code c}. A TRANSITION_EDGE tile is not
     * overwritten; the position is still tracked.
     */
    public void placePlayer(Coordinate c) {
        clearPlayer();
        playerPosition = c;
        TraversalStatus current = traversal.get(c);
        if (current == TraversalStatus.TRANSITION_EDGE) {
            underPlayer = TraversalStatus.TRANSITION_EDGE;
            return;
        }
        underPlayer = current.isStructural() ? current : TraversalStatus.WALKABLE;
        traversal.set(c, TraversalStatus.PLAYER);
    }

    /**
     * Removes the PLAYER marker, restoring the status it covered.
     */
    public void clearPlayer() {
        if (playerPosition == null) return;
        if (traversal.get(playerPosition) == TraversalStatus.PLAYER) {
            traversal.set(playerPosition, underPlayer);
        }
        playerPosition = null;
        underPlayer = TraversalStatus.WALKABLE;
    }

    /**
     * Status a tile has underneath a possible PLAYER marker.
     */
    public TraversalStatus getUnderlyingTraversal(Coordinate c) {
        if (c.equals(playerPosition) && traversal.get(c) == TraversalStatus.PLAYER) {
            return underPlayer;
        }
        return traversal.get(c);
    }

    /**
     * Counts an arrival into this area.
     */
    public void recordVisit() {
        visitCount++;
        touch();
    }

    /**
     * Updates the last-updated timestamp.
     */
    public void touch() {
        lastUpdated = clock.instant();
    }

    // ========== Queries ==========

    /**
     * Tile the agent faces when standing at {@code c} facing {@code facing}.
     */
    public static Coordinate targetOf(Coordinate c, Direction facing) {
        return c.move(facing);
    }

    /**
     * Number of tiles whose traversal status is known.
     */
    public int exploredCount() {
        return traversal.count(status -> status != TraversalStatus.UNKNOWN);
    }

    /**
     * Cuts a window of both grids centred on {@code center}.
     */
    public MapWindow window(Coordinate center, int halfWidth, int halfHeight) {
        return MapWindow.cut(this, center, halfWidth, halfHeight);
    }

    /**
     * One-line description: name, bounds, explored tiles and visits.
     */
    public String summary() {
        GridBounds bounds = getBounds();
        return displayName + " | "
                + "Bounds: " + (bounds != null ? bounds.toString() : "(empty)") + " | "
                + "Explored: " + exploredCount() + " tiles | "
                + "Visits: " + visitCount;
    }

    /**
     * Renders the traversal grid with one symbol per tile, row by row.
     */
    public String toGridString() {
        StringBuilder sb = new StringBuilder();
        GridBounds bounds = traversal.bounds();
        if (bounds == null) return sb.toString();
        for (int y = bounds.minY; y <= bounds.maxY; y++) {
            for (int x = bounds.minX; x <= bounds.maxX; x++) {
                sb.append(traversal.get(x, y).symbol);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "AreaMap[" + areaId + " " + summary() + "]";
    }
}
