package overworld.persistence;

import overworld.domain.AreaId;
import overworld.domain.Coordinate;
import overworld.domain.TraversalStatus;
import overworld.map.AreaMap;
import overworld.map.CoordinateGrid;
import overworld.map.GridBounds;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * On-disk form of an {@link AreaMap}.
 *
 * Both grids are exported over the same rectangle (the union of their written
 * extents) starting at (originX, originY). Traversal rows are strings of
 * status symbols; terrain rows are label lists. Timestamps are ISO-8601.
 * The PLAYER marker is saved as a separate tile, with the status it covers
 * written into the rows in its place.
 */
public class AreaMapRecord {

    public String areaId;
    public int group;
    public int number;
    public String displayName;
    public int originX;
    public int originY;
    public List<List<String>> terrainRows = new ArrayList<>();
    public List<String> traversalRows = new ArrayList<>();
    public Bounds bounds;
    public Tile player;
    public int visitCount;
    public String createdAt;
    public String lastUpdated;

    public AreaMapRecord() {} // For Jackson

    /**
     * Inclusive extent of the stored rows.
     */
    public static class Bounds {
        public int minX;
        public int minY;
        public int maxX;
        public int maxY;

        public Bounds() {}

        Bounds(GridBounds bounds) {
            this.minX = bounds.minX;
            this.minY = bounds.minY;
            this.maxX = bounds.maxX;
            this.maxY = bounds.maxY;
        }
    }

    /**
     * Tile the agent stood on when the map was saved.
     */
    public static class Tile {
        public int x;
        public int y;

        public Tile() {}

        Tile(Coordinate c) {
            this.x = c.x;
            this.y = c.y;
        }
    }

    public static AreaMapRecord from(AreaMap map) {
        AreaMapRecord record = new AreaMapRecord();
        AreaId id = map.getAreaId();
        record.areaId = id.key();
        record.group = id.group;
        record.number = id.number;
        record.displayName = map.getDisplayName();
        record.visitCount = map.getVisitCount();
        record.createdAt = map.getCreatedAt().toString();
        record.lastUpdated = map.getLastUpdated().toString();

        GridBounds extent = map.getBounds();
        if (extent == null) {
            return record;
        }
        record.originX = extent.minX;
        record.originY = extent.minY;
        record.bounds = new Bounds(extent);
        record.terrainRows = map.terrainGrid().rowsWithin(extent);

        // The rows hold what the PLAYER marker covers; the position is stored apart
        Coordinate playerPos = map.getPlayerPosition();
        if (playerPos != null) {
            record.player = new Tile(playerPos);
        }
        for (int y = extent.minY; y <= extent.maxY; y++) {
            StringBuilder sb = new StringBuilder(extent.width());
            for (int x = extent.minX; x <= extent.maxX; x++) {
                Coordinate c = Coordinate.of(x, y);
                sb.append(map.getUnderlyingTraversal(c).symbol);
            }
            record.traversalRows.add(sb.toString());
        }
        return record;
    }

    /**
     * Rebuilds the map.
     *
     * @throws IllegalArgumentException if the record is inconsistent
     *         (unknown symbol, bad timestamp, mismatched identity)
     */
    public AreaMap toAreaMap(Clock clock) {
        AreaId id = AreaId.of(group, number);
        if (areaId != null && !areaId.equals(id.key())) {
            throw new IllegalArgumentException("Record key " + areaId + " does not match " + id.key());
        }

        List<List<String>> terrainSource = terrainRows != null ? terrainRows : new ArrayList<>();
        CoordinateGrid<String> terrain =
                CoordinateGrid.fromRows(AreaMap.UNKNOWN_LABEL, originX, originY, terrainSource);

        List<List<TraversalStatus>> statusRows = new ArrayList<>();
        if (traversalRows != null) {
            for (String row : traversalRows) {
                List<TraversalStatus> statuses = new ArrayList<>(row.length());
                for (int i = 0; i < row.length(); i++) {
                    statuses.add(TraversalStatus.fromSymbol(row.charAt(i)));
                }
                statusRows.add(statuses);
            }
        }
        CoordinateGrid<TraversalStatus> traversal =
                CoordinateGrid.fromRows(TraversalStatus.UNKNOWN, originX, originY, statusRows);

        Instant now = clock.instant();
        AreaMap map = new AreaMap(id, displayName, terrain, traversal, visitCount,
                parseInstant(createdAt, now), parseInstant(lastUpdated, now), clock);
        if (player != null) {
            map.placePlayer(Coordinate.of(player.x, player.y));
        }
        return map;
    }

    private static Instant parseInstant(String text, Instant fallback) {
        if (text == null || text.isEmpty()) return fallback;
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Bad timestamp: " + text, e);
        }
    }
}
