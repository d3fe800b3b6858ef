package overworld.graph;

import overworld.domain.AreaId;
import overworld.domain.Coordinate;
import overworld.domain.Direction;

import java.util.*;

/**
 * Graph of areas linked by transition edges.
 *
 * Connections are always stored in reciprocal pairs. Queries run BFS over
 * areas, treating every connection as unit length.
 */
public class ConnectivityGraph {

    /** Adjacency list, insertion ordered so queries are deterministic */
    private final Map<AreaId, List<AreaConnection>> connections = new LinkedHashMap<>();

    /**
     * Records that leaving {@code fromArea} at {@code exit} travelling
     * {@code direction} arrives in {@code toArea} at {@code entry}, together
     * with the reverse link. An existing connection with the same
     * (fromArea, fromCoord, toArea) is replaced.
     *
     * @return true if the forward connection did not exist before
     */
    public boolean addConnection(AreaId fromArea, Coordinate exit, AreaId toArea, Coordinate entry,
                                 Direction direction) {
        AreaConnection forward = new AreaConnection(fromArea, exit, toArea, entry, direction);
        AreaConnection previous = find(forward);
        if (previous != null && !previous.toCoord.equals(entry)) {
            // The old reverse is keyed by the old arrival tile
            remove(previous.reverse());
        }
        boolean created = upsert(forward);
        upsert(forward.reverse());
        return created;
    }

    /**
     * Inserts a single directed connection as loaded from storage, without
     * adding its reverse.
     */
    public void restore(AreaConnection connection) {
        upsert(connection);
    }

    private AreaConnection find(AreaConnection key) {
        List<AreaConnection> list = connections.get(key.fromArea);
        if (list == null) return null;
        for (AreaConnection existing : list) {
            if (existing.sameKey(key)) return existing;
        }
        return null;
    }

    private void remove(AreaConnection key) {
        List<AreaConnection> list = connections.get(key.fromArea);
        if (list != null) {
            list.removeIf(existing -> existing.sameKey(key));
        }
    }

    private boolean upsert(AreaConnection connection) {
        List<AreaConnection> list = connections.computeIfAbsent(connection.fromArea, k -> new ArrayList<>());
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i).sameKey(connection)) {
                list.set(i, connection);
                return false;
            }
        }
        list.add(connection);
        connections.computeIfAbsent(connection.toArea, k -> new ArrayList<>());
        return true;
    }

    /**
     * Get all connections leaving an area.
     */
    public List<AreaConnection> connectionsFrom(AreaId area) {
        List<AreaConnection> list = connections.get(area);
        return list != null ? Collections.unmodifiableList(list) : Collections.emptyList();
    }

    /**
     * All connections, grouped by origin area.
     */
    public Map<AreaId, List<AreaConnection>> asMap() {
        Map<AreaId, List<AreaConnection>> copy = new LinkedHashMap<>();
        for (Map.Entry<AreaId, List<AreaConnection>> entry : connections.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        return copy;
    }

    /**
     * Areas that appear in any connection.
     */
    public Set<AreaId> areas() {
        return Collections.unmodifiableSet(connections.keySet());
    }

    /**
     * Number of directed connections (twice the number of reciprocal pairs).
     */
    public int connectionCount() {
        int count = 0;
        for (List<AreaConnection> list : connections.values()) {
            count += list.size();
        }
        return count;
    }

    /**
     * Finds the shortest sequence of areas from {@code from} to {@code to}
     * using BFS.
     *
     * @return the areas visited in order, both ends included; empty if
     *         {@code to} cannot be reached
     */
    public Optional<List<AreaId>> shortestAreaPath(AreaId from, AreaId to) {
        if (from.equals(to)) {
            return Optional.of(List.of(from));
        }

        Map<AreaId, AreaId> cameFrom = new HashMap<>();
        Queue<AreaId> queue = new ArrayDeque<>();
        queue.add(from);
        cameFrom.put(from, null);

        while (!queue.isEmpty()) {
            AreaId current = queue.poll();

            for (AreaConnection conn : connectionsFrom(current)) {
                AreaId next = conn.toArea;
                if (cameFrom.containsKey(next)) {
                    continue;
                }
                cameFrom.put(next, current);
                if (next.equals(to)) {
                    return Optional.of(reconstructPath(cameFrom, to));
                }
                queue.add(next);
            }
        }

        return Optional.empty();
    }

    /**
     * Connections out of {@code from} that start a shortest route to {@code to}.
     * Empty if {@code to} is unreachable or is {@code from} itself.
     */
    public List<AreaConnection> exitsTowards(AreaId from, AreaId to) {
        Optional<List<AreaId>> path = shortestAreaPath(from, to);
        if (path.isEmpty() || path.get().size() < 2) {
            return Collections.emptyList();
        }
        AreaId nextHop = path.get().get(1);
        List<AreaConnection> exits = new ArrayList<>();
        for (AreaConnection conn : connectionsFrom(from)) {
            if (conn.toArea.equals(nextHop)) {
                exits.add(conn);
            }
        }
        return exits;
    }

    private List<AreaId> reconstructPath(Map<AreaId, AreaId> cameFrom, AreaId goal) {
        List<AreaId> path = new ArrayList<>();
        AreaId current = goal;
        while (current != null) {
            path.add(current);
            current = cameFrom.get(current);
        }
        Collections.reverse(path);
        return path;
    }
}
