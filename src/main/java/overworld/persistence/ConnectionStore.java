package overworld.persistence;

import overworld.domain.AreaId;
import overworld.graph.AreaConnection;
import overworld.graph.ConnectivityGraph;
import overworld.planning.NavConfig;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Saves and loads the connectivity graph as {@code map_connections.json}:
 * an object keyed by origin area, each value the list of connections
 * leaving that area.
 */
public class ConnectionStore {

    public static final String FILE_NAME = "map_connections.json";

    private final JsonStore store;

    public ConnectionStore(JsonStore store) {
        this.store = store;
    }

    /**
     * Area key to outgoing connections, the stored layout.
     */
    public static class ConnectionTable extends LinkedHashMap<String, List<ConnectionRecord>> {
        private static final long serialVersionUID = 1L;
    }

    /**
     * @return true if the graph was written
     */
    public boolean save(ConnectivityGraph graph) {
        ConnectionTable table = new ConnectionTable();
        for (Map.Entry<AreaId, List<AreaConnection>> entry : graph.asMap().entrySet()) {
            List<ConnectionRecord> records = new ArrayList<>();
            for (AreaConnection connection : entry.getValue()) {
                records.add(ConnectionRecord.from(connection));
            }
            table.put(entry.getKey().key(), records);
        }

        try {
            store.saveJson(FILE_NAME, table, JsonStore.SCHEMA_VERSION);
            return true;
        } catch (IOException e) {
            logMinimal("[ConnectionStore] Failed to save connections: " + e.getMessage());
            return false;
        }
    }

    /**
     * Loads stored connections into {@code graph}. Unreadable entries are
     * skipped; an unreadable file loads nothing.
     *
     * @return number of directed connections restored
     */
    public int loadInto(ConnectivityGraph graph) {
        ConnectionTable table;
        try {
            table = store.loadJson(FILE_NAME, ConnectionTable.class);
        } catch (IOException e) {
            logNormal("[ConnectionStore] Corrupt " + FILE_NAME + ", starting with no connections: "
                    + e.getMessage());
            return 0;
        }
        if (table == null) {
            return 0;
        }

        int restored = 0;
        for (Map.Entry<String, List<ConnectionRecord>> entry : table.entrySet()) {
            AreaId fromArea;
            try {
                fromArea = AreaId.fromKey(entry.getKey());
            } catch (IllegalArgumentException e) {
                logNormal("[ConnectionStore] Skipping bad area key " + entry.getKey());
                continue;
            }
            if (entry.getValue() == null) continue;
            for (ConnectionRecord record : entry.getValue()) {
                if (record == null) continue;
                try {
                    graph.restore(record.toConnection(fromArea));
                    restored++;
                } catch (IllegalArgumentException e) {
                    logNormal("[ConnectionStore] Skipping bad connection from " + fromArea + ": " + e.getMessage());
                }
            }
        }
        logVerbose("[ConnectionStore] Restored " + restored + " connections");
        return restored;
    }

    private void logMinimal(String msg) {
        if (NavConfig.isMinimal())
            System.err.println(msg);
    }

    private void logNormal(String msg) {
        if (NavConfig.isNormal())
            System.err.println(msg);
    }

    private void logVerbose(String msg) {
        if (NavConfig.isVerbose())
            System.err.println(msg);
    }
}
