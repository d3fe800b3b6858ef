package overworld.persistence;

import overworld.domain.AreaId;
import overworld.map.AreaMap;
import overworld.planning.NavConfig;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Saves and loads area maps as {@code maps/map_<group>_<number>.json}.
 *
 * Failures never propagate: a failed save is logged and reported as false,
 * an unreadable file is logged and treated as a never-visited area.
 */
public class AreaMapStore {

    public static final String MAPS_DIRECTORY = "maps";

    private final JsonStore store;
    private final Clock clock;

    public AreaMapStore(JsonStore store) {
        this(store, Clock.systemUTC());
    }

    public AreaMapStore(JsonStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    public static String fileNameFor(AreaId areaId) {
        return MAPS_DIRECTORY + "/" + areaId.key() + ".json";
    }

    /**
     * @return true if the map was written
     */
    public boolean save(AreaMap map) {
        try {
            store.saveJson(fileNameFor(map.getAreaId()), AreaMapRecord.from(map), JsonStore.SCHEMA_VERSION);
            return true;
        } catch (IOException e) {
            logMinimal("[AreaMapStore] Failed to save " + map.getAreaId() + ": " + e.getMessage());
            return false;
        }
    }

    /**
     * Loads a stored map.
     *
     * @return the map, or empty if it was never saved or cannot be read
     */
    public Optional<AreaMap> load(AreaId areaId) {
        String fileName = fileNameFor(areaId);
        try {
            AreaMapRecord record = store.loadJson(fileName, AreaMapRecord.class);
            if (record == null) {
                return Optional.empty();
            }
            AreaMap map = record.toAreaMap(clock);
            if (!map.getAreaId().equals(areaId)) {
                logNormal("[AreaMapStore] " + fileName + " holds " + map.getAreaId() + ", ignoring");
                return Optional.empty();
            }
            return Optional.of(map);
        } catch (IOException | IllegalArgumentException e) {
            logNormal("[AreaMapStore] Corrupt map " + fileName + ", starting fresh: " + e.getMessage());
            return Optional.empty();
        }
    }

    public boolean exists(AreaId areaId) {
        return store.exists(fileNameFor(areaId));
    }

    /**
     * Areas that have a stored map. Files whose names are not area keys are skipped.
     */
    public List<AreaId> storedAreas() {
        List<AreaId> areas = new ArrayList<>();
        try {
            for (String name : store.list(MAPS_DIRECTORY)) {
                String key = name.substring(0, name.length() - ".json".length());
                try {
                    areas.add(AreaId.fromKey(key));
                } catch (IllegalArgumentException e) {
                    logVerbose("[AreaMapStore] Skipping " + name);
                }
            }
        } catch (IOException e) {
            logNormal("[AreaMapStore] Cannot list stored maps: " + e.getMessage());
        }
        return areas;
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
