package overworld.persistence;

import overworld.domain.AreaId;
import overworld.map.AreaMap;
import overworld.planning.NavConfig;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Session cache of area maps in front of an {@link AreaMapStore}.
 *
 * A map is created lazily on first request: loaded from disk if it was saved
 * in an earlier session, otherwise created empty. Maps stay cached for the
 * rest of the session.
 */
public class AreaMapRepository {

    private final AreaMapStore store;
    private final Clock clock;
    private final Map<AreaId, AreaMap> maps = new LinkedHashMap<>();

    private int createdCount = 0;
    private int loadedCount = 0;

    public AreaMapRepository(AreaMapStore store) {
        this(store, Clock.systemUTC());
    }

    public AreaMapRepository(AreaMapStore store, Clock clock) {
        this.store = store;
        this.clock = clock;
    }

    /**
     * Returns the cached map, loading or creating it on first use.
     *
     * @param displayName human name for a newly created map; also refreshes
     *                    the name of an existing one when given
     */
    public AreaMap getOrCreate(AreaId areaId, String displayName) {
        AreaMap map = maps.get(areaId);
        if (map == null) {
            map = store.load(areaId).orElse(null);
            if (map != null) {
                loadedCount++;
                logVerbose("[AreaMaps] Loaded " + map.summary());
            } else {
                map = new AreaMap(areaId, displayName, clock);
                createdCount++;
                logNormal("[AreaMaps] New area " + areaId + " (" + map.getDisplayName() + ")");
            }
            maps.put(areaId, map);
        }
        map.setDisplayName(displayName);
        return map;
    }

    /**
     * @return the cached map, or null if it has not been requested this session
     */
    public AreaMap get(AreaId areaId) {
        return maps.get(areaId);
    }

    public boolean contains(AreaId areaId) {
        return maps.containsKey(areaId);
    }

    public Collection<AreaMap> all() {
        return Collections.unmodifiableCollection(maps.values());
    }

    public int size() {
        return maps.size();
    }

    /**
     * Maps created empty this session (not loaded from disk).
     */
    public int getCreatedCount() {
        return createdCount;
    }

    public int getLoadedCount() {
        return loadedCount;
    }

    public boolean save(AreaMap map) {
        return store.save(map);
    }

    /**
     * Saves every cached map.
     *
     * @return number of maps written successfully
     */
    public int saveAll() {
        int saved = 0;
        for (AreaMap map : maps.values()) {
            if (store.save(map)) saved++;
        }
        return saved;
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
