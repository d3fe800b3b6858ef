package overworld.domain;

/**
 * Stable identifier of a discrete area, derived from the game's external
 * (group, number) pair. The key form {@code map_<group>_<number>} names the
 * persisted record of the area.
 */
public final class AreaId {

    private static final String KEY_PREFIX = "map_";

    public final int group;
    public final int number;

    private AreaId(int group, int number) {
        this.group = group;
        this.number = number;
    }

    public static AreaId of(int group, int number) {
        return new AreaId(group, number);
    }

    /**
     * Parses an id from its key form.
     *
     * @param key a string such as "map_3_0"
     * @return the AreaId
     * @throws IllegalArgumentException if the key is not in key form
     */
    public static AreaId fromKey(String key) {
        if (key == null || !key.startsWith(KEY_PREFIX)) {
            throw new IllegalArgumentException("Invalid area key: " + key);
        }
        String[] parts = key.substring(KEY_PREFIX.length()).split("_");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Invalid area key: " + key);
        }
        try {
            return new AreaId(Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid area key: " + key, e);
        }
    }

    public String key() {
        return KEY_PREFIX + group + "_" + number;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof AreaId)) return false;
        AreaId other = (AreaId) obj;
        return group == other.group && number == other.number;
    }

    @Override
    public int hashCode() {
        return 31 * group + number;
    }

    @Override
    public String toString() {
        return key();
    }
}
