package overworld.persistence;

import overworld.domain.AreaId;
import overworld.domain.Coordinate;
import overworld.domain.Direction;
import overworld.graph.AreaConnection;

/**
 * On-disk form of one directed {@link AreaConnection}. The origin area is the
 * key the record is stored under.
 */
public class ConnectionRecord {

    public String toArea;
    public int fromX;
    public int fromY;
    public int toX;
    public int toY;
    public String direction;

    public ConnectionRecord() {} // For Jackson

    public static ConnectionRecord from(AreaConnection connection) {
        ConnectionRecord record = new ConnectionRecord();
        record.toArea = connection.toArea.key();
        record.fromX = connection.fromCoord.x;
        record.fromY = connection.fromCoord.y;
        record.toX = connection.toCoord.x;
        record.toY = connection.toCoord.y;
        record.direction = connection.direction.displayName();
        return record;
    }

    /**
     * @throws IllegalArgumentException if the area key or direction is invalid
     */
    public AreaConnection toConnection(AreaId fromArea) {
        return new AreaConnection(fromArea, Coordinate.of(fromX, fromY),
                AreaId.fromKey(toArea), Coordinate.of(toX, toY), Direction.fromString(direction));
    }
}
