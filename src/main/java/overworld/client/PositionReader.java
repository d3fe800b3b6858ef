package overworld.client;

import overworld.domain.AgentSnapshot;

/**
 * Reads the controlled character's area, tile and facing. Pollable and free
 * of side effects; may return null or an incomplete snapshot when the read
 * fails.
 */
public interface PositionReader {

    AgentSnapshot read();
}
