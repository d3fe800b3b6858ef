package overworld.client;

import overworld.map.LabeledCell;

import java.util.List;

/**
 * Source of classified screen tiles: one label per cell of the fixed
 * observation window around the agent.
 */
public interface VisionClassifier {

    /**
     * Classifies the current screen.
     *
     * @return one cell per (row, col) of the window, in any order
     */
    List<LabeledCell> classify();
}
