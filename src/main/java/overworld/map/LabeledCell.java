package overworld.map;

/**
 * One classified tile of an observation: its row and column inside the
 * observation window and the label the vision classifier assigned.
 */
public final class LabeledCell {

    public final int row;
    public final int col;
    public final String label;

    public LabeledCell(int row, int col, String label) {
        this.row = row;
        this.col = col;
        this.label = label;
    }

    @Override
    public String toString() {
        return "(" + row + "," + col + "," + label + ")";
    }
}
