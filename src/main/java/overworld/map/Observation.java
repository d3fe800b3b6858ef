package overworld.map;

import java.util.List;

/**
 * A fixed-size rectangle of classifier labels with the agent at a known cell
 * inside it. Built and validated from the vision classifier's
 * (row, col, label) triples; an Observation that exists is always complete.
 */
public final class Observation {

    public final int rows;
    public final int cols;

    /** Cell holding the agent */
    public final int agentRow;
    public final int agentCol;

    private final String[][] labels;

    private Observation(int rows, int cols, int agentRow, int agentCol, String[][] labels) {
        this.rows = rows;
        this.cols = cols;
        this.agentRow = agentRow;
        this.agentCol = agentCol;
        this.labels = labels;
    }

    /**
     * Assembles an observation from classifier triples.
     *
     * @param cells    one triple per cell, any order
     * @param rows     expected window height
     * @param cols     expected window width
     * @param agentRow agent cell row
     * @param agentCol agent cell column
     * @return the observation
     * @throws MalformedObservationException if a cell is missing, duplicated,
     *         outside the window, unlabeled, or the agent offset lies outside
     */
    public static Observation fromCells(List<LabeledCell> cells, int rows, int cols,
                                        int agentRow, int agentCol) throws MalformedObservationException {
        if (rows <= 0 || cols <= 0) {
            throw new MalformedObservationException("Invalid window size " + rows + "x" + cols);
        }
        checkAgentOffset(rows, cols, agentRow, agentCol);
        if (cells == null) {
            throw new MalformedObservationException("No cells in observation");
        }
        if (cells.size() != rows * cols) {
            throw new MalformedObservationException("Expected " + (rows * cols) + " cells for a "
                    + rows + "x" + cols + " window, got " + cells.size());
        }

        String[][] labels = new String[rows][cols];
        for (LabeledCell cell : cells) {
            if (cell == null) {
                throw new MalformedObservationException("Null cell in observation");
            }
            if (cell.row < 0 || cell.row >= rows || cell.col < 0 || cell.col >= cols) {
                throw new MalformedObservationException("Cell " + cell + " outside " + rows + "x" + cols + " window");
            }
            if (cell.label == null || cell.label.isBlank()) {
                throw new MalformedObservationException("Cell " + cell + " has no label");
            }
            if (labels[cell.row][cell.col] != null) {
                throw new MalformedObservationException("Duplicate cell " + cell);
            }
            labels[cell.row][cell.col] = cell.label;
        }
        // Counts match and no duplicates, so every cell is filled
        return new Observation(rows, cols, agentRow, agentCol, labels);
    }

    /**
     * Assembles an observation from label rows (top to bottom).
     *
     * @throws MalformedObservationException if the rows are ragged, empty or
     *         contain missing labels
     */
    public static Observation fromRows(List<List<String>> rowLabels, int agentRow, int agentCol)
            throws MalformedObservationException {
        if (rowLabels == null || rowLabels.isEmpty() || rowLabels.get(0).isEmpty()) {
            throw new MalformedObservationException("Empty observation");
        }
        int rows = rowLabels.size();
        int cols = rowLabels.get(0).size();
        checkAgentOffset(rows, cols, agentRow, agentCol);

        String[][] labels = new String[rows][cols];
        for (int r = 0; r < rows; r++) {
            List<String> row = rowLabels.get(r);
            if (row.size() != cols) {
                throw new MalformedObservationException("Row " + r + " has " + row.size()
                        + " cells, expected " + cols);
            }
            for (int c = 0; c < cols; c++) {
                String label = row.get(c);
                if (label == null || label.isBlank()) {
                    throw new MalformedObservationException("Cell (" + r + "," + c + ") has no label");
                }
                labels[r][c] = label;
            }
        }
        return new Observation(rows, cols, agentRow, agentCol, labels);
    }

    private static void checkAgentOffset(int rows, int cols, int agentRow, int agentCol)
            throws MalformedObservationException {
        if (agentRow < 0 || agentRow >= rows || agentCol < 0 || agentCol >= cols) {
            throw new MalformedObservationException("Agent offset (" + agentRow + "," + agentCol
                    + ") outside " + rows + "x" + cols + " window");
        }
    }

    public String labelAt(int row, int col) {
        return labels[row][col];
    }
}
