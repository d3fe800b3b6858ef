package overworld.planning;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Configuration for mapping, planning and the decision loop.
 * Centralizes all configurable parameters to avoid hardcoding.
 */
public class NavConfig {

    /** Observation window height in tiles (screen is 15x9 after cropping) */
    public static final int DEFAULT_WINDOW_ROWS = 9;

    /** Observation window width in tiles */
    public static final int DEFAULT_WINDOW_COLS = 15;

    /** Row of the agent inside the observation window */
    public static final int DEFAULT_AGENT_ROW = 4;

    /** Column of the agent inside the observation window */
    public static final int DEFAULT_AGENT_COL = 7;

    /** Labels the vision classifier only emits for tiles nobody can walk on */
    public static final Set<String> DEFAULT_SOLID_LABELS = Set.of("tree", "black");

    /** Extra cost of stepping into an unknown tile (prefers confirmed routes) */
    public static final double DEFAULT_UNKNOWN_TILE_COST = 0.1;

    /** Default maximum nodes to expand in a single A* search */
    public static final int DEFAULT_MAX_SEARCH_NODES = 50_000;

    /** Positions kept in the history ring buffer */
    public static final int DEFAULT_HISTORY_CAPACITY = 20;

    /** Most recent positions inspected by stuck detection */
    public static final int STUCK_WINDOW = 10;

    /** Distinct positions in the window at or below which the agent counts as looping */
    public static final int STUCK_DISTINCT_THRESHOLD = 3;

    /** Stuck counter value at which the agent is considered stuck */
    public static final int STUCK_COUNTER_THRESHOLD = 3;

    /** Farthest radius the advisor scans along each direction */
    public static final int ADVISOR_SCAN_RADIUS = 4;

    /** Minimum time to wait after an action before trusting position feedback */
    public static final long DEFAULT_SETTLE_MIN_MS = 120;

    /** Maximum time to wait for position and facing to stabilize */
    public static final long DEFAULT_SETTLE_TIMEOUT_MS = 2_000;

    /** Interval between polls while waiting */
    public static final long DEFAULT_POLL_INTERVAL_MS = 30;

    /** Consecutive identical polls required to call the agent settled */
    public static final int DEFAULT_STABLE_POLLS = 3;

    /** Window after an interaction in which dialogue activation is attributed to it */
    public static final long DEFAULT_DIALOGUE_WINDOW_MS = 600;

    /** Periodic save interval, in decision cycles */
    public static final int DEFAULT_SAVE_INTERVAL_CYCLES = 25;

    /** Half-width of the window handed to the decision source */
    public static final int VIEW_HALF_WIDTH = 7;

    /** Half-height of the window handed to the decision source */
    public static final int VIEW_HALF_HEIGHT = 4;

    // ========== Logging Configuration ==========

    /**
     * Log level for controlling output verbosity.
     * 0 = SILENT (no output except critical errors)
     * 1 = MINIMAL (area changes, persistence failures)
     * 2 = NORMAL (+ outcomes, rejected observations, plans)
     * 3 = VERBOSE (+ per-tile detail, search statistics)
     *
     * Overridden by the OVERWORLD_LOG_LEVEL environment variable.
     */
    public static final int LOG_LEVEL = readLogLevel();

    /** Helper method to check if verbose logging is enabled */
    public static boolean isVerbose() { return LOG_LEVEL >= 3; }

    /** Helper method to check if normal logging is enabled */
    public static boolean isNormal() { return LOG_LEVEL >= 2; }

    /** Helper method to check if minimal logging is enabled */
    public static boolean isMinimal() { return LOG_LEVEL >= 1; }

    private static int readLogLevel() {
        String value = System.getenv("OVERWORLD_LOG_LEVEL");
        if (value == null) return 2;
        try {
            return Math.max(0, Math.min(3, Integer.parseInt(value.trim())));
        } catch (NumberFormatException e) {
            System.err.println("[NavConfig] Ignoring invalid OVERWORLD_LOG_LEVEL: " + value);
            return 2;
        }
    }

    // Instance configuration
    private int windowRows = DEFAULT_WINDOW_ROWS;
    private int windowCols = DEFAULT_WINDOW_COLS;
    private int agentRow = DEFAULT_AGENT_ROW;
    private int agentCol = DEFAULT_AGENT_COL;
    private Set<String> solidLabels = DEFAULT_SOLID_LABELS;
    private boolean keepNegativeCoordinates = true;
    private double unknownTileCost = DEFAULT_UNKNOWN_TILE_COST;
    private int maxSearchNodes = DEFAULT_MAX_SEARCH_NODES;
    private int historyCapacity = DEFAULT_HISTORY_CAPACITY;
    private long settleMinMs = DEFAULT_SETTLE_MIN_MS;
    private long settleTimeoutMs = DEFAULT_SETTLE_TIMEOUT_MS;
    private long pollIntervalMs = DEFAULT_POLL_INTERVAL_MS;
    private int stablePolls = DEFAULT_STABLE_POLLS;
    private long dialogueWindowMs = DEFAULT_DIALOGUE_WINDOW_MS;
    private int saveIntervalCycles = DEFAULT_SAVE_INTERVAL_CYCLES;
    private Path dataDirectory = Paths.get("overworld-data");

    public NavConfig() {}

    /**
     * Creates a NavConfig with default values.
     * Factory method for cleaner API.
     */
    public static NavConfig defaults() {
        return new NavConfig();
    }

    /**
     * Creates a NavConfig with defaults, then applies environment overrides:
     * OVERWORLD_DATA_DIR, OVERWORLD_SOLID_LABELS (comma separated),
     * OVERWORLD_DROP_NEGATIVE=true for the legacy merge behaviour.
     */
    public static NavConfig fromEnvironment() {
        NavConfig config = new NavConfig();

        String dataDir = System.getenv("OVERWORLD_DATA_DIR");
        if (dataDir != null && !dataDir.isBlank()) {
            config.setDataDirectory(Paths.get(dataDir.trim()));
            System.err.println("[NavConfig] Data directory set via environment variable: " + dataDir);
        }

        String solid = System.getenv("OVERWORLD_SOLID_LABELS");
        if (solid != null && !solid.isBlank()) {
            Set<String> labels = new LinkedHashSet<>();
            for (String label : solid.split(",")) {
                if (!label.isBlank()) labels.add(label.trim());
            }
            config.setSolidLabels(labels);
            System.err.println("[NavConfig] Solid labels set via environment variable: " + labels);
        }

        if ("true".equalsIgnoreCase(System.getenv("OVERWORLD_DROP_NEGATIVE"))) {
            config.setKeepNegativeCoordinates(false);
            System.err.println("[NavConfig] Negative observation coordinates will be dropped");
        }

        return config;
    }

    public int getWindowRows() { return windowRows; }
    public void setWindowRows(int windowRows) { this.windowRows = windowRows; }

    public int getWindowCols() { return windowCols; }
    public void setWindowCols(int windowCols) { this.windowCols = windowCols; }

    public int getAgentRow() { return agentRow; }
    public void setAgentRow(int agentRow) { this.agentRow = agentRow; }

    public int getAgentCol() { return agentCol; }
    public void setAgentCol(int agentCol) { this.agentCol = agentCol; }

    public Set<String> getSolidLabels() { return solidLabels; }
    public void setSolidLabels(Set<String> solidLabels) {
        this.solidLabels = solidLabels != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(solidLabels))
                : Collections.emptySet();
    }

    public boolean isKeepNegativeCoordinates() { return keepNegativeCoordinates; }
    public void setKeepNegativeCoordinates(boolean keep) { this.keepNegativeCoordinates = keep; }

    public double getUnknownTileCost() { return unknownTileCost; }
    public void setUnknownTileCost(double unknownTileCost) { this.unknownTileCost = unknownTileCost; }

    public int getMaxSearchNodes() { return maxSearchNodes; }
    public void setMaxSearchNodes(int maxSearchNodes) { this.maxSearchNodes = maxSearchNodes; }

    public int getHistoryCapacity() { return historyCapacity; }
    public void setHistoryCapacity(int historyCapacity) { this.historyCapacity = historyCapacity; }

    public long getSettleMinMs() { return settleMinMs; }
    public void setSettleMinMs(long settleMinMs) { this.settleMinMs = settleMinMs; }

    public long getSettleTimeoutMs() { return settleTimeoutMs; }
    public void setSettleTimeoutMs(long settleTimeoutMs) { this.settleTimeoutMs = settleTimeoutMs; }

    public long getPollIntervalMs() { return pollIntervalMs; }
    public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }

    public int getStablePolls() { return stablePolls; }
    public void setStablePolls(int stablePolls) { this.stablePolls = stablePolls; }

    public long getDialogueWindowMs() { return dialogueWindowMs; }
    public void setDialogueWindowMs(long dialogueWindowMs) { this.dialogueWindowMs = dialogueWindowMs; }

    public int getSaveIntervalCycles() { return saveIntervalCycles; }
    public void setSaveIntervalCycles(int saveIntervalCycles) { this.saveIntervalCycles = saveIntervalCycles; }

    public Path getDataDirectory() { return dataDirectory; }
    public void setDataDirectory(Path dataDirectory) { this.dataDirectory = dataDirectory; }
}
