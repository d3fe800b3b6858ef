package overworld.client;

import overworld.domain.AgentSnapshot;
import overworld.domain.AreaId;
import overworld.domain.Button;
import overworld.domain.Coordinate;
import overworld.explore.DirectionSuggestion;
import overworld.explore.ExplorationAdvisor;
import overworld.explore.PositionHistory;
import overworld.graph.AreaConnection;
import overworld.graph.ConnectivityGraph;
import overworld.map.AreaMap;
import overworld.map.MalformedObservationException;
import overworld.map.MapWindow;
import overworld.map.Observation;
import overworld.map.ObservationMerger;
import overworld.outcome.ActionOutcome;
import overworld.outcome.ActiveArea;
import overworld.outcome.OutcomeClassifier;
import overworld.outcome.TraversalUpdater;
import overworld.persistence.AreaMapRepository;
import overworld.persistence.AreaMapStore;
import overworld.persistence.ConnectionStore;
import overworld.persistence.JsonStore;
import overworld.planning.AStarPathPlanner;
import overworld.planning.NavConfig;
import overworld.planning.PathPlanner;
import overworld.planning.PathPlanner.PathResult;

import java.io.PrintStream;
import java.util.List;

/**
 * The decision loop: one cycle observes, lets the decision source pick an
 * action, issues it, waits for the agent to settle, classifies what happened
 * and updates the map.
 *
 * Cycle order:
 * 1. Read the agent; skip the cycle if unreadable or not in the overworld
 * 2. Merge the vision observation into the current area map
 * 3. Record the position and ask the advisor for a suggestion
 * 4. Ask the decision source for a button and issue it
 * 5. Wait for the agent to settle; abort untouched if interrupted
 * 6. Classify the outcome and apply it
 * 7. Save everything every {@code saveIntervalCycles} completed cycles
 *
 * Single threaded; cycles never overlap. Nothing in a cycle throws on bad
 * input or failed persistence, it only logs and gains no information.
 */
public class NavigationEngine {

    /** Configuration */
    private final NavConfig config;

    /** External collaborators */
    private final VisionClassifier vision;
    private final PositionReader positions;
    private final ActionExecutor executor;
    private final DecisionSource decisions;

    /** Debug output stream */
    private final PrintStream debugOut;

    private final AreaMapRepository maps;
    private final ConnectivityGraph graph;
    private final ConnectionStore connectionStore;
    private final ObservationMerger merger;
    private final PositionHistory history;
    private final ExplorationAdvisor advisor;
    private final PathPlanner planner;
    private final SettleWaiter settleWaiter;

    /** Created on the first successful reading */
    private ActiveArea activeArea;
    private TraversalUpdater updater;

    private AgentSnapshot lastSnapshot;
    private ActionOutcome lastOutcome;
    private int completedCycles = 0;

    /**
     * Creates an engine storing its data under {@link NavConfig#getDataDirectory()}.
     */
    public NavigationEngine(NavConfig config, VisionClassifier vision, PositionReader positions,
                            ActionExecutor executor, DecisionSource decisions) {
        this(config, vision, positions, executor, decisions, Sleeper.SYSTEM, System.err);
    }

    /**
     * Creates an engine with a custom sleeper and debug stream (for testing).
     */
    public NavigationEngine(NavConfig config, VisionClassifier vision, PositionReader positions,
                            ActionExecutor executor, DecisionSource decisions,
                            Sleeper sleeper, PrintStream debugOut) {
        this.config = config;
        this.vision = vision;
        this.positions = positions;
        this.executor = executor;
        this.decisions = decisions;
        this.debugOut = debugOut;

        JsonStore store = new JsonStore(config.getDataDirectory());
        this.maps = new AreaMapRepository(new AreaMapStore(store));
        this.connectionStore = new ConnectionStore(store);
        this.graph = new ConnectivityGraph();
        this.merger = new ObservationMerger(config);
        this.history = new PositionHistory(config.getHistoryCapacity());
        this.advisor = new ExplorationAdvisor(history);
        this.planner = new AStarPathPlanner(config);
        this.settleWaiter = new SettleWaiter(positions, sleeper, config);

        int restored = connectionStore.loadInto(graph);
        logNormal("[Engine] Data in " + config.getDataDirectory() + ", " + restored + " stored connections");
    }

    // ========== Accessors ==========

    public ConnectivityGraph getGraph() { return graph; }

    public AreaMapRepository getMaps() { return maps; }

    public PositionHistory getHistory() { return history; }

    public ActionOutcome getLastOutcome() { return lastOutcome; }

    public int getCompletedCycles() { return completedCycles; }

    /**
     * @return the current area's map, or null before the first successful reading
     */
    public AreaMap currentMap() {
        return activeArea != null ? activeArea.current() : null;
    }

    // ========== Loop ==========

    /**
     * Runs up to {@code maxCycles} cycles, then saves everything.
     *
     * @return number of cycles that completed
     */
    public int run(int maxCycles) {
        int completed = 0;
        for (int i = 0; i < maxCycles; i++) {
            if (Thread.currentThread().isInterrupted()) {
                logNormal("[Engine] Interrupted, stopping after " + i + " cycles");
                break;
            }
            if (runCycle().status == CycleResult.Status.COMPLETED) {
                completed++;
            }
        }
        shutdown();
        return completed;
    }

    /**
     * Runs one decision cycle.
     */
    public CycleResult runCycle() {
        // 1. Read the agent
        AgentSnapshot before = positions.read();
        if (before == null || !before.isComplete()) {
            logNormal("[Engine] Unreadable position, skipping cycle");
            return CycleResult.skipped("unreadable position");
        }
        if (!before.navigable) {
            logVerbose("[Engine] Not navigable, skipping cycle: " + before);
            return CycleResult.skipped("not navigable");
        }
        enterOrSync(before);
        lastSnapshot = before;
        AreaMap map = activeArea.current();

        // 2. Observe
        observe(map, before);

        // 3. Advise
        history.record(before.areaId, before.position);
        DirectionSuggestion suggestion = advisor.suggest(map, before.position);

        // 4. Decide and act
        NavigationView view = buildView(map, before, suggestion);
        Button action = decisions.decide(view);
        if (action == null) {
            action = Button.WAIT;
        }
        logVerbose("[Engine] Cycle " + (completedCycles + 1) + ": " + suggestion + " -> " + action);

        if (action != Button.WAIT && !executor.execute(action)) {
            logNormal("[Engine] Failed to issue " + action);
            ActionOutcome outcome = ActionOutcome.unknown("execute failed for " + action);
            return finishCycle(action, outcome, null);
        }

        // 5. Settle
        AgentSnapshot after = before;
        boolean dialogue = false;
        SettleWaiter.Status settleStatus = SettleWaiter.Status.STABILIZED;
        if (action != Button.WAIT) {
            SettleWaiter.SettleResult settle = settleWaiter.await(before);
            settleStatus = settle.status;
            if (settle.status == SettleWaiter.Status.INTERRUPTED) {
                logNormal("[Engine] " + action + " interrupted: " + settle.snapshot);
                return CycleResult.aborted(action, settle.status, "interrupted while settling");
            }
            if (settle.status == SettleWaiter.Status.TIMED_OUT) {
                logNormal("[Engine] " + action + " did not settle within " + config.getSettleTimeoutMs() + "ms");
            }
            after = settle.snapshot;
            dialogue = settle.dialogueSeen;
            if (!dialogue && (action.isDirectional() || action == Button.A)) {
                dialogue = settleWaiter.watchForDialogue();
            }
        }

        // 6. Classify and apply
        ActionOutcome outcome = OutcomeClassifier.classify(action, before, after, dialogue);
        updater.apply(outcome);
        if (after != null && after.isComplete()) {
            lastSnapshot = after;
        }
        return finishCycle(action, outcome, settleStatus);
    }

    /**
     * Saves every map and the connection graph.
     */
    public void shutdown() {
        int saved = maps.saveAll();
        boolean connections = connectionStore.save(graph);
        logNormal("[Engine] Saved " + saved + "/" + maps.size() + " maps"
                + (connections ? ", connections" : ", connections FAILED"));
    }

    // ========== Planning ==========

    /**
     * Plans a route to a tile in the current area from the last reading.
     */
    public PathResult planPath(Coordinate goal) {
        if (activeArea == null || lastSnapshot == null) {
            return PathResult.noPath(0);
        }
        return planner.findPath(activeArea.current(), lastSnapshot.position, lastSnapshot.facing, goal);
    }

    /**
     * Plans a route to the exit that starts the shortest known area path to
     * {@code target}. When several exits lead there, the cheapest to reach wins.
     */
    public PathResult planRouteTo(AreaId target) {
        if (activeArea == null || lastSnapshot == null) {
            return PathResult.noPath(0);
        }
        if (activeArea.areaId().equals(target)) {
            return PathResult.success(List.of(), 0, 0);
        }

        List<AreaConnection> exits = graph.exitsTowards(activeArea.areaId(), target);
        PathResult best = null;
        for (AreaConnection exit : exits) {
            PathResult result = planPath(exit.fromCoord);
            if (result.isFound() && (best == null || result.cost < best.cost)) {
                best = result;
            }
        }
        if (best == null) {
            logVerbose("[Engine] No route from " + activeArea.areaId() + " to " + target
                    + " (" + exits.size() + " candidate exits)");
            return PathResult.noPath(0);
        }
        return best;
    }

    // ========== Internal Helpers ==========

    private void enterOrSync(AgentSnapshot snapshot) {
        if (activeArea == null) {
            AreaMap map = maps.getOrCreate(snapshot.areaId, snapshot.areaName);
            map.recordVisit();
            map.placePlayer(snapshot.position);
            activeArea = new ActiveArea(map);
            updater = new TraversalUpdater(activeArea, maps, graph, connectionStore);
            logNormal("[Engine] Starting in " + map.summary());
            return;
        }
        updater.syncTo(snapshot);
    }

    private void observe(AreaMap map, AgentSnapshot agent) {
        try {
            Observation observation = Observation.fromCells(vision.classify(),
                    config.getWindowRows(), config.getWindowCols(), config.getAgentRow(), config.getAgentCol());
            merger.merge(map, observation, agent.position);
        } catch (MalformedObservationException e) {
            logNormal("[Engine] Observation rejected: " + e.getMessage());
        }
    }

    private NavigationView buildView(AreaMap map, AgentSnapshot agent, DirectionSuggestion suggestion) {
        MapWindow window = map.window(agent.position, NavConfig.VIEW_HALF_WIDTH, NavConfig.VIEW_HALF_HEIGHT);
        return new NavigationView(agent, map.getDisplayName(), window, suggestion,
                graph.connectionsFrom(map.getAreaId()), lastOutcome, completedCycles + 1);
    }

    private CycleResult finishCycle(Button action, ActionOutcome outcome, SettleWaiter.Status settleStatus) {
        lastOutcome = outcome;
        completedCycles++;
        logVerbose("[Engine] " + action + " -> " + outcome);

        if (config.getSaveIntervalCycles() > 0 && completedCycles % config.getSaveIntervalCycles() == 0) {
            int saved = maps.saveAll();
            connectionStore.save(graph);
            logVerbose("[Engine] Periodic save: " + saved + " maps");
        }
        return CycleResult.completed(action, outcome, settleStatus);
    }

    private void logNormal(String msg) {
        if (NavConfig.isNormal())
            debugOut.println(msg);
    }

    private void logVerbose(String msg) {
        if (NavConfig.isVerbose())
            debugOut.println(msg);
    }
}
