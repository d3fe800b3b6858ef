package overworld.client;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import overworld.domain.AgentSnapshot;
import overworld.domain.AreaId;
import overworld.domain.Button;
import overworld.domain.Coordinate;
import overworld.domain.Direction;
import overworld.domain.PlanStep;
import overworld.domain.TraversalStatus;
import overworld.graph.ConnectivityGraph;
import overworld.map.AreaMap;
import overworld.map.LabeledCell;
import overworld.outcome.ActionOutcome;
import overworld.persistence.AreaMapStore;
import overworld.persistence.ConnectionStore;
import overworld.persistence.JsonStore;
import overworld.planning.NavConfig;
import overworld.planning.PathPlanner.PathResult;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class NavigationEngineTest {

    private static final AreaId TOWN = AreaId.of(3, 0);
    private static final AreaId HOUSE = AreaId.of(4, 1);

    @TempDir
    Path dataDir;

    @Mock
    private VisionClassifier vision;

    @Mock
    private PositionReader positions;

    @Mock
    private ActionExecutor executor;

    @Mock
    private DecisionSource decisions;

    private NavConfig config;

    @BeforeEach
    void setUp() {
        config = NavConfig.defaults();
        config.setDataDirectory(dataDir);
        lenient().when(vision.classify()).thenReturn(grassWindow());
        lenient().when(executor.execute(any())).thenReturn(true);
    }

    private NavigationEngine newEngine() {
        return new NavigationEngine(config, vision, positions, executor, decisions,
                ms -> { }, new PrintStream(new ByteArrayOutputStream()));
    }

    private static List<LabeledCell> grassWindow() {
        List<LabeledCell> cells = new ArrayList<>();
        for (int r = 0; r < NavConfig.DEFAULT_WINDOW_ROWS; r++) {
            for (int c = 0; c < NavConfig.DEFAULT_WINDOW_COLS; c++) {
                cells.add(new LabeledCell(r, c, "grass"));
            }
        }
        return cells;
    }

    @Test
    void testMoveCycleUpdatesMap() {
        when(positions.read()).thenReturn(
                AgentSnapshot.at(TOWN, 5, 5, Direction.RIGHT),
                AgentSnapshot.at(TOWN, 6, 5, Direction.RIGHT));
        when(decisions.decide(any())).thenReturn(Button.RIGHT);
        NavigationEngine engine = newEngine();

        CycleResult result = engine.runCycle();

        assertEquals(CycleResult.Status.COMPLETED, result.status);
        assertEquals(ActionOutcome.moved(Coordinate.of(5, 5), Coordinate.of(6, 5)), result.outcome);
        assertEquals(SettleWaiter.Status.STABILIZED, result.settleStatus);
        AreaMap map = engine.currentMap();
        assertEquals(TraversalStatus.WALKABLE, map.getTraversal(Coordinate.of(5, 5)));
        assertEquals(TraversalStatus.PLAYER, map.getTraversal(Coordinate.of(6, 5)));
        assertEquals("grass", map.getTerrain(Coordinate.of(12, 9)));
        assertEquals(1, engine.getCompletedCycles());
        verify(executor).execute(Button.RIGHT);
    }

    @Test
    void testDecisionSeesViewOfCurrentArea() {
        when(positions.read()).thenReturn(AgentSnapshot.at(TOWN, 5, 5, Direction.DOWN));
        when(decisions.decide(any())).thenReturn(Button.WAIT);
        NavigationEngine engine = newEngine();

        engine.runCycle();

        ArgumentCaptor<NavigationView> captor = ArgumentCaptor.forClass(NavigationView.class);
        verify(decisions).decide(captor.capture());
        NavigationView view = captor.getValue();
        assertEquals(Coordinate.of(5, 5), view.agent.position);
        assertEquals(1, view.cycle);
        assertNull(view.lastOutcome);
        assertEquals(Direction.UP, view.suggestion.suggested);
        assertEquals(2 * NavConfig.VIEW_HALF_HEIGHT + 1, view.getTraversalRows().size());
    }

    @Test
    void testAreaChangeRecordsConnectionAndSaves() {
        when(positions.read()).thenReturn(
                AgentSnapshot.at(TOWN, 5, 5, Direction.UP),
                AgentSnapshot.at(HOUSE, 2, 7, Direction.UP));
        when(decisions.decide(any())).thenReturn(Button.UP);
        NavigationEngine engine = newEngine();

        CycleResult result = engine.runCycle();

        assertEquals(ActionOutcome.Type.AREA_CHANGED, result.outcome.type);
        assertEquals(SettleWaiter.Status.AREA_CHANGED, result.settleStatus);
        assertEquals(HOUSE, engine.currentMap().getAreaId());
        assertEquals(2, engine.getGraph().connectionCount());
        assertEquals(TraversalStatus.TRANSITION_EDGE,
                engine.getMaps().get(TOWN).getTraversal(Coordinate.of(5, 4)));
        assertTrue(Files.exists(dataDir.resolve(ConnectionStore.FILE_NAME)));
        assertTrue(Files.exists(dataDir.resolve(AreaMapStore.fileNameFor(TOWN))));
    }

    @Test
    void testUnreadablePositionSkipsCycle() {
        when(positions.read()).thenReturn(null);
        NavigationEngine engine = newEngine();

        CycleResult result = engine.runCycle();

        assertEquals(CycleResult.Status.SKIPPED, result.status);
        assertNull(engine.currentMap());
        assertEquals(0, engine.getCompletedCycles());
        verifyNoInteractions(decisions, executor);
    }

    @Test
    void testNonNavigableScreenSkipsCycle() {
        when(positions.read()).thenReturn(
                new AgentSnapshot(TOWN, "Town", Coordinate.of(5, 5), Direction.UP, false, false));
        NavigationEngine engine = newEngine();

        assertEquals(CycleResult.Status.SKIPPED, engine.runCycle().status);
        verifyNoInteractions(decisions, executor);
    }

    @Test
    void testInterruptedSettleLeavesMapUntouched() {
        when(positions.read()).thenReturn(
                AgentSnapshot.at(TOWN, 5, 5, Direction.LEFT),
                new AgentSnapshot(TOWN, null, Coordinate.of(5, 5), Direction.LEFT, false, false));
        when(decisions.decide(any())).thenReturn(Button.LEFT);
        NavigationEngine engine = newEngine();

        CycleResult result = engine.runCycle();

        assertEquals(CycleResult.Status.ABORTED, result.status);
        assertEquals(TraversalStatus.UNKNOWN, engine.currentMap().getTraversal(Coordinate.of(4, 5)));
        assertEquals(0, engine.getCompletedCycles());
        assertNull(engine.getLastOutcome());
    }

    @Test
    void testBlockedStepMarksTile() {
        when(positions.read()).thenReturn(AgentSnapshot.at(TOWN, 5, 5, Direction.LEFT));
        when(decisions.decide(any())).thenReturn(Button.LEFT);
        NavigationEngine engine = newEngine();

        CycleResult result = engine.runCycle();

        assertEquals(ActionOutcome.Type.BLOCKED, result.outcome.type);
        assertEquals(TraversalStatus.BLOCKED, engine.currentMap().getTraversal(Coordinate.of(4, 5)));
    }

    @Test
    void testMalformedObservationStillCompletesCycle() {
        when(vision.classify()).thenReturn(List.of(new LabeledCell(0, 0, "grass")));
        when(positions.read()).thenReturn(AgentSnapshot.at(TOWN, 5, 5, Direction.UP));
        when(decisions.decide(any())).thenReturn(null);
        NavigationEngine engine = newEngine();

        CycleResult result = engine.runCycle();

        assertEquals(CycleResult.Status.COMPLETED, result.status);
        assertEquals(Button.WAIT, result.action);
        assertSame(ActionOutcome.WAITED, result.outcome);
        assertTrue(engine.currentMap().terrainGrid().isEmpty());
        verify(executor, never()).execute(any());
    }

    @Test
    void testFailedExecuteIsUnknownOutcome() {
        when(positions.read()).thenReturn(AgentSnapshot.at(TOWN, 5, 5, Direction.UP));
        when(decisions.decide(any())).thenReturn(Button.UP);
        when(executor.execute(Button.UP)).thenReturn(false);
        NavigationEngine engine = newEngine();

        CycleResult result = engine.runCycle();

        assertEquals(ActionOutcome.Type.UNKNOWN, result.outcome.type);
        assertEquals(TraversalStatus.UNKNOWN, engine.currentMap().getTraversal(Coordinate.of(5, 4)));
    }

    @Test
    void testStoredConnectionsLoadedAtStartup() {
        ConnectivityGraph stored = new ConnectivityGraph();
        stored.addConnection(TOWN, Coordinate.of(5, 4), HOUSE, Coordinate.of(2, 7), Direction.UP);
        new ConnectionStore(new JsonStore(dataDir)).save(stored);

        NavigationEngine engine = newEngine();

        assertEquals(2, engine.getGraph().connectionCount());
    }

    @Test
    void testPeriodicSave() {
        config.setSaveIntervalCycles(1);
        when(positions.read()).thenReturn(AgentSnapshot.at(TOWN, 5, 5, Direction.UP));
        when(decisions.decide(any())).thenReturn(Button.WAIT);
        NavigationEngine engine = newEngine();

        engine.runCycle();

        assertTrue(Files.exists(dataDir.resolve(AreaMapStore.fileNameFor(TOWN))));
    }

    @Test
    void testRunSavesOnShutdown() {
        when(positions.read()).thenReturn(AgentSnapshot.at(TOWN, 5, 5, Direction.UP));
        when(decisions.decide(any())).thenReturn(Button.WAIT);
        NavigationEngine engine = newEngine();

        assertEquals(3, engine.run(3));

        assertTrue(Files.exists(dataDir.resolve(AreaMapStore.fileNameFor(TOWN))));
        assertTrue(Files.exists(dataDir.resolve(ConnectionStore.FILE_NAME)));
    }

    @Test
    void testPlanRouteToNeighbouringArea() {
        ConnectivityGraph stored = new ConnectivityGraph();
        stored.addConnection(TOWN, Coordinate.of(5, 4), HOUSE, Coordinate.of(2, 7), Direction.UP);
        new ConnectionStore(new JsonStore(dataDir)).save(stored);
        when(positions.read()).thenReturn(AgentSnapshot.at(TOWN, 5, 5, Direction.DOWN));
        when(decisions.decide(any())).thenReturn(Button.WAIT);
        NavigationEngine engine = newEngine();
        engine.runCycle();

        PathResult route = engine.planRouteTo(HOUSE);

        assertTrue(route.isFound());
        assertEquals(List.of(PlanStep.turn(Direction.UP), PlanStep.move(Direction.UP)), route.steps);
        assertTrue(engine.planRouteTo(TOWN).steps.isEmpty());
        assertFalse(engine.planRouteTo(AreaId.of(9, 9)).isFound());
    }

    @Test
    void testPlanningBeforeFirstReadingFindsNothing() {
        NavigationEngine engine = newEngine();

        assertFalse(engine.planPath(Coordinate.of(1, 1)).isFound());
        assertFalse(engine.planRouteTo(HOUSE).isFound());
    }
}
