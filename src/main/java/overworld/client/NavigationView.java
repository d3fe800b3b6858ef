package overworld.client;

import overworld.domain.AgentSnapshot;
import overworld.explore.DirectionSuggestion;
import overworld.graph.AreaConnection;
import overworld.map.MapWindow;
import overworld.outcome.ActionOutcome;

import java.util.List;

/**
 * Read-only picture handed to the {@link DecisionSource} each cycle: the
 * agent's reading, both grids around it, the advisor's suggestion, the known
 * exits of the current area and what the previous action did.
 */
public final class NavigationView {

    public final AgentSnapshot agent;
    public final String areaName;
    public final MapWindow window;
    public final DirectionSuggestion suggestion;
    public final List<AreaConnection> connections;
    /** Outcome of the previous cycle, null on the first cycle */
    public final ActionOutcome lastOutcome;
    public final int cycle;

    public NavigationView(AgentSnapshot agent, String areaName, MapWindow window, DirectionSuggestion suggestion,
                          List<AreaConnection> connections, ActionOutcome lastOutcome, int cycle) {
        this.agent = agent;
        this.areaName = areaName;
        this.window = window;
        this.suggestion = suggestion;
        this.connections = List.copyOf(connections);
        this.lastOutcome = lastOutcome;
        this.cycle = cycle;
    }

    public List<String> getTraversalRows() {
        return window.getTraversalRows();
    }

    public List<List<String>> getTerrainRows() {
        return window.getTerrainRows();
    }

    public boolean isStuck() {
        return suggestion.stuck;
    }

    /**
     * Multi-line text form, one traversal row per line, for prompts and logs.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Area: ").append(areaName).append(" (").append(agent.areaId).append(")\n");
        sb.append("Position: ").append(agent.position)
                .append(" facing ").append(agent.facing != null ? agent.facing.displayName() : "?").append('\n');
        for (String row : window.getTraversalRows()) {
            sb.append(row).append('\n');
        }
        sb.append(suggestion).append('\n');
        for (AreaConnection connection : connections) {
            sb.append("Exit: ").append(connection).append('\n');
        }
        if (lastOutcome != null) {
            sb.append("Last: ").append(lastOutcome).append('\n');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "NavigationView[cycle " + cycle + ", " + agent + ", " + suggestion + "]";
    }
}
