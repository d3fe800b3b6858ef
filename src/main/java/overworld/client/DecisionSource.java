package overworld.client;

import overworld.domain.Button;

/**
 * Chooses the next action from what the engine knows. The engine does not
 * check the choice beyond the button set itself.
 */
public interface DecisionSource {

    /**
     * @return the button to press; null is treated as WAIT
     */
    Button decide(NavigationView view);
}
