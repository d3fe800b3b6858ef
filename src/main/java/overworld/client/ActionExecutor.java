package overworld.client;

import overworld.domain.Button;

/**
 * Issues a button press. Fire-and-forget: the effect is observed by polling
 * the {@link PositionReader} afterwards.
 */
public interface ActionExecutor {

    /**
     * @return false if the press could not be issued at all
     */
    boolean execute(Button button);
}
