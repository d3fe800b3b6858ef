package overworld.map;

/**
 * Thrown when a classifier observation does not describe a complete window
 * of the expected size.
 */
public class MalformedObservationException extends Exception {

    public MalformedObservationException(String message) {
        super(message);
    }
}
